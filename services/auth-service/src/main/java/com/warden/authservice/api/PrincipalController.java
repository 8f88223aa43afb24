package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import com.warden.security.edge.PrincipalType;
import com.warden.security.edge.SecurityContext;
import com.warden.security.edge.SensitivityTier;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tells any authenticated caller how the edge identified it, together with the serialized
 * context a downstream service would receive.
 */
@RestController
public class PrincipalController {

    @GetMapping("/api/v1/me")
    public PrincipalView me(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(name = EdgeAuthorityFilter.FORWARDED_CONTEXT_ATTRIBUTE, required = false)
                    String forwarded) {
        boolean mfaVerified = security.mfa() != null && security.mfa().verified();
        return new PrincipalView(security.principalType(), security.subject(), security.tenantId(),
                security.roles(), security.scopes(), security.tier(), mfaVerified, forwarded);
    }

    public record PrincipalView(
            PrincipalType principalType,
            String subject,
            String tenantId,
            Set<String> roles,
            Set<String> scopes,
            SensitivityTier tier,
            boolean mfaVerified,
            String forwardedContext) {
    }
}
