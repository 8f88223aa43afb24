package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import com.warden.observability.RequestContext;
import com.warden.security.AuthException;
import com.warden.security.apikey.ApiKey;
import com.warden.security.apikey.ApiKeyEngine;
import com.warden.security.apikey.ApiKeyRequest;
import com.warden.security.apikey.ApiKeyStatus;
import com.warden.security.apikey.ApiKeyUpdate;
import com.warden.security.apikey.CreatedApiKey;
import com.warden.security.edge.SecurityContext;
import com.warden.security.ratelimit.WindowType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * API key self-service. Keys are always owned by the calling user; an API key cannot manage
 * other keys.
 *
 * <p>The raw key is returned once, by create and rotate.
 */
@RestController
@RequestMapping("/api/v1/api-keys")
public class ApiKeyController {

    private final ApiKeyEngine apiKeys;

    public ApiKeyController(ApiKeyEngine apiKeys) {
        this.apiKeys = apiKeys;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedKeyView create(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @Valid @RequestBody CreateKeyRequest request) {
        String userId = SessionController.userOf(security);
        CreatedApiKey created = apiKeys.createApiKey(context, userId, request.toRequest(security.tenantId()));
        return CreatedKeyView.of(created);
    }

    @GetMapping
    public List<ApiKeyView> list(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return apiKeys.listApiKeys(SessionController.userOf(security), includeInactive).stream()
                .map(ApiKeyView::of)
                .toList();
    }

    @GetMapping("/{keyId}")
    public ApiKeyView get(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @PathVariable String keyId) {
        return apiKeys.getApiKey(keyId, SessionController.userOf(security))
                .map(ApiKeyView::of)
                .orElseThrow(() -> AuthException.invalidRequest("API key not found"));
    }

    @PatchMapping("/{keyId}")
    public ApiKeyView update(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String keyId,
            @RequestBody ApiKeyUpdate update) {
        return ApiKeyView.of(apiKeys.updateApiKey(context, keyId, SessionController.userOf(security), update));
    }

    @PostMapping("/{keyId}/rotate")
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedKeyView rotate(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String keyId) {
        return CreatedKeyView.of(apiKeys.rotateApiKey(context, keyId, SessionController.userOf(security)));
    }

    @PostMapping("/{keyId}/suspend")
    public ApiKeyView suspend(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String keyId) {
        return ApiKeyView.of(apiKeys.suspendApiKey(context, keyId, SessionController.userOf(security)));
    }

    @PostMapping("/{keyId}/reactivate")
    public ApiKeyView reactivate(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String keyId) {
        return ApiKeyView.of(apiKeys.reactivateApiKey(context, keyId, SessionController.userOf(security)));
    }

    @DeleteMapping("/{keyId}")
    public ApiKeyView revoke(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String keyId) {
        return ApiKeyView.of(apiKeys.revokeApiKey(context, keyId, SessionController.userOf(security)));
    }

    /**
     * @param expiresIn ISO-8601 duration, nullable for the default lifetime
     */
    public record CreateKeyRequest(
            @NotBlank String name,
            String description,
            @NotEmpty List<String> scopes,
            Duration expiresIn,
            Integer rateLimitRequests,
            WindowType rateLimitWindow,
            List<String> allowedIps,
            Boolean requireHttps) {

        ApiKeyRequest toRequest(String tenantId) {
            return new ApiKeyRequest(name, description, scopes, tenantId, expiresIn, rateLimitRequests,
                    rateLimitWindow, allowedIps, requireHttps);
        }
    }

    /** Public view of a key; never includes the hash. */
    public record ApiKeyView(
            String keyId,
            String keyPrefix,
            String name,
            String description,
            List<String> scopes,
            ApiKeyStatus status,
            int rateLimitRequests,
            WindowType rateLimitWindow,
            List<String> allowedIps,
            boolean requireHttps,
            Instant createdAt,
            Instant expiresAt,
            Instant lastUsed,
            long totalRequests,
            long failedRequests,
            String rotatedFrom) {

        static ApiKeyView of(ApiKey key) {
            return new ApiKeyView(key.keyId(), key.keyPrefix(), key.name(), key.description(), key.scopes(),
                    key.status(), key.rateLimitRequests(), key.rateLimitWindow(), key.allowedIps(),
                    key.requireHttps(), key.createdAt(), key.expiresAt(), key.lastUsed(), key.totalRequests(),
                    key.failedRequests(), key.rotatedFrom());
        }
    }

    public record CreatedKeyView(String apiKey, ApiKeyView key) {

        static CreatedKeyView of(CreatedApiKey created) {
            return new CreatedKeyView(created.rawKey(), ApiKeyView.of(created.key()));
        }
    }
}
