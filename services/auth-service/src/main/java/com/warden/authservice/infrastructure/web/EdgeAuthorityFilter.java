package com.warden.authservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.observability.MdcScope;
import com.warden.observability.RequestContext;
import com.warden.security.AuthException;
import com.warden.security.edge.EdgeAuthority;
import com.warden.security.edge.EdgeRequest;
import com.warden.security.edge.SecurityContext;
import com.warden.security.edge.SecurityContextSerializer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that authenticates and authorizes every HTTP request before it reaches a
 * controller.
 *
 * <p>For each request the filter:
 *
 * <ol>
 *   <li>propagates {@code X-Correlation-ID} or generates one, and echoes it on the response
 *   <li>opens an {@link MdcScope} so every log line carries the correlation ID
 *   <li>asks {@link EdgeAuthority} for a decision on the route's sensitivity tier
 *   <li>on denial writes an RFC 7807 problem and stops the chain
 *   <li>on success exposes the {@link SecurityContext}, the enriched {@link RequestContext} and
 *       the serialized context (for forwarding downstream) as request attributes
 * </ol>
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so nothing handles an unauthorized request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EdgeAuthorityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(EdgeAuthorityFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String SECURITY_CONTEXT_ATTRIBUTE = "warden.securityContext";
    public static final String REQUEST_CONTEXT_ATTRIBUTE = "warden.requestContext";
    public static final String FORWARDED_CONTEXT_ATTRIBUTE = "warden.forwardedContext";

    private final EdgeAuthority edgeAuthority;
    private final ObjectMapper objectMapper;

    public EdgeAuthorityFilter(EdgeAuthority edgeAuthority, ObjectMapper objectMapper) {
        this.edgeAuthority = edgeAuthority;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        RequestContext context = RequestContext.of(correlationId);

        SecurityContext security;
        try (MdcScope ignored = MdcScope.open(context)) {
            security = edgeAuthority.authorize(context, toEdgeRequest(request));
        } catch (AuthException ex) {
            try (MdcScope ignored = MdcScope.open(context)) {
                log.debug("Rejected {} {}: {}", request.getMethod(), pathOf(request), ex.code());
                writeProblem(response, ex, correlationId);
            }
            return;
        }

        RequestContext enriched = security.applyTo(context);
        request.setAttribute(SECURITY_CONTEXT_ATTRIBUTE, security);
        request.setAttribute(REQUEST_CONTEXT_ATTRIBUTE, enriched);
        if (!security.isAnonymous()) {
            request.setAttribute(FORWARDED_CONTEXT_ATTRIBUTE, SecurityContextSerializer.serialize(security));
        }

        try (MdcScope ignored = MdcScope.open(enriched)) {
            filterChain.doFilter(request, response);
        }
    }

    private EdgeRequest toEdgeRequest(HttpServletRequest request) {
        EdgeRequest.Builder builder = EdgeRequest.builder(request.getMethod(), pathOf(request))
                .remoteAddress(request.getRemoteAddr())
                .secure(request.isSecure());
        for (String name : Collections.list(request.getHeaderNames())) {
            builder.header(name, request.getHeader(name));
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                builder.cookie(cookie.getName(), cookie.getValue());
            }
        }
        return builder.build();
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private void writeProblem(HttpServletResponse response, AuthException ex, String correlationId)
            throws IOException {
        ProblemDetail problem = AuthProblems.toProblem(ex, correlationId);
        response.setStatus(problem.getStatus());
        AuthProblems.headersFor(ex).forEach((name, values) -> values.forEach(v -> response.addHeader(name, v)));
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
