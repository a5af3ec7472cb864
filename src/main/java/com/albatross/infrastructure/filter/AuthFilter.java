package com.albatross.infrastructure.filter;

import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Set<String> PUBLIC_PATHS = Set.of(
        "/actuator",
        "/v3/api-docs",
        "/swagger-ui",
        "/docs.html",
        "/api/v1/login",
        "/api/v1/bootstrap",
        "/ws"
    );

    private final CredentialStore credentialStore;

    public AuthFilter(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        // Allow public paths without auth
        if (isPublicPath(path)) {
            RequestContext.setRequestId(requestId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                RequestContext.clear();
            }
            return;
        }

        String token = extractBearerToken(request);
        if (token == null) {
            log.warn("Missing bearer token for path: {}", path);
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Missing bearer token", requestId);
            return;
        }

        Optional<AuthenticatedUser> identity;
        try {
            identity = credentialStore.resolve(token);
        } catch (CredentialStoreException e) {
            log.error("Credential lookup failed for path: {}", path, e);
            writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "INFRASTRUCTURE_ERROR",
                "Credential store unavailable", requestId);
            return;
        }

        if (identity.isEmpty()) {
            log.warn("Unknown or expired token for path: {}", path);
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Invalid or expired token", requestId);
            return;
        }

        AuthenticatedUser user = identity.get();
        RequestContext.set(user, requestId);
        log.debug("Request authenticated: userId={}, role={}, requestId={}, path={}",
            user.userId(), user.role().label(), requestId, path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean isPublicPath(String path) {
        return PUBLIC_PATHS.stream().anyMatch(path::startsWith);
    }

    private static String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader(AUTHORIZATION_HEADER);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static void writeError(
            HttpServletResponse response, int status, String error, String message, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write(
            "{\"error\":\"" + error + "\",\"message\":\"" + message + "\",\"requestId\":\"" + requestId + "\"}"
        );
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
