package com.albatross.adapter.in.websocket;

import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.domain.model.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the caller before the upgrade. The token comes from a bearer header or the {@code api_key} query parameter.
 */
public class CredentialHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CredentialHandshakeInterceptor.class);

    public static final String IDENTITY_ATTRIBUTE = "albatross.identity";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String API_KEY_PARAM = "api_key";

    private final CredentialStore credentialStore;

    public CredentialHandshakeInterceptor(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        String token = extractToken(request);
        if (token == null) {
            log.warn("Realtime handshake without credentials: remote={}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        Optional<AuthenticatedUser> identity;
        try {
            identity = credentialStore.resolve(token);
        } catch (CredentialStoreException e) {
            log.error("Credential lookup failed during realtime handshake", e);
            response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
            return false;
        }
        if (identity.isEmpty()) {
            log.warn("Realtime handshake with unknown token: remote={}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        attributes.put(IDENTITY_ATTRIBUTE, identity.get());
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception) {
        if (exception != null) {
            log.warn("Realtime handshake failed: {}", exception.getMessage());
        }
    }

    private static String extractToken(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String apiKey = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(API_KEY_PARAM);
        return apiKey == null || apiKey.isBlank() ? null : apiKey;
    }
}
