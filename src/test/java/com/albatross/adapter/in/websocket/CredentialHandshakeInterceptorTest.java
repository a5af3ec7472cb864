package com.albatross.adapter.in.websocket;

import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CredentialHandshakeInterceptor")
class CredentialHandshakeInterceptorTest {

    private static final AuthenticatedUser PILOT = new AuthenticatedUser("u-1", "t-1", Role.PILOT);

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private WebSocketHandler handler;

    private CredentialHandshakeInterceptor interceptor;
    private MockHttpServletRequest servletRequest;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        interceptor = new CredentialHandshakeInterceptor(credentialStore);
        servletRequest = new MockHttpServletRequest("GET", "/ws");
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake() throws IOException {
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest), response, handler, attributes);
        response.flush();
        return accepted;
    }

    @Test
    @DisplayName("Should resolve a bearer token into the session attributes")
    void shouldAcceptBearer() throws IOException {
        // Given
        servletRequest.addHeader("Authorization", "Bearer tok-1");
        when(credentialStore.resolve("tok-1")).thenReturn(Optional.of(PILOT));

        // When / Then
        assertTrue(handshake());
        assertEquals(PILOT, attributes.get(CredentialHandshakeInterceptor.IDENTITY_ATTRIBUTE));
    }

    @Test
    @DisplayName("Should accept the api_key query parameter")
    void shouldAcceptQueryParameter() throws IOException {
        // Given
        servletRequest.setQueryString("api_key=tok-2");
        when(credentialStore.resolve("tok-2")).thenReturn(Optional.of(PILOT));

        // When / Then
        assertTrue(handshake());
    }

    @Test
    @DisplayName("Should refuse a handshake without credentials")
    void shouldRefuseMissingToken() throws IOException {
        // When / Then
        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
        verifyNoInteractions(credentialStore);
    }

    @Test
    @DisplayName("Should refuse an unknown token")
    void shouldRefuseUnknownToken() throws IOException {
        // Given
        servletRequest.addHeader("Authorization", "Bearer stale");
        when(credentialStore.resolve("stale")).thenReturn(Optional.empty());

        // When / Then
        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
    }

    @Test
    @DisplayName("Should answer 503 when the credential store is down")
    void shouldReportStoreOutage() throws IOException {
        // Given
        servletRequest.addHeader("Authorization", "Bearer tok-1");
        when(credentialStore.resolve(anyString())).thenThrow(new CredentialStoreException("redis down", null));

        // When / Then
        assertFalse(handshake());
        assertEquals(503, servletResponse.getStatus());
    }
}
