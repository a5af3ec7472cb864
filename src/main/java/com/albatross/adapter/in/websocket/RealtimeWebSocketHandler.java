package com.albatross.adapter.in.websocket;

import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.NotificationSubscriber;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.infrastructure.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Routes container callbacks to the {@link RealtimeConnection} of each session.
 */
public class RealtimeWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

    private final Map<String, RealtimeConnection> connections = new ConcurrentHashMap<>();

    private final AppProperties.Realtime settings;
    private final ObjectMapper objectMapper;
    private final NotificationSubscriber notificationSubscriber;
    private final TaskScheduler scheduler;
    private final Executor forwardExecutor;
    private final MetricsPort metrics;

    public RealtimeWebSocketHandler(
            AppProperties.Realtime settings,
            ObjectMapper objectMapper,
            NotificationSubscriber notificationSubscriber,
            TaskScheduler scheduler,
            Executor forwardExecutor,
            MetricsPort metrics) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.notificationSubscriber = notificationSubscriber;
        this.scheduler = scheduler;
        this.forwardExecutor = forwardExecutor;
        this.metrics = metrics;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object identity = session.getAttributes().get(CredentialHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        if (!(identity instanceof AuthenticatedUser user)) {
            log.warn("Realtime session without identity: sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        RealtimeConnection connection = new RealtimeConnection(
            session, user, settings, objectMapper, notificationSubscriber, scheduler, forwardExecutor, metrics);
        connections.put(session.getId(), connection);
        connection.start();
        metrics.incrementRealtimeConnections();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        RealtimeConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.handleText(message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        RealtimeConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.handleBinary();
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        RealtimeConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.touch();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Realtime transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
        RealtimeConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        RealtimeConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.shutdown();
        }
        log.debug("Realtime session ended: sessionId={}, status={}", session.getId(), status);
    }

    int activeConnections() {
        return connections.size();
    }
}
