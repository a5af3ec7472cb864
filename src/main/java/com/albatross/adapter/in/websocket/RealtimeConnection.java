package com.albatross.adapter.in.websocket;

import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.NotificationSubscriber;
import com.albatross.domain.authz.ChannelAuthorizer;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.infrastructure.config.AppProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * State of one authenticated realtime socket.
 * <p>
 * The container thread delivers inbound frames. A shared scheduler ticks the heartbeat and the idle
 * watchdog and hands the resulting writes to a shared executor, which also drains notifications queued
 * by the bus listener. Every write, the close frame included, holds the send lock because sessions are
 * not thread-safe.
 */
public class RealtimeConnection {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConnection.class);

    static final CloseStatus IDLE_TIMEOUT = CloseStatus.NORMAL.withReason("Idle timeout");

    private final WebSocketSession session;
    private final AuthenticatedUser user;
    private final AppProperties.Realtime settings;
    private final ObjectMapper objectMapper;
    private final NotificationSubscriber notificationSubscriber;
    private final TaskScheduler scheduler;
    private final Executor forwardExecutor;
    private final MetricsPort metrics;
    private final LongSupplier clock;

    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final SlidingWindowRateLimiter rateLimiter;
    private final BlockingQueue<PendingNotification> outbound;
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicLong lastActivity = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile ScheduledFuture<?> idleTask;
    private volatile NotificationSubscriber.Subscription busSubscription;

    public RealtimeConnection(
            WebSocketSession session,
            AuthenticatedUser user,
            AppProperties.Realtime settings,
            ObjectMapper objectMapper,
            NotificationSubscriber notificationSubscriber,
            TaskScheduler scheduler,
            Executor forwardExecutor,
            MetricsPort metrics) {
        this(session, user, settings, objectMapper, notificationSubscriber, scheduler, forwardExecutor, metrics,
            System::currentTimeMillis);
    }

    RealtimeConnection(
            WebSocketSession session,
            AuthenticatedUser user,
            AppProperties.Realtime settings,
            ObjectMapper objectMapper,
            NotificationSubscriber notificationSubscriber,
            TaskScheduler scheduler,
            Executor forwardExecutor,
            MetricsPort metrics,
            LongSupplier clock) {
        this.session = session;
        this.user = user;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.notificationSubscriber = notificationSubscriber;
        this.scheduler = scheduler;
        this.forwardExecutor = forwardExecutor;
        this.metrics = metrics;
        this.clock = clock;
        this.rateLimiter = new SlidingWindowRateLimiter(settings.getRateLimitMax(), settings.getRateLimitWindowMs(), clock);
        this.outbound = new ArrayBlockingQueue<>(settings.getOutboundQueueCapacity());
        this.lastActivity.set(clock.getAsLong());
    }

    public void start() {
        subscriptions.addAll(ChannelAuthorizer.baselineChannels(user));
        busSubscription = notificationSubscriber.subscribe(this::onNotification);

        Duration heartbeat = Duration.ofMillis(settings.getHeartbeatIntervalMs());
        heartbeatTask = scheduler.scheduleAtFixedRate(
            () -> dispatch(this::sendHeartbeat), Instant.now().plus(heartbeat), heartbeat);
        Duration idleCheck = Duration.ofMillis(settings.getIdleCheckIntervalMs());
        idleTask = scheduler.scheduleAtFixedRate(this::checkIdle, Instant.now().plus(idleCheck), idleCheck);

        log.info("Realtime connection opened: sessionId={}, userId={}, channels={}",
            session.getId(), user.userId(), subscriptions);
    }

    public void handleText(String text) {
        touch();
        if (text.getBytes(StandardCharsets.UTF_8).length > settings.getMaxFrameBytes()) {
            metrics.incrementRealtimeFramesRejected("too_large");
            send(new ServerFrame.Error(ServerFrame.INVALID_MESSAGE, "Message too large"));
            return;
        }
        if (!rateLimiter.tryAcquire()) {
            metrics.incrementRealtimeFramesRejected("rate_limited");
            send(new ServerFrame.Error(ServerFrame.RATE_LIMITED, "Too many messages"));
            return;
        }

        Optional<ClientFrame> parsed = ClientFrame.parse(objectMapper, text);
        if (parsed.isEmpty()) {
            metrics.incrementRealtimeFramesRejected("invalid");
            send(new ServerFrame.Error(ServerFrame.INVALID_MESSAGE, "Unrecognized message"));
            return;
        }

        ClientFrame frame = parsed.get();
        if (frame instanceof ClientFrame.Subscribe subscribe) {
            handleSubscribe(subscribe.channels());
        } else if (frame instanceof ClientFrame.Unsubscribe unsubscribe) {
            handleUnsubscribe(unsubscribe.channels());
        } else if (frame instanceof ClientFrame.Ping ping) {
            send(new ServerFrame.Pong(ping.id()));
        }
    }

    public void handleBinary() {
        touch();
        metrics.incrementRealtimeFramesRejected("binary");
        send(new ServerFrame.Error(ServerFrame.INVALID_MESSAGE, "Binary frames not supported"));
    }

    public void touch() {
        lastActivity.set(clock.getAsLong());
    }

    private void handleSubscribe(List<String> channels) {
        List<String> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (String channel : channels) {
            if (!ChannelAuthorizer.validate(channel, user)) {
                rejected.add(channel);
            } else if (subscriptions.add(channel)) {
                accepted.add(channel);
            }
        }
        log.debug("Subscribe: sessionId={}, accepted={}, rejected={}", session.getId(), accepted, rejected);
        send(new ServerFrame.SubscribeAck(channels, accepted, rejected));
    }

    private void handleUnsubscribe(List<String> channels) {
        List<String> removed = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String channel : channels) {
            if (subscriptions.remove(channel)) {
                removed.add(channel);
            } else {
                missing.add(channel);
            }
        }
        send(new ServerFrame.UnsubscribeAck(channels, removed, missing));
    }

    void onNotification(String channel, String payload) {
        if (closed.get() || !subscriptions.contains(channel)) {
            return;
        }
        if (!outbound.offer(new PendingNotification(channel, payload))) {
            log.warn("Outbound queue full, dropping notification: sessionId={}, channel={}", session.getId(), channel);
            return;
        }
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            forwardExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Forward executor rejected drain: sessionId={}", session.getId());
        }
    }

    private void drain() {
        try {
            PendingNotification next;
            while (!closed.get() && (next = outbound.poll()) != null) {
                if (!send(new ServerFrame.Event(next.channel(), toPayload(next.payload())))) {
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        if (!outbound.isEmpty() && !closed.get()) {
            scheduleDrain();
        }
    }

    private JsonNode toPayload(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return objectMapper.createObjectNode().put("raw", text);
        }
    }

    private void dispatch(Runnable task) {
        if (closed.get()) {
            return;
        }
        try {
            forwardExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Forward executor rejected task: sessionId={}", session.getId());
        }
    }

    private void sendHeartbeat() {
        send(new ServerFrame.Heartbeat(Instant.ofEpochMilli(clock.getAsLong()).toString()));
    }

    void checkIdle() {
        long idleFor = clock.getAsLong() - lastActivity.get();
        if (idleFor > settings.getIdleTimeoutMs()) {
            log.info("Idle timeout reached: sessionId={}, idleMs={}", session.getId(), idleFor);
            dispatch(() -> close(IDLE_TIMEOUT));
        }
    }

    /**
     * @return false when the frame could not be written; the connection is torn down in that case
     */
    boolean send(ServerFrame frame) {
        if (closed.get()) {
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize frame: type={}", frame.getClass().getSimpleName(), e);
            return true;
        }

        sendLock.lock();
        try {
            session.sendMessage(new TextMessage(json));
            touch();
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Send failed, closing connection: sessionId={}, error={}", session.getId(), e.getMessage());
            close(CloseStatus.SERVER_ERROR);
            return false;
        } finally {
            sendLock.unlock();
        }
    }

    public void close(CloseStatus status) {
        if (!shutdown()) {
            return;
        }
        sendLock.lock();
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close handshake failed: sessionId={}, error={}", session.getId(), e.getMessage());
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Cancels the connection's tasks and removes its bus listener. Safe to call more than once.
     *
     * @return true on the first call only
     */
    public boolean shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        cancel(heartbeatTask);
        cancel(idleTask);
        NotificationSubscriber.Subscription subscription = busSubscription;
        if (subscription != null) {
            subscription.close();
        }
        outbound.clear();
        log.info("Realtime connection closed: sessionId={}, userId={}", session.getId(), user.userId());
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    Set<String> subscriptions() {
        return Set.copyOf(subscriptions);
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private record PendingNotification(String channel, String payload) {}
}
