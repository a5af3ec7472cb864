package com.albatross.infrastructure.config;

import com.albatross.adapter.in.websocket.CredentialHandshakeInterceptor;
import com.albatross.adapter.in.websocket.RealtimeWebSocketHandler;
import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.NotificationSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@ConditionalOnProperty(name = "app.realtime.enabled", havingValue = "true", matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {

    // Above the application frame limit so oversized frames reach the handler instead of closing the socket.
    private static final int CONTAINER_TEXT_BUFFER_BYTES = 65_536;

    private final AppProperties appProperties;
    private final CredentialStore credentialStore;
    private final NotificationSubscriber notificationSubscriber;
    private final ObjectMapper objectMapper;
    private final MetricsPort metrics;

    public WebSocketConfig(
            AppProperties appProperties,
            CredentialStore credentialStore,
            NotificationSubscriber notificationSubscriber,
            ObjectMapper objectMapper,
            MetricsPort metrics) {
        this.appProperties = appProperties;
        this.credentialStore = credentialStore;
        this.notificationSubscriber = notificationSubscriber;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        AppProperties.Realtime realtime = appProperties.getRealtime();
        registry.addHandler(realtimeWebSocketHandler(), realtime.getPath())
            .addInterceptors(new CredentialHandshakeInterceptor(credentialStore))
            .setAllowedOriginPatterns(realtime.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public RealtimeWebSocketHandler realtimeWebSocketHandler() {
        return new RealtimeWebSocketHandler(
            appProperties.getRealtime(),
            objectMapper,
            notificationSubscriber,
            realtimeScheduler(),
            realtimeForwardExecutor(),
            metrics
        );
    }

    /**
     * Only fires heartbeat and idle ticks; the socket writes they trigger run on the forward executor.
     */
    @Bean
    public ThreadPoolTaskScheduler realtimeScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(appProperties.getRealtime().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("realtime-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor realtimeForwardExecutor() {
        AppProperties.Realtime realtime = appProperties.getRealtime();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(realtime.getForwardPoolSize());
        executor.setMaxPoolSize(realtime.getForwardPoolSize());
        executor.setQueueCapacity(realtime.getForwardQueueCapacity());
        executor.setThreadNamePrefix("realtime-send-");
        return executor;
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(CONTAINER_TEXT_BUFFER_BYTES);
        container.setMaxBinaryMessageBufferSize(CONTAINER_TEXT_BUFFER_BYTES);
        return container;
    }
}
