package com.albatross.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Store store = new Store();
    private Bus bus = new Bus();
    private Outbox outbox = new Outbox();
    private Projection projection = new Projection();
    private Notifications notifications = new Notifications();
    private Credentials credentials = new Credentials();
    private Realtime realtime = new Realtime();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public void setOutbox(Outbox outbox) {
        this.outbox = outbox;
    }

    public Projection getProjection() {
        return projection;
    }

    public void setProjection(Projection projection) {
        this.projection = projection;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Realtime getRealtime() {
        return realtime;
    }

    public void setRealtime(Realtime realtime) {
        this.realtime = realtime;
    }

    public static class Store {
        /**
         * {@code jdbc} or {@code memory}.
         */
        private String type = "jdbc";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Bus {
        /**
         * {@code kafka} or {@code memory}.
         */
        private String type = "kafka";
        private String exchange = "albatross";
        private long publishTimeoutMs = 5000;
        private int partitions = 3;
        private short replicas = 1;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = exchange;
        }

        public long getPublishTimeoutMs() {
            return publishTimeoutMs;
        }

        public void setPublishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public short getReplicas() {
            return replicas;
        }

        public void setReplicas(short replicas) {
            this.replicas = replicas;
        }
    }

    public static class Outbox {
        private boolean enabled = true;
        private long pollIntervalMs = 1000;
        private long gracePeriodMs = 5000;
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getGracePeriodMs() {
            return gracePeriodMs;
        }

        public void setGracePeriodMs(long gracePeriodMs) {
            this.gracePeriodMs = gracePeriodMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Projection {
        private boolean enabled = true;
        private String groupId = "albatross-projection";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }
    }

    public static class Notifications {
        /**
         * {@code redis} or {@code memory}.
         */
        private String type = "redis";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Credentials {
        /**
         * {@code redis} or {@code memory}.
         */
        private String type = "redis";
        private long sessionTtlSeconds = 86400;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public long getSessionTtlSeconds() {
            return sessionTtlSeconds;
        }

        public void setSessionTtlSeconds(long sessionTtlSeconds) {
            this.sessionTtlSeconds = sessionTtlSeconds;
        }
    }

    public static class Realtime {
        private boolean enabled = true;
        private String path = "/ws";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private long heartbeatIntervalMs = 30_000;
        private long idleTimeoutMs = 90_000;
        private long idleCheckIntervalMs = 5_000;
        private int maxFrameBytes = 32_768;
        private int rateLimitMax = 10;
        private long rateLimitWindowMs = 10_000;
        private int outboundQueueCapacity = 256;
        private int schedulerPoolSize = 2;
        private int forwardPoolSize = 8;
        private int forwardQueueCapacity = 1_024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getIdleTimeoutMs() {
            return idleTimeoutMs;
        }

        public void setIdleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
        }

        public long getIdleCheckIntervalMs() {
            return idleCheckIntervalMs;
        }

        public void setIdleCheckIntervalMs(long idleCheckIntervalMs) {
            this.idleCheckIntervalMs = idleCheckIntervalMs;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }

        public int getRateLimitMax() {
            return rateLimitMax;
        }

        public void setRateLimitMax(int rateLimitMax) {
            this.rateLimitMax = rateLimitMax;
        }

        public long getRateLimitWindowMs() {
            return rateLimitWindowMs;
        }

        public void setRateLimitWindowMs(long rateLimitWindowMs) {
            this.rateLimitWindowMs = rateLimitWindowMs;
        }

        public int getOutboundQueueCapacity() {
            return outboundQueueCapacity;
        }

        public void setOutboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = outboundQueueCapacity;
        }

        public int getSchedulerPoolSize() {
            return schedulerPoolSize;
        }

        public void setSchedulerPoolSize(int schedulerPoolSize) {
            this.schedulerPoolSize = schedulerPoolSize;
        }

        public int getForwardPoolSize() {
            return forwardPoolSize;
        }

        public void setForwardPoolSize(int forwardPoolSize) {
            this.forwardPoolSize = forwardPoolSize;
        }

        public int getForwardQueueCapacity() {
            return forwardQueueCapacity;
        }

        public void setForwardQueueCapacity(int forwardQueueCapacity) {
            this.forwardQueueCapacity = forwardQueueCapacity;
        }
    }
}
