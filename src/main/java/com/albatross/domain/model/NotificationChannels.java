package com.albatross.domain.model;

/**
 * Channel names shared by the projection worker (publisher) and the realtime gateway (subscriber).
 * Every channel is {@code <entity>:<id>:<topic>}.
 */
public final class NotificationChannels {

    public static final String USER = "user";
    public static final String TENANT = "tenant";
    public static final String UPDATES = "updates";
    public static final String API_KEYS = "apikeys";

    private NotificationChannels() {}

    public static String userUpdates(String userId) {
        return USER + ":" + userId + ":" + UPDATES;
    }

    public static String userApiKeys(String userId) {
        return USER + ":" + userId + ":" + API_KEYS;
    }

    public static String tenantUpdates(String tenantId) {
        return TENANT + ":" + tenantId + ":" + UPDATES;
    }
}
