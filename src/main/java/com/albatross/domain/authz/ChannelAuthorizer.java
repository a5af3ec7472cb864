package com.albatross.domain.authz;

import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.NotificationChannels;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which notification channels a realtime connection may listen on.
 */
public final class ChannelAuthorizer {

    private ChannelAuthorizer() {}

    /**
     * A channel is {@code user:<id>:updates|apikeys} for the caller's own id,
     * or {@code tenant:<id>:updates} for the caller's own tenant.
     */
    public static boolean validate(String channel, AuthenticatedUser user) {
        if (channel == null || user == null) {
            return false;
        }
        String[] parts = channel.split(":", -1);
        if (parts.length != 3) {
            return false;
        }
        String entity = parts[0];
        String id = parts[1];
        String topic = parts[2];

        if (NotificationChannels.USER.equals(entity)) {
            return (NotificationChannels.UPDATES.equals(topic) || NotificationChannels.API_KEYS.equals(topic))
                && id.equals(user.userId());
        }
        if (NotificationChannels.TENANT.equals(entity)) {
            return NotificationChannels.UPDATES.equals(topic)
                && user.hasTenant()
                && id.equals(user.tenantId());
        }
        return false;
    }

    public static Set<String> baselineChannels(AuthenticatedUser user) {
        Set<String> channels = new LinkedHashSet<>();
        channels.add(NotificationChannels.userUpdates(user.userId()));
        channels.add(NotificationChannels.userApiKeys(user.userId()));
        if (user.hasTenant()) {
            channels.add(NotificationChannels.tenantUpdates(user.tenantId()));
        }
        return channels;
    }
}
