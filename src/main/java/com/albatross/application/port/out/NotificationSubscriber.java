package com.albatross.application.port.out;

/**
 * Topic-wide subscription to every {@code user:*} and {@code tenant:*} notification channel.
 */
public interface NotificationSubscriber {

    Subscription subscribe(Listener listener);

    @FunctionalInterface
    interface Listener {
        void onMessage(String channel, String payload);
    }

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
