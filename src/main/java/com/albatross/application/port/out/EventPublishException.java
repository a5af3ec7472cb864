package com.albatross.application.port.out;

/**
 * The bus did not confirm a publish.
 */
public class EventPublishException extends RuntimeException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
