package com.albatross.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new time-ordered identifier (UUIDv7).
     */
    UUID generate();
}
