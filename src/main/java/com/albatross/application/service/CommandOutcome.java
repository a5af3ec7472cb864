package com.albatross.application.service;

import java.util.List;

/**
 * Aggregate state after a successful command, the events it produced and the new stream version.
 */
public record CommandOutcome<A, E>(A aggregate, List<E> events, long version) {
}
