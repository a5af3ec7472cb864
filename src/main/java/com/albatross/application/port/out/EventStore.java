package com.albatross.application.port.out;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.StoredEvent;

import java.util.List;

/**
 * Append-only event log with optimistic concurrency per aggregate.
 */
public interface EventStore {

    /**
     * All events of one aggregate in ascending sequence. Empty when the aggregate has no history.
     */
    List<StoredEvent> load(String aggregateId);

    /**
     * Appends events as sequences {@code expectedVersion+1..expectedVersion+n}.
     * Fails with {@link CoreError.Concurrency} when the stream has moved past {@code expectedVersion}.
     * An empty list is a no-op that succeeds with the expected version.
     *
     * @return the stream version after the append
     */
    Result<Long, CoreError> save(String aggregateId, long expectedVersion, List<NewEvent> events);

    /**
     * Current version of a stream, 0 when it has no events.
     */
    long currentVersion(String aggregateId);
}
