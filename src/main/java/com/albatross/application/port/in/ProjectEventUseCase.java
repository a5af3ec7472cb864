package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;

public interface ProjectEventUseCase {

    /**
     * Applies one bus message to the read models and publishes its notification.
     *
     * @param sequence stream sequence from the message headers, null when absent
     */
    Result<Outcome, CoreError> project(String eventType, String aggregateId, Long sequence, byte[] payload);

    enum Outcome {
        APPLIED,
        SKIPPED
    }
}
