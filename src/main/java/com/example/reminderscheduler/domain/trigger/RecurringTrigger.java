package com.example.reminderscheduler.domain.trigger;

import java.time.Instant;

/**
 * Trigger that fires repeatedly between optional start and end bounds.
 */
public interface RecurringTrigger extends Trigger {

    Instant getStartDate();

    /**
     * Inclusive upper bound; no fire time (jitter included) ever passes it
     */
    Instant getEndDate();

    Integer getJitterSeconds();

    default boolean hasJitter() {
        return getJitterSeconds() != null && getJitterSeconds() > 0;
    }
}
