package com.example.reminderscheduler.domain.trigger;

import com.example.reminderscheduler.domain.enums.TriggerType;

import java.time.ZoneId;

/**
 * Defining parameters of a reminder schedule.
 * <p>
 * Implementations are immutable values; behaviour lives in the trigger evaluator.
 */
public interface Trigger {

    TriggerType getType();

    /**
     * Zone in which wall-clock fields are interpreted
     */
    ZoneId getZone();
}
