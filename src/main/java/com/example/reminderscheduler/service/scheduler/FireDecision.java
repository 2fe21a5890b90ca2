package com.example.reminderscheduler.service.scheduler;

import com.example.reminderscheduler.domain.enums.TriggerType;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What the loop decided for one due entry, computed under the job's store lock.
 */
@Value
@Builder
public class FireDecision {

    public enum Action {
        /**
         * Deliver the payload now
         */
        EXECUTE,

        /**
         * Run is later than the misfire grace allows
         */
        MISSED,

        /**
         * A previous delivery of the same job is still running
         */
        SKIPPED_IN_FLIGHT,

        /**
         * Entry no longer matches the store (removed, paused or moved); nothing fires
         */
        STALE
    }

    String jobId;
    Action action;
    TriggerType triggerType;

    /**
     * The run time this decision consumed
     */
    Instant scheduledTime;

    /**
     * Where the job goes next in the due set, null if it left it
     */
    Instant nextRunTime;

    ReminderPayload payload;

    static FireDecision stale(String jobId, Instant currentRunTime) {
        return FireDecision.builder()
                .jobId(jobId)
                .action(Action.STALE)
                .nextRunTime(currentRunTime)
                .build();
    }
}
