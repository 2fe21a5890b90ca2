package com.example.reminderscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of a reminder job.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Job has a next run time and participates in the due set.
     */
    SCHEDULED("scheduled", "Scheduled", true),

    /**
     * Job was paused by its owner and will not fire until resumed.
     */
    PAUSED("paused", "Paused", false),

    /**
     * Recurring job whose trigger has no further fire time.
     * Terminal state.
     */
    COMPLETED("completed", "Completed", false);

    private final String code;
    private final String displayName;

    /**
     * Indicates if a job in this status can be picked up by the scheduler loop
     */
    private final boolean dueEligible;

    /**
     * Find JobStatus by its code value
     */
    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
