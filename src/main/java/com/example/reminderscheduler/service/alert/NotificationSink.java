package com.example.reminderscheduler.service.alert;

import java.time.Instant;

/**
 * Operational notifications raised by the scheduler loop. Implementations must not
 * throw back into the caller.
 */
public interface NotificationSink {

    /**
     * A run was skipped because it was too late or a previous delivery was still running
     */
    void missed(String jobId, Instant scheduledTime);

    void executionFailed(String jobId, String errorDescription);

    /**
     * The job store kept failing after retries
     */
    void storeFailure(String operation, String errorDescription);
}
