package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for creating a job whose id is already taken
 */
@Getter
public class DuplicateJobIdException extends RuntimeException {

    private final String jobId;

    public DuplicateJobIdException(String jobId) {
        super("Reminder already exists: " + jobId);
        this.jobId = jobId;
    }

    public DuplicateJobIdException(String jobId, Throwable cause) {
        super("Reminder already exists: " + jobId, cause);
        this.jobId = jobId;
    }
}
