package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for reminder job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Reminder not found: " + jobId);
        this.jobId = jobId;
    }
}
