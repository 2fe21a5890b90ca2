package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for invalid job state transition
 */
@Getter
public class InvalidJobStateException extends RuntimeException {

    private final String jobId;
    private final String currentState;
    private final String requestedState;

    public InvalidJobStateException(String jobId, String currentState, String requestedState) {
        super(String.format("Cannot transition reminder %s from %s to %s", jobId, currentState, requestedState));
        this.jobId = jobId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
