package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for job store I/O failures (database unreachable, lock timeout, ...)
 */
@Getter
public class JobStoreException extends RuntimeException {

    private final String operation;

    public JobStoreException(String operation, Throwable cause) {
        super(String.format("Job store %s failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
