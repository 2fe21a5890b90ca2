package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for trigger parameters that are malformed, inconsistent or never fire.
 * {@code constraint} names the violated rule, usually the offending field.
 */
@Getter
public class InvalidTriggerException extends RuntimeException {

    private final String constraint;

    public InvalidTriggerException(String constraint, String message) {
        super(String.format("Invalid trigger (%s): %s", constraint, message));
        this.constraint = constraint;
    }

    public InvalidTriggerException(String constraint, String message, Throwable cause) {
        super(String.format("Invalid trigger (%s): %s", constraint, message), cause);
        this.constraint = constraint;
    }
}
