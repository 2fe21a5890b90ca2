package com.example.reminderscheduler.exception;

import lombok.Getter;

/**
 * Exception for date/time text that could not be understood
 */
@Getter
public class DateParseException extends RuntimeException {

    private final String text;

    public DateParseException(String text) {
        super("Could not parse date/time: '" + text + "'");
        this.text = text;
    }
}
