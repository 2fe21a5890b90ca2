package com.example.reminderscheduler.service.parse;

import com.example.reminderscheduler.exception.DateParseException;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Turns user supplied date/time text into an instant.
 */
public interface DateTimeParser {

    /**
     * @param zoneHint zone for text that does not carry an offset
     * @throws DateParseException if the text is not understood
     */
    Instant parse(String text, ZoneId zoneHint);
}
