package com.example.reminderscheduler.service.parse;

import com.example.reminderscheduler.exception.DateParseException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Accepts ISO-8601 instants, offset and zoned date-times, plus the local forms
 * {@code yyyy-MM-dd HH:mm[:ss]}, {@code yyyy-MM-ddTHH:mm[:ss]} and {@code yyyy-MM-dd}
 * (midnight), read in the hint zone.
 */
@Component
public class IsoDateTimeParser implements DateTimeParser {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    @Override
    public Instant parse(String text, ZoneId zoneHint) {
        if (text == null || text.isBlank()) {
            throw new DateParseException(String.valueOf(text));
        }
        var trimmed = text.trim();

        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the next form
        }
        try {
            return ZonedDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a zoned date-time
        }
        for (var format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format).atZone(zoneHint).toInstant();
            } catch (DateTimeParseException ignored) {
                // try next local form
            }
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay(zoneHint).toInstant();
        } catch (DateTimeParseException e) {
            throw new DateParseException(trimmed);
        }
    }
}
