package com.example.reminderscheduler.service.trigger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Cron fields, most significant first.
 */
@Getter
@RequiredArgsConstructor
public enum CronField {

    YEAR("year", 1970, 9999, false, List.of()),
    MONTH("month", 1, 12, true,
            List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec")),
    DAY("day", 1, 31, true, List.of()),
    WEEK("week", 1, 53, false, List.of()),
    DAY_OF_WEEK("day_of_week", 0, 6, false, List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun")),
    HOUR("hour", 0, 23, true, List.of()),
    MINUTE("minute", 0, 59, true, List.of()),
    SECOND("second", 0, 59, true, List.of());

    private final String fieldName;
    private final int min;
    private final int max;

    /**
     * Whether an unset field below the least significant set one is pinned to {@link #min}
     * instead of matching anything
     */
    private final boolean pinnedWhenUnset;

    /**
     * Accepted value names, in order starting at {@link #min}
     */
    private final List<String> names;

    int resolve(String token) {
        var index = names.indexOf(token.toLowerCase());
        if (index >= 0) {
            return min + index;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s: '%s' is not a number", fieldName, token));
        }
    }
}
