package com.example.reminderscheduler.service.trigger;

import com.example.reminderscheduler.domain.trigger.CronTrigger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed form of a {@link CronTrigger}: one matcher per field, with unset fields
 * filled in by significance.
 */
public final class CronSchedule {

    private final Map<CronField, CronFieldMatcher> matchers;

    private CronSchedule(Map<CronField, CronFieldMatcher> matchers) {
        this.matchers = matchers;
    }

    /**
     * @throws IllegalArgumentException if a field expression does not parse
     */
    public static CronSchedule of(CronTrigger trigger) {
        var expressions = new EnumMap<CronField, String>(CronField.class);
        put(expressions, CronField.YEAR, trigger.getYear());
        put(expressions, CronField.MONTH, trigger.getMonth());
        put(expressions, CronField.DAY, trigger.getDay());
        put(expressions, CronField.WEEK, trigger.getWeek());
        put(expressions, CronField.DAY_OF_WEEK, trigger.getDayOfWeek());
        put(expressions, CronField.HOUR, trigger.getHour());
        put(expressions, CronField.MINUTE, trigger.getMinute());
        put(expressions, CronField.SECOND, trigger.getSecond());

        CronField leastSignificantSet = null;
        for (var field : CronField.values()) {
            if (expressions.containsKey(field)) {
                leastSignificantSet = field;
            }
        }

        var matchers = new EnumMap<CronField, CronFieldMatcher>(CronField.class);
        for (var field : CronField.values()) {
            var expression = expressions.get(field);
            if (expression != null) {
                matchers.put(field, CronFieldMatcher.parse(field, expression));
            } else if (leastSignificantSet != null
                    && field.ordinal() > leastSignificantSet.ordinal()
                    && field.isPinnedWhenUnset()) {
                matchers.put(field, CronFieldMatcher.only(field, field.getMin()));
            } else {
                matchers.put(field, CronFieldMatcher.any(field));
            }
        }
        return new CronSchedule(matchers);
    }

    private static void put(Map<CronField, String> expressions, CronField field, String expression) {
        if (expression != null && !expression.isBlank()) {
            expressions.put(field, expression);
        }
    }

    /**
     * Earliest instant {@code >= fromInclusive} and {@code <= limit} whose wall-clock time in
     * {@code zone} matches every field.
     * <p>
     * Local times skipped by a DST gap resolve to the shifted instant; repeated local times
     * in an overlap resolve to the earliest offset that is not before {@code fromInclusive}.
     */
    public Optional<Instant> nextMatch(Instant fromInclusive, ZoneId zone, Instant limit) {
        var year = matchers.get(CronField.YEAR);
        var month = matchers.get(CronField.MONTH);
        var week = matchers.get(CronField.WEEK);
        var dayOfWeek = matchers.get(CronField.DAY_OF_WEEK);
        var hour = matchers.get(CronField.HOUR);
        var minute = matchers.get(CronField.MINUTE);
        var second = matchers.get(CronField.SECOND);

        var cursor = LocalDateTime.ofInstant(fromInclusive, zone);
        var end = LocalDateTime.ofInstant(limit, zone).plusDays(1);

        while (!cursor.isAfter(end)) {
            if (!year.matches(cursor.getYear())) {
                var nextYear = year.nextValue(cursor.getYear() + 1);
                if (nextYear < 0) {
                    return Optional.empty();
                }
                cursor = LocalDateTime.of(nextYear, 1, 1, 0, 0);
                continue;
            }
            if (!month.matches(cursor.getMonthValue())) {
                cursor = cursor.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            var date = cursor.toLocalDate();
            if (!matchesDay(date.getDayOfMonth(), date.lengthOfMonth())
                    || !week.matches(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                    || !dayOfWeek.matches(date.getDayOfWeek().getValue() - 1)) {
                cursor = date.plusDays(1).atStartOfDay();
                continue;
            }
            if (!hour.matches(cursor.getHour())) {
                cursor = cursor.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minute.matches(cursor.getMinute())) {
                cursor = cursor.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            if (!second.matches(cursor.getSecond())) {
                cursor = cursor.plusSeconds(1);
                continue;
            }

            var zoned = ZonedDateTime.ofLocal(cursor, zone, null);
            if (zoned.toInstant().isBefore(fromInclusive)) {
                zoned = zoned.withLaterOffsetAtOverlap();
            }
            if (zoned.toInstant().isBefore(fromInclusive)) {
                cursor = cursor.plusSeconds(1);
                continue;
            }
            var candidate = zoned.toInstant();
            return candidate.isAfter(limit) ? Optional.empty() : Optional.of(candidate);
        }
        return Optional.empty();
    }

    private boolean matchesDay(int dayOfMonth, int lengthOfMonth) {
        return matchers.get(CronField.DAY).matchesDay(dayOfMonth, lengthOfMonth);
    }

    CronFieldMatcher matcher(CronField field) {
        return matchers.get(field);
    }
}
