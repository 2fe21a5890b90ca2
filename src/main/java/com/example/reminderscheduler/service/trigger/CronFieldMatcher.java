package com.example.reminderscheduler.service.trigger;

import java.util.BitSet;

/**
 * Set of values one cron field accepts.
 * <p>
 * Accepts comma separated lists of {@code *}, {@code *&#47;n}, {@code a}, {@code a-b},
 * {@code a-b/n}, {@code a/n}; value names where the field has them, and {@code last}
 * for the day of month.
 */
public final class CronFieldMatcher {

    private final CronField field;
    private final BitSet values;
    private final boolean any;
    private final boolean lastDayOfMonth;

    private CronFieldMatcher(CronField field, BitSet values, boolean any, boolean lastDayOfMonth) {
        this.field = field;
        this.values = values;
        this.any = any;
        this.lastDayOfMonth = lastDayOfMonth;
    }

    public static CronFieldMatcher any(CronField field) {
        return new CronFieldMatcher(field, null, true, false);
    }

    public static CronFieldMatcher only(CronField field, int value) {
        var values = new BitSet(field.getMax() + 1);
        values.set(value);
        return new CronFieldMatcher(field, values, false, false);
    }

    /**
     * @throws IllegalArgumentException naming the field when the expression is malformed or out of range
     */
    public static CronFieldMatcher parse(CronField field, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException(field.getFieldName() + ": empty expression");
        }
        var values = new BitSet(field.getMax() + 1);
        var last = false;
        for (var raw : expression.trim().split(",")) {
            var part = raw.trim().toLowerCase();
            if (part.equals("*")) {
                return any(field);
            }
            if (part.equals("last")) {
                if (field != CronField.DAY) {
                    throw new IllegalArgumentException(field.getFieldName() + ": 'last' is only valid for day");
                }
                last = true;
                continue;
            }
            addPart(field, part, values);
        }
        return new CronFieldMatcher(field, values, false, last);
    }

    private static void addPart(CronField field, String part, BitSet values) {
        var step = 1;
        var range = part;
        var slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = field.resolve(part.substring(slash + 1));
            if (step <= 0) {
                throw new IllegalArgumentException(field.getFieldName() + ": step must be positive in '" + part + "'");
            }
        }

        int from;
        int to;
        if (range.equals("*")) {
            from = field.getMin();
            to = field.getMax();
        } else if (range.indexOf('-') > 0) {
            var dash = range.indexOf('-');
            from = field.resolve(range.substring(0, dash));
            to = field.resolve(range.substring(dash + 1));
        } else {
            from = field.resolve(range);
            to = slash >= 0 ? field.getMax() : from;
        }

        checkRange(field, from, part);
        checkRange(field, to, part);
        if (from > to) {
            throw new IllegalArgumentException(
                    String.format("%s: range start exceeds end in '%s'", field.getFieldName(), part));
        }
        for (var value = from; value <= to; value += step) {
            values.set(value);
        }
    }

    private static void checkRange(CronField field, int value, String part) {
        if (value < field.getMin() || value > field.getMax()) {
            throw new IllegalArgumentException(String.format("%s: %d outside %d-%d in '%s'",
                    field.getFieldName(), value, field.getMin(), field.getMax(), part));
        }
    }

    public CronField getField() {
        return field;
    }

    public boolean isAny() {
        return any;
    }

    public boolean matches(int value) {
        return any || values.get(value);
    }

    /**
     * Day-of-month check, aware of {@code last}
     */
    public boolean matchesDay(int dayOfMonth, int lengthOfMonth) {
        return matches(dayOfMonth) || (lastDayOfMonth && dayOfMonth == lengthOfMonth);
    }

    /**
     * Smallest accepted value {@code >= from}, or -1
     */
    public int nextValue(int from) {
        if (any) {
            return from <= field.getMax() ? Math.max(from, field.getMin()) : -1;
        }
        if (from > field.getMax()) {
            return -1;
        }
        return values.nextSetBit(Math.max(from, field.getMin()));
    }
}
