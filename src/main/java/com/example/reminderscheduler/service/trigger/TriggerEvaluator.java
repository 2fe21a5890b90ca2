package com.example.reminderscheduler.service.trigger;

import com.example.reminderscheduler.domain.trigger.CronTrigger;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.RecurringTrigger;
import com.example.reminderscheduler.domain.trigger.Trigger;
import com.example.reminderscheduler.exception.InvalidTriggerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Computes fire times for every trigger type.
 * <p>
 * Pure apart from jitter: given the same trigger, previous fire time and clock reading
 * it always returns the same instant when the trigger has no jitter.
 */
@Slf4j
@Component
public class TriggerEvaluator {

    /**
     * How far ahead a cron scan looks before giving up
     */
    static final int CRON_SEARCH_HORIZON_YEARS = 100;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private final Supplier<Random> random;

    public TriggerEvaluator() {
        this.random = ThreadLocalRandom::current;
    }

    public TriggerEvaluator(Random random) {
        this.random = () -> random;
    }

    /**
     * Next fire time strictly after {@code previousFireTime}, or after {@code now} when the
     * trigger has not fired yet.
     */
    public Optional<Instant> nextFireTime(Trigger trigger, Instant previousFireTime, Instant now) {
        switch (trigger.getType()) {
            case DATE:
                var runDate = ((DateTrigger) trigger).getRunDate();
                var after = previousFireTime != null ? previousFireTime : now;
                return runDate.isAfter(after) ? Optional.of(runDate) : Optional.empty();
            case CRON:
                var cron = (CronTrigger) trigger;
                return bounded(cron, nextCron(cron, previousFireTime != null ? previousFireTime : now));
            case INTERVAL:
                var interval = (IntervalTrigger) trigger;
                return bounded(interval, Optional.of(nextInterval(interval, previousFireTime, now)));
            default:
                throw new IllegalStateException("Unsupported trigger type: " + trigger.getType());
        }
    }

    /**
     * First fire time strictly after {@code now} that follows {@code previousFireTime}.
     * Occurrences between the two are skipped, so a late or missed run does not shift the
     * schedule.
     */
    public Optional<Instant> nextFutureFireTime(Trigger trigger, Instant previousFireTime, Instant now) {
        switch (trigger.getType()) {
            case DATE:
                return nextFireTime(trigger, previousFireTime, now).filter(next -> next.isAfter(now));
            case CRON:
                var cron = (CronTrigger) trigger;
                var after = previousFireTime != null && previousFireTime.isAfter(now) ? previousFireTime : now;
                return bounded(cron, nextCron(cron, after));
            case INTERVAL:
                var interval = (IntervalTrigger) trigger;
                var next = nextInterval(interval, previousFireTime, now);
                if (!next.isAfter(now)) {
                    next = skipPast(next, interval.getInterval(), now);
                }
                return bounded(interval, Optional.of(next));
            default:
                throw new IllegalStateException("Unsupported trigger type: " + trigger.getType());
        }
    }

    /**
     * @throws InvalidTriggerException naming the violated constraint
     */
    public void validate(Trigger trigger) {
        if (trigger == null) {
            throw new InvalidTriggerException("trigger", "trigger is required");
        }
        if (trigger.getZone() == null) {
            throw new InvalidTriggerException("timezone", "timezone is required");
        }
        switch (trigger.getType()) {
            case DATE:
                if (((DateTrigger) trigger).getRunDate() == null) {
                    throw new InvalidTriggerException("runDate", "run date is required");
                }
                return;
            case CRON:
                validateBounds((CronTrigger) trigger);
                try {
                    CronSchedule.of((CronTrigger) trigger);
                } catch (IllegalArgumentException e) {
                    throw new InvalidTriggerException("cron", e.getMessage(), e);
                }
                return;
            case INTERVAL:
                var interval = (IntervalTrigger) trigger;
                validateBounds(interval);
                if (interval.getWeeks() < 0 || interval.getDays() < 0 || interval.getHours() < 0
                        || interval.getMinutes() < 0 || interval.getSeconds() < 0) {
                    throw new InvalidTriggerException("interval", "interval components must not be negative");
                }
                if (interval.getInterval().isZero()) {
                    throw new InvalidTriggerException("interval", "interval must be positive");
                }
                return;
            default:
                throw new InvalidTriggerException("type", "unsupported trigger type " + trigger.getType());
        }
    }

    private void validateBounds(RecurringTrigger trigger) {
        if (trigger.getStartDate() != null && trigger.getEndDate() != null
                && trigger.getStartDate().isAfter(trigger.getEndDate())) {
            throw new InvalidTriggerException("endDate", "start date is after end date");
        }
        if (trigger.getJitterSeconds() != null && trigger.getJitterSeconds() < 0) {
            throw new InvalidTriggerException("jitterSeconds", "jitter must not be negative");
        }
    }

    private Optional<Instant> nextCron(CronTrigger trigger, Instant after) {
        var from = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        if (trigger.getStartDate() != null) {
            var start = ceilToSecond(trigger.getStartDate());
            if (start.isAfter(from)) {
                from = start;
            }
        }
        var limit = from.atZone(ZoneOffset.UTC).plusYears(CRON_SEARCH_HORIZON_YEARS).toInstant();
        if (trigger.getEndDate() != null && trigger.getEndDate().isBefore(limit)) {
            limit = trigger.getEndDate();
        }
        if (from.isAfter(limit)) {
            return Optional.empty();
        }
        var next = CronSchedule.of(trigger).nextMatch(from, trigger.getZone(), limit);
        if (next.isEmpty()) {
            log.debug("Cron trigger has no fire time after {}", after);
        }
        return next;
    }

    private Instant nextInterval(IntervalTrigger trigger, Instant previousFireTime, Instant now) {
        var interval = trigger.getInterval();
        var anchor = trigger.getStartDate();
        if (previousFireTime != null) {
            // stay on the anchor grid so jittered runs do not drift the schedule
            return anchor != null && !anchor.isAfter(previousFireTime)
                    ? firstGridPointAfter(anchor, interval, previousFireTime)
                    : previousFireTime.plus(interval);
        }
        if (anchor == null) {
            anchor = now;
        }
        return anchor.isBefore(now) ? skipPast(anchor, interval, now.minusNanos(1)) : anchor;
    }

    /**
     * First {@code anchor + k * interval} strictly after {@code instant}
     */
    private static Instant firstGridPointAfter(Instant anchor, Duration interval, Instant instant) {
        var periods = toNanos(Duration.between(anchor, instant))
                .divide(toNanos(interval))
                .longValueExact() + 1;
        return anchor.plus(interval.multipliedBy(periods));
    }

    // spans of a few centuries no longer fit a long of nanoseconds
    private static BigInteger toNanos(Duration duration) {
        return BigInteger.valueOf(duration.getSeconds())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(duration.getNano()));
    }

    /**
     * First {@code from + k * interval} strictly after {@code instant}, k >= 1
     */
    private static Instant skipPast(Instant from, Duration interval, Instant instant) {
        return firstGridPointAfter(from, interval, instant);
    }

    private Optional<Instant> bounded(RecurringTrigger trigger, Optional<Instant> next) {
        var endDate = trigger.getEndDate();
        return next.filter(time -> endDate == null || !time.isAfter(endDate))
                .map(time -> applyJitter(trigger, time));
    }

    private Instant applyJitter(RecurringTrigger trigger, Instant time) {
        if (!trigger.hasJitter()) {
            return time;
        }
        var maxMillis = trigger.getJitterSeconds() * 1000L;
        if (trigger.getEndDate() != null) {
            maxMillis = Math.min(maxMillis, Duration.between(time, trigger.getEndDate()).toMillis());
        }
        if (maxMillis <= 0) {
            return time;
        }
        return time.plusMillis((long) (random.get().nextDouble() * (maxMillis + 1)));
    }

    private static Instant ceilToSecond(Instant instant) {
        var truncated = instant.truncatedTo(ChronoUnit.SECONDS);
        return truncated.equals(instant) ? instant : truncated.plusSeconds(1);
    }
}
