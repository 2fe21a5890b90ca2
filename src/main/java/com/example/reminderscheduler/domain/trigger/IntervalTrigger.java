package com.example.reminderscheduler.domain.trigger;

import com.example.reminderscheduler.domain.enums.TriggerType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Fires every fixed duration, anchored at {@code startDate}.
 */
@Value
@Builder(toBuilder = true)
public class IntervalTrigger implements RecurringTrigger {

    int weeks;
    int days;
    int hours;
    int minutes;
    int seconds;

    @Builder.Default
    ZoneId zone = ZoneOffset.UTC;

    Instant startDate;
    Instant endDate;
    Integer jitterSeconds;

    @Override
    public TriggerType getType() {
        return TriggerType.INTERVAL;
    }

    public Duration getInterval() {
        return Duration.ofDays(7L * weeks + days)
                .plusHours(hours)
                .plusMinutes(minutes)
                .plusSeconds(seconds);
    }
}
