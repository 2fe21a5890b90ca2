package com.example.reminderscheduler.domain.trigger;

import com.example.reminderscheduler.domain.enums.TriggerType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Calendar based trigger. Each field holds a field expression ({@code *}, {@code 9},
 * {@code 1-5}, {@code *&#47;15}, {@code mon,wed}, {@code last} ...) or {@code null} when unset.
 * <p>
 * Unset fields more significant than the least significant set field match anything,
 * unset less significant fields match their minimum only.
 */
@Value
@Builder(toBuilder = true)
public class CronTrigger implements RecurringTrigger {

    String year;
    String month;
    String day;

    /**
     * ISO week of the week-based year
     */
    String week;

    /**
     * 0 = monday .. 6 = sunday, or names mon..sun
     */
    String dayOfWeek;

    String hour;
    String minute;
    String second;

    @Builder.Default
    ZoneId zone = ZoneOffset.UTC;

    Instant startDate;
    Instant endDate;
    Integer jitterSeconds;

    @Override
    public TriggerType getType() {
        return TriggerType.CRON;
    }
}
