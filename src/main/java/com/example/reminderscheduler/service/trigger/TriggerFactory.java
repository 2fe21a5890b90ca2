package com.example.reminderscheduler.service.trigger;

import com.example.reminderscheduler.config.ReminderSchedulerProperties;
import com.example.reminderscheduler.domain.trigger.CronTrigger;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.Trigger;
import com.example.reminderscheduler.dto.TriggerRequest;
import com.example.reminderscheduler.exception.InvalidTriggerException;
import com.example.reminderscheduler.service.parse.DateTimeParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Builds trigger values from API requests, resolving zones and date text.
 * Consistency checks are left to {@link TriggerEvaluator#validate}.
 */
@Component
@RequiredArgsConstructor
public class TriggerFactory {

    private final DateTimeParser dateTimeParser;
    private final ReminderSchedulerProperties properties;

    public Trigger fromRequest(TriggerRequest request) {
        var zone = resolveZone(request.getTimezone());
        switch (request.getType()) {
            case DATE:
                if (request.getRunDate() == null) {
                    throw new InvalidTriggerException("runDate", "run date is required");
                }
                return DateTrigger.builder()
                        .runDate(dateTimeParser.parse(request.getRunDate(), zone))
                        .zone(zone)
                        .build();
            case CRON:
                return CronTrigger.builder()
                        .year(request.getYear())
                        .month(request.getMonth())
                        .day(request.getDay())
                        .week(request.getWeek())
                        .dayOfWeek(request.getDayOfWeek())
                        .hour(request.getHour())
                        .minute(request.getMinute())
                        .second(request.getSecond())
                        .zone(zone)
                        .startDate(parseOptional(request.getStartDate(), zone))
                        .endDate(parseOptional(request.getEndDate(), zone))
                        .jitterSeconds(request.getJitterSeconds())
                        .build();
            case INTERVAL:
                return IntervalTrigger.builder()
                        .weeks(orZero(request.getWeeks()))
                        .days(orZero(request.getDays()))
                        .hours(orZero(request.getHours()))
                        .minutes(orZero(request.getMinutes()))
                        .seconds(orZero(request.getSeconds()))
                        .zone(zone)
                        .startDate(parseOptional(request.getStartDate(), zone))
                        .endDate(parseOptional(request.getEndDate(), zone))
                        .jitterSeconds(request.getJitterSeconds())
                        .build();
            default:
                throw new InvalidTriggerException("type", "unsupported trigger type " + request.getType());
        }
    }

    /**
     * Zone for the given id, or the configured default when blank
     *
     * @throws InvalidTriggerException if the id does not resolve
     */
    public ZoneId resolveZone(String timezone) {
        var id = timezone == null || timezone.isBlank() ? properties.getDefaultTimezone() : timezone.trim();
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new InvalidTriggerException("timezone", "unknown timezone '" + id + "'", e);
        }
    }

    private Instant parseOptional(String text, ZoneId zone) {
        return text == null || text.isBlank() ? null : dateTimeParser.parse(text, zone);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
