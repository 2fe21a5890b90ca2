package com.example.reminderscheduler.mapper;

import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.dto.JobSnapshot;
import org.mapstruct.AfterMapping;
import org.mapstruct.Builder;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.MappingTarget;
import org.mapstruct.ReportingPolicy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * MapStruct mapper for converting reminder jobs to API snapshots.
 * {@code now} is the reference point for the countdown in {@code triggerDisplay}.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true))
public interface JobMapper {

    int PREVIEW_LENGTH = 100;

    DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    JobSnapshot toSnapshot(ReminderJob job, @Context Instant now);

    List<JobSnapshot> toSnapshots(List<ReminderJob> jobs, @Context Instant now);

    @AfterMapping
    default void describe(ReminderJob job, @MappingTarget JobSnapshot snapshot, @Context Instant now) {
        snapshot.setMessagePreview(preview(job.getMessage()));
        snapshot.setTriggerDisplay(triggerDisplay(job, now));
    }

    static String preview(String message) {
        if (message == null || message.length() <= PREVIEW_LENGTH) {
            return message;
        }
        return message.substring(0, PREVIEW_LENGTH - 3) + "...";
    }

    static String triggerDisplay(ReminderJob job, Instant now) {
        if (job.getStatus() == JobStatus.PAUSED) {
            return "Paused";
        }
        if (job.getStatus() == JobStatus.COMPLETED || job.getNextRunTime() == null) {
            return "Completed";
        }
        var zone = job.getTimezone() != null ? ZoneId.of(job.getTimezone()) : ZoneOffset.UTC;
        var when = DISPLAY_FORMAT.format(job.getNextRunTime().atZone(zone));
        return when + " (" + countdown(Duration.between(now, job.getNextRunTime())) + ")";
    }

    /**
     * "in 2 hours 3 minutes", "in 45 seconds", "due now"
     */
    static String countdown(Duration remaining) {
        if (remaining.isNegative() || remaining.isZero()) {
            return "due now";
        }
        var parts = new ArrayList<String>();
        addUnit(parts, remaining.toDaysPart(), "day");
        addUnit(parts, remaining.toHoursPart(), "hour");
        addUnit(parts, remaining.toMinutesPart(), "minute");
        if (parts.isEmpty()) {
            addUnit(parts, Math.max(1, remaining.toSecondsPart()), "second");
        }
        // two most significant units are enough for a list line
        return "in " + String.join(" ", parts.subList(0, Math.min(2, parts.size())));
    }

    private static void addUnit(List<String> parts, long amount, String unit) {
        if (amount > 0) {
            parts.add(amount + " " + unit + (amount == 1 ? "" : "s"));
        }
    }
}
