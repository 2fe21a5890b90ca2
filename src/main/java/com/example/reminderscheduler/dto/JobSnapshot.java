package com.example.reminderscheduler.dto;

import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TargetKind;
import com.example.reminderscheduler.domain.enums.TriggerType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a reminder job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSnapshot {

    private String id;
    private TriggerType triggerType;
    private JobStatus status;
    private Instant nextRunTime;

    /**
     * e.g. {@code 2030-01-01 09:00 (in 2 hours 3 minutes)}, {@code Paused} or {@code Completed}
     */
    private String triggerDisplay;

    private Instant runDate;
    private String cronYear;
    private String cronMonth;
    private String cronDay;
    private String cronWeek;
    private String cronDayOfWeek;
    private String cronHour;
    private String cronMinute;
    private String cronSecond;
    private Integer intervalWeeks;
    private Integer intervalDays;
    private Integer intervalHours;
    private Integer intervalMinutes;
    private Integer intervalSeconds;
    private String timezone;
    private Instant startDate;
    private Instant endDate;
    private Integer jitterSeconds;

    private TargetKind targetKind;
    private String targetId;
    private String message;

    /**
     * Message cut to list width
     */
    private String messagePreview;

    private String authorId;
    private Integer misfireGraceSeconds;
    private Integer runCount;
    private Instant lastRunAt;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
}
