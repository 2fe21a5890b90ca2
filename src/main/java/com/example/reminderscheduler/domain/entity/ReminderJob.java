package com.example.reminderscheduler.domain.entity;

import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TargetKind;
import com.example.reminderscheduler.domain.enums.TriggerType;
import com.example.reminderscheduler.domain.trigger.CronTrigger;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.domain.trigger.Trigger;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Persisted reminder job.
 * <p>
 * Trigger parameters are stored as typed columns, one group per trigger type, so a
 * trigger read back through {@link #getTrigger()} equals the one that was written.
 */
@Entity
@Table(name = "reminder_jobs", indexes = {
        @Index(name = "idx_reminder_status_next_run", columnList = "status, next_run_time"),
        @Index(name = "idx_reminder_target_id", columnList = "target_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ReminderJob {

    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType triggerType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    /**
     * Next instant the job is due. Kept (but not due) for paused one-shot jobs,
     * null for paused or completed recurring jobs.
     */
    @Column(name = "next_run_time")
    private Instant nextRunTime;

    @Column(name = "misfire_grace_seconds", nullable = false)
    private Integer misfireGraceSeconds;

    // === Trigger Columns ===

    @Column(name = "run_date")
    private Instant runDate;

    @Column(name = "cron_year", length = 100)
    private String cronYear;

    @Column(name = "cron_month", length = 100)
    private String cronMonth;

    @Column(name = "cron_day", length = 100)
    private String cronDay;

    @Column(name = "cron_week", length = 100)
    private String cronWeek;

    @Column(name = "cron_day_of_week", length = 100)
    private String cronDayOfWeek;

    @Column(name = "cron_hour", length = 100)
    private String cronHour;

    @Column(name = "cron_minute", length = 100)
    private String cronMinute;

    @Column(name = "cron_second", length = 100)
    private String cronSecond;

    @Column(name = "interval_weeks")
    private Integer intervalWeeks;

    @Column(name = "interval_days")
    private Integer intervalDays;

    @Column(name = "interval_hours")
    private Integer intervalHours;

    @Column(name = "interval_minutes")
    private Integer intervalMinutes;

    @Column(name = "interval_seconds")
    private Integer intervalSeconds;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "jitter_seconds")
    private Integer jitterSeconds;

    // === Payload Columns ===

    @Enumerated(EnumType.STRING)
    @Column(name = "target_kind", nullable = false, length = 20)
    private TargetKind targetKind;

    @Column(name = "target_id", nullable = false, length = 100)
    private String targetId;

    @Column(name = "message", nullable = false, length = 4000)
    private String message;

    @Column(name = "author_id", length = 100)
    private String authorId;

    // === Run History ===

    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private Integer runCount = 0;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = JobStatus.SCHEDULED;
        }
        if (this.runCount == null) {
            this.runCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Rebuild the trigger value from its columns
     */
    public Trigger getTrigger() {
        var zone = timezone != null ? ZoneId.of(timezone) : ZoneOffset.UTC;
        switch (triggerType) {
            case DATE:
                return DateTrigger.builder()
                        .runDate(runDate)
                        .zone(zone)
                        .build();
            case CRON:
                return CronTrigger.builder()
                        .year(cronYear)
                        .month(cronMonth)
                        .day(cronDay)
                        .week(cronWeek)
                        .dayOfWeek(cronDayOfWeek)
                        .hour(cronHour)
                        .minute(cronMinute)
                        .second(cronSecond)
                        .zone(zone)
                        .startDate(startDate)
                        .endDate(endDate)
                        .jitterSeconds(jitterSeconds)
                        .build();
            case INTERVAL:
                return IntervalTrigger.builder()
                        .weeks(valueOrZero(intervalWeeks))
                        .days(valueOrZero(intervalDays))
                        .hours(valueOrZero(intervalHours))
                        .minutes(valueOrZero(intervalMinutes))
                        .seconds(valueOrZero(intervalSeconds))
                        .zone(zone)
                        .startDate(startDate)
                        .endDate(endDate)
                        .jitterSeconds(jitterSeconds)
                        .build();
            default:
                throw new IllegalStateException("Unsupported trigger type: " + triggerType);
        }
    }

    /**
     * Replace all trigger columns with the given trigger's parameters
     */
    public void setTrigger(Trigger trigger) {
        clearTriggerColumns();
        this.triggerType = trigger.getType();
        this.timezone = trigger.getZone().getId();
        switch (trigger.getType()) {
            case DATE:
                this.runDate = ((DateTrigger) trigger).getRunDate();
                break;
            case CRON:
                var cron = (CronTrigger) trigger;
                this.cronYear = cron.getYear();
                this.cronMonth = cron.getMonth();
                this.cronDay = cron.getDay();
                this.cronWeek = cron.getWeek();
                this.cronDayOfWeek = cron.getDayOfWeek();
                this.cronHour = cron.getHour();
                this.cronMinute = cron.getMinute();
                this.cronSecond = cron.getSecond();
                this.startDate = cron.getStartDate();
                this.endDate = cron.getEndDate();
                this.jitterSeconds = cron.getJitterSeconds();
                break;
            case INTERVAL:
                var interval = (IntervalTrigger) trigger;
                this.intervalWeeks = interval.getWeeks();
                this.intervalDays = interval.getDays();
                this.intervalHours = interval.getHours();
                this.intervalMinutes = interval.getMinutes();
                this.intervalSeconds = interval.getSeconds();
                this.startDate = interval.getStartDate();
                this.endDate = interval.getEndDate();
                this.jitterSeconds = interval.getJitterSeconds();
                break;
            default:
                throw new IllegalStateException("Unsupported trigger type: " + trigger.getType());
        }
    }

    public ReminderPayload getPayload() {
        return ReminderPayload.builder()
                .targetKind(targetKind)
                .targetId(targetId)
                .message(message)
                .authorId(authorId)
                .build();
    }

    public void setPayload(ReminderPayload payload) {
        this.targetKind = payload.getTargetKind();
        this.targetId = payload.getTargetId();
        this.message = payload.getMessage();
        this.authorId = payload.getAuthorId();
    }

    public boolean isOneShot() {
        return triggerType == TriggerType.DATE;
    }

    /**
     * Check if the job should be in the scheduler's due set
     */
    public boolean isDue() {
        return status == JobStatus.SCHEDULED && nextRunTime != null;
    }

    /**
     * A one-shot job with nothing left to run is deleted instead of being kept
     */
    public boolean isDisposable() {
        return isOneShot() && status == JobStatus.COMPLETED;
    }

    public void markCompleted() {
        this.status = JobStatus.COMPLETED;
        this.nextRunTime = null;
    }

    public void recordRun(Instant ranAt) {
        this.runCount = (runCount == null ? 0 : runCount) + 1;
        this.lastRunAt = ranAt;
    }

    /**
     * Detached copy, used wherever a job leaves the store's unit of work
     */
    public ReminderJob copy() {
        return toBuilder().build();
    }

    private void clearTriggerColumns() {
        this.runDate = null;
        this.cronYear = null;
        this.cronMonth = null;
        this.cronDay = null;
        this.cronWeek = null;
        this.cronDayOfWeek = null;
        this.cronHour = null;
        this.cronMinute = null;
        this.cronSecond = null;
        this.intervalWeeks = null;
        this.intervalDays = null;
        this.intervalHours = null;
        this.intervalMinutes = null;
        this.intervalSeconds = null;
        this.startDate = null;
        this.endDate = null;
        this.jitterSeconds = null;
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
