package com.example.reminderscheduler.service;

import com.example.reminderscheduler.config.ReminderSchedulerProperties;
import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TriggerType;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.domain.trigger.Trigger;
import com.example.reminderscheduler.dto.EditReminderRequest;
import com.example.reminderscheduler.dto.JobSnapshot;
import com.example.reminderscheduler.exception.InvalidJobStateException;
import com.example.reminderscheduler.exception.InvalidTriggerException;
import com.example.reminderscheduler.mapper.JobMapper;
import com.example.reminderscheduler.service.parse.DateTimeParser;
import com.example.reminderscheduler.service.scheduler.SchedulerLoop;
import com.example.reminderscheduler.service.store.JobStore;
import com.example.reminderscheduler.service.trigger.TriggerEvaluator;
import com.example.reminderscheduler.service.trigger.TriggerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Service for reminder lifecycle operations.
 * <p>
 * Provides:
 * - Scheduling new reminders
 * - Listing and reading reminders
 * - Pause, resume, reschedule and trigger replacement
 * - Payload changes and snapshot edits
 * - Removal
 * <p>
 * Each operation is one store update under the job's lock; timing changes are then
 * pushed to the scheduler loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderLifecycleService {

    private final JobStore jobStore;
    private final TriggerEvaluator triggerEvaluator;
    private final TriggerFactory triggerFactory;
    private final DateTimeParser dateTimeParser;
    private final SchedulerLoop schedulerLoop;
    private final JobMapper jobMapper;
    private final ReminderSchedulerProperties properties;
    private final Clock clock;

    // === Creation ===

    /**
     * Schedule a new reminder
     *
     * @param id optional caller-chosen id, generated when null
     */
    public JobSnapshot add(String id, Trigger trigger, ReminderPayload payload, Integer misfireGraceSeconds) {
        var now = clock.instant();
        triggerEvaluator.validate(trigger);
        var effectiveTrigger = anchorInterval(trigger, now);
        var nextRunTime = firstRunTime(effectiveTrigger, now);

        var job = ReminderJob.builder()
                .id(id != null ? id : generateId())
                .status(JobStatus.SCHEDULED)
                .nextRunTime(nextRunTime)
                .misfireGraceSeconds(misfireGraceSeconds != null
                        ? misfireGraceSeconds
                        : properties.getDefaultMisfireGraceSeconds())
                .build();
        job.setTrigger(effectiveTrigger);
        job.setPayload(payload);

        var saved = jobStore.create(job);
        schedulerLoop.jobScheduled(saved.getId(), nextRunTime);
        log.info("Scheduled {} reminder {} for {} {}, first run at {}", trigger.getType().getCode(), saved.getId(),
                payload.getTargetKind().getCode(), payload.getTargetId(), nextRunTime);

        return toSnapshot(saved);
    }

    // === Retrieval ===

    public JobSnapshot get(String id) {
        return toSnapshot(jobStore.read(id));
    }

    public List<JobSnapshot> list() {
        return jobMapper.toSnapshots(jobStore.list(), clock.instant());
    }

    public Page<JobSnapshot> list(Pageable pageable) {
        var now = clock.instant();
        return jobStore.list(pageable).map(job -> jobMapper.toSnapshot(job, now));
    }

    /**
     * Reminders delivered to any of the given targets, e.g. the channels of one server
     */
    public Page<JobSnapshot> listByTargets(Collection<String> targetIds, Pageable pageable) {
        var now = clock.instant();
        return jobStore.listByTargets(targetIds, pageable).map(job -> jobMapper.toSnapshot(job, now));
    }

    // === State Management ===

    /**
     * Stop a reminder from firing until resumed. One-shot reminders keep their run date.
     */
    public JobSnapshot pause(String id) {
        var job = jobStore.update(id, current -> {
            if (current.getStatus() == JobStatus.COMPLETED) {
                throw new InvalidJobStateException(id, current.getStatus().name(), JobStatus.PAUSED.name());
            }
            if (current.getStatus() == JobStatus.PAUSED) {
                return;
            }
            current.setStatus(JobStatus.PAUSED);
            if (!current.isOneShot()) {
                current.setNextRunTime(null);
            }
        });
        schedulerLoop.jobUnscheduled(id);
        log.info("Paused reminder {}", id);

        return toSnapshot(job);
    }

    /**
     * Resume a paused reminder. Recurring reminders continue from now; a one-shot
     * reminder whose run date passed while paused is handled by the misfire policy.
     */
    public JobSnapshot resume(String id) {
        var now = clock.instant();
        var job = jobStore.update(id, current -> {
            if (current.getStatus() != JobStatus.PAUSED) {
                return;
            }
            var next = current.isOneShot()
                    ? current.getRunDate()
                    : triggerEvaluator.nextFireTime(current.getTrigger(), null, now).orElse(null);
            if (next == null) {
                current.markCompleted();
                return;
            }
            current.setStatus(JobStatus.SCHEDULED);
            current.setNextRunTime(next);
        });
        notifyLoop(job);
        log.info("Resumed reminder {}, status {}, next run at {}", id, job.getStatus(), job.getNextRunTime());

        return toSnapshot(job);
    }

    /**
     * Move a one-shot reminder to a new run date
     */
    public JobSnapshot reschedule(String id, Instant newRunDate) {
        requireFutureRunDate(newRunDate);

        var job = jobStore.update(id, current -> moveRunDate(current, newRunDate));
        notifyLoop(job);
        log.info("Rescheduled reminder {} to {}", id, newRunDate);

        return toSnapshot(job);
    }

    /**
     * Replace the schedule of any reminder. A paused reminder stays paused; a completed one
     * is scheduled again.
     */
    public JobSnapshot replaceTrigger(String id, Trigger trigger) {
        var now = clock.instant();
        triggerEvaluator.validate(trigger);
        var effectiveTrigger = anchorInterval(trigger, now);
        var nextRunTime = firstRunTime(effectiveTrigger, now);

        var job = jobStore.update(id, current -> {
            current.setTrigger(effectiveTrigger);
            if (current.getStatus() == JobStatus.PAUSED) {
                current.setNextRunTime(effectiveTrigger.getType() == TriggerType.DATE ? nextRunTime : null);
            } else {
                current.setStatus(JobStatus.SCHEDULED);
                current.setNextRunTime(nextRunTime);
            }
        });
        notifyLoop(job);
        log.info("Replaced trigger of reminder {} with {} trigger, next run at {}", id,
                trigger.getType().getCode(), job.getNextRunTime());

        return toSnapshot(job);
    }

    /**
     * Replace what a reminder delivers without touching its schedule
     */
    public JobSnapshot modifyPayload(String id, ReminderPayload payload) {
        var job = jobStore.update(id, current -> {
            var authorId = payload.getAuthorId() != null ? payload.getAuthorId() : current.getAuthorId();
            current.setPayload(payload.toBuilder().authorId(authorId).build());
        });
        log.info("Updated payload of reminder {}", id);

        return toSnapshot(job);
    }

    /**
     * Apply an edit made on a displayed snapshot. Every supplied field is validated and
     * applied, even when it equals the current value.
     */
    public JobSnapshot edit(String id, EditReminderRequest request) {
        var message = request.getMessage();
        if (message != null && message.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        Instant newRunDate = null;
        if (request.getRunDate() != null) {
            var zone = request.getTimezone() != null
                    ? triggerFactory.resolveZone(request.getTimezone())
                    : jobStore.read(id).getTrigger().getZone();
            newRunDate = dateTimeParser.parse(request.getRunDate(), zone);
            requireFutureRunDate(newRunDate);
        }
        if (newRunDate == null && message == null) {
            return get(id);
        }

        var runDate = newRunDate;
        var job = jobStore.update(id, current -> {
            if (runDate != null) {
                moveRunDate(current, runDate);
            }
            if (message != null) {
                current.setMessage(message);
            }
        });
        if (runDate != null) {
            notifyLoop(job);
        }
        log.info("Edited reminder {}, run date {}, message {}", id,
                runDate != null ? runDate : "unchanged", message != null ? "replaced" : "unchanged");

        return toSnapshot(job);
    }

    // === Removal ===

    /**
     * Delete a reminder. A delivery already running is not aborted.
     *
     * @return the reminder as it was before removal
     */
    public JobSnapshot remove(String id) {
        var job = jobStore.read(id);
        jobStore.delete(id);
        schedulerLoop.jobUnscheduled(id);
        log.info("Removed reminder {}", id);

        return toSnapshot(job);
    }

    // === Helpers ===

    private void requireFutureRunDate(Instant runDate) {
        if (runDate == null || !runDate.isAfter(clock.instant())) {
            throw new InvalidTriggerException("runDate", "new run date must be in the future");
        }
    }

    private static void moveRunDate(ReminderJob job, Instant runDate) {
        if (!job.isOneShot()) {
            throw new InvalidTriggerException("type",
                    "only one-shot reminders have a single run date; replace the trigger instead");
        }
        var trigger = (DateTrigger) job.getTrigger();
        job.setTrigger(trigger.toBuilder().runDate(runDate).build());
        job.setNextRunTime(runDate);
    }

    /**
     * An interval without a start date is anchored at creation time, so later
     * recomputations (resume, restart) stay on the same grid
     */
    private Trigger anchorInterval(Trigger trigger, Instant now) {
        if (trigger instanceof IntervalTrigger interval && interval.getStartDate() == null) {
            return interval.toBuilder().startDate(now).build();
        }
        return trigger;
    }

    private Instant firstRunTime(Trigger trigger, Instant now) {
        return triggerEvaluator.nextFireTime(trigger, null, now)
                .orElseThrow(() -> new InvalidTriggerException("nextRunTime", "trigger never fires after " + now));
    }

    private void notifyLoop(ReminderJob job) {
        if (job.isDue()) {
            schedulerLoop.jobScheduled(job.getId(), job.getNextRunTime());
        } else {
            schedulerLoop.jobUnscheduled(job.getId());
        }
    }

    private JobSnapshot toSnapshot(ReminderJob job) {
        return jobMapper.toSnapshot(job, clock.instant());
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
