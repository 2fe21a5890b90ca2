package com.example.reminderscheduler.service.scheduler;

import com.example.reminderscheduler.config.MetricsConfig;
import com.example.reminderscheduler.config.ReminderSchedulerProperties;
import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.exception.JobNotFoundException;
import com.example.reminderscheduler.service.alert.NotificationSink;
import com.example.reminderscheduler.service.dispatch.DeliveryResult;
import com.example.reminderscheduler.service.dispatch.MessageDispatcher;
import com.example.reminderscheduler.service.store.JobStore;
import com.example.reminderscheduler.service.trigger.TriggerEvaluator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires individual due jobs.
 * <p>
 * Handles:
 * - Deciding between run, miss and skip under the job's store lock
 * - Advancing the job to its next future run, or finishing it
 * - Handing the delivery to the dispatch executor with a bounded timeout
 * - Recording the delivery outcome, metrics and alerts
 */
@Slf4j
@Service
public class JobFireService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final JobStore jobStore;
    private final TriggerEvaluator triggerEvaluator;
    private final MessageDispatcher messageDispatcher;
    private final NotificationSink notificationSink;
    private final MetricsConfig metricsConfig;
    private final ReminderSchedulerProperties properties;
    private final Executor dispatchExecutor;

    /**
     * Ids whose delivery is still running; at most one delivery per id at a time
     */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobFireService(JobStore jobStore, TriggerEvaluator triggerEvaluator, MessageDispatcher messageDispatcher,
                          NotificationSink notificationSink, MetricsConfig metricsConfig,
                          ReminderSchedulerProperties properties,
                          @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        this.jobStore = jobStore;
        this.triggerEvaluator = triggerEvaluator;
        this.messageDispatcher = messageDispatcher;
        this.notificationSink = notificationSink;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Re-read the job behind {@code entry} under its lock, decide what this run does and
     * move the job to its next future run time in the same unit of work.
     */
    public FireDecision advance(DueEntry entry, Instant now) {
        var decision = new AtomicReference<FireDecision>();
        try {
            jobStore.update(entry.getJobId(), job -> decision.set(decide(job, entry, now)));
        } catch (JobNotFoundException e) {
            log.debug("Reminder {} was removed before it fired", entry.getJobId());
            return FireDecision.stale(entry.getJobId(), null);
        }
        return decision.get();
    }

    private FireDecision decide(ReminderJob job, DueEntry entry, Instant now) {
        var jobId = job.getId();
        if (!job.isDue()) {
            log.debug("Reminder {} is {} and no longer due", jobId, job.getStatus());
            return FireDecision.stale(jobId, null);
        }
        if (!entry.getDueAt().equals(job.getNextRunTime())) {
            log.debug("Reminder {} moved from {} to {}", jobId, entry.getDueAt(), job.getNextRunTime());
            return FireDecision.stale(jobId, job.getNextRunTime());
        }

        var scheduledTime = job.getNextRunTime();
        FireDecision.Action action;
        if (Duration.between(scheduledTime, now).compareTo(Duration.ofSeconds(graceSeconds(job))) > 0) {
            action = FireDecision.Action.MISSED;
            job.setLastError("Missed run scheduled at " + scheduledTime);
        } else if (inFlight.contains(jobId)) {
            action = FireDecision.Action.SKIPPED_IN_FLIGHT;
            job.setLastError("Skipped run scheduled at " + scheduledTime + ", previous delivery still running");
        } else {
            action = FireDecision.Action.EXECUTE;
            job.recordRun(now);
        }

        var next = triggerEvaluator.nextFutureFireTime(job.getTrigger(), scheduledTime, now);
        if (next.isPresent()) {
            job.setNextRunTime(next.get());
        } else {
            log.info("Reminder {} has no further runs, {}", jobId, job.isOneShot() ? "removing" : "completing");
            job.markCompleted();
        }

        return FireDecision.builder()
                .jobId(jobId)
                .action(action)
                .triggerType(job.getTriggerType())
                .scheduledTime(scheduledTime)
                .nextRunTime(job.getNextRunTime())
                .payload(job.getPayload())
                .build();
    }

    private int graceSeconds(ReminderJob job) {
        return job.getMisfireGraceSeconds() != null
                ? job.getMisfireGraceSeconds()
                : properties.getDefaultMisfireGraceSeconds();
    }

    /**
     * Start delivering an {@link FireDecision.Action#EXECUTE} decision without waiting for it.
     * The returned future completes with the outcome and never completes exceptionally.
     */
    public CompletableFuture<DeliveryResult> dispatch(FireDecision decision) {
        var jobId = decision.getJobId();
        if (!inFlight.add(jobId)) {
            log.warn("Reminder {} is still being delivered, skipping run at {}", jobId, decision.getScheduledTime());
            metricsConfig.recordMissedRun("in_flight");
            notificationSink.missed(jobId, decision.getScheduledTime());
            return CompletableFuture.completedFuture(
                    DeliveryResult.failure("Previous delivery still running", "IN_FLIGHT"));
        }

        var timerSample = metricsConfig.startDeliveryTimer();
        var delivery = new CompletableFuture<DeliveryResult>();
        try {
            dispatchExecutor.execute(() -> {
                // the timeout covers the delivery itself, not the wait in the dispatch queue
                delivery.orTimeout(properties.getDispatchTimeoutSeconds(), TimeUnit.SECONDS);
                try {
                    delivery.complete(messageDispatcher.deliver(decision.getPayload()));
                } catch (RuntimeException e) {
                    delivery.completeExceptionally(e);
                } finally {
                    inFlight.remove(jobId);
                }
            });
            return delivery.handle((result, error) -> {
                var outcome = error != null ? failureOf(error)
                        : result != null ? result
                        : DeliveryResult.failure("Dispatcher returned no result", "NO_RESULT");
                completeDelivery(decision, outcome, timerSample);
                return outcome;
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            var outcome = DeliveryResult.failure("Dispatch queue is full", "REJECTED");
            completeDelivery(decision, outcome, timerSample);
            return CompletableFuture.completedFuture(outcome);
        }
    }

    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    private DeliveryResult failureOf(Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return DeliveryResult.failure(
                    "Delivery timed out after " + properties.getDispatchTimeoutSeconds() + "s", "TIMEOUT");
        }
        return DeliveryResult.failure(String.valueOf(cause.getMessage()), cause.getClass().getSimpleName());
    }

    private void completeDelivery(FireDecision decision, DeliveryResult outcome, Timer.Sample timerSample) {
        var jobId = decision.getJobId();
        metricsConfig.recordDelivery(timerSample, decision.getTriggerType(), outcome.isSuccess());

        if (outcome.isSuccess()) {
            log.info("Reminder {} delivered (message {})", jobId, outcome.getMessageId());
            recordOutcome(jobId, null);
            return;
        }

        var description = outcome.describeFailure();
        log.warn("Reminder {} delivery failed: {}", jobId, description);
        metricsConfig.recordDeliveryFailure(outcome.getErrorType());
        notificationSink.executionFailed(jobId, description);
        recordOutcome(jobId, description);
    }

    /**
     * Store the last delivery error. Finished one-shot jobs are already gone by now.
     */
    private void recordOutcome(String jobId, String error) {
        try {
            jobStore.update(jobId, job -> job.setLastError(truncate(error)));
        } catch (JobNotFoundException e) {
            log.debug("Reminder {} no longer stored, delivery outcome not recorded", jobId);
        } catch (Exception e) {
            log.warn("Could not record delivery outcome of reminder {}: {}", jobId, e.getMessage());
        }
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
