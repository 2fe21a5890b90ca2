package com.example.reminderscheduler.service.scheduler;

import com.example.reminderscheduler.config.MetricsConfig;
import com.example.reminderscheduler.config.ReminderSchedulerProperties;
import com.example.reminderscheduler.exception.JobStoreException;
import com.example.reminderscheduler.service.alert.NotificationSink;
import com.example.reminderscheduler.service.store.JobStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single thread that fires reminders when they become due.
 * <p>
 * Flow:
 * 1. Sleep until the earliest due time, a wake-up from a lifecycle change, or the sync period
 * 2. Pop every due entry and let {@link JobFireService} decide and advance each job
 * 3. Hand executions to the dispatch pool without waiting for them
 * 4. Put the job back in the due set at its next run time
 * 5. Periodically re-read the store so the due set cannot drift from it
 */
@Slf4j
@Service
public class SchedulerLoop {

    private final JobStore jobStore;
    private final JobFireService jobFireService;
    private final NotificationSink notificationSink;
    private final MetricsConfig metricsConfig;
    private final ReminderSchedulerProperties properties;
    private final Clock clock;

    private final DueQueue dueQueue = new DueQueue();
    private final Retry storeRetry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread loopThread;
    private Instant nextSyncAt = Instant.MIN;

    public SchedulerLoop(JobStore jobStore, JobFireService jobFireService, NotificationSink notificationSink,
                         MetricsConfig metricsConfig, ReminderSchedulerProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.jobFireService = jobFireService;
        this.notificationSink = notificationSink;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
        this.storeRetry = Retry.of("jobStore", RetryConfig.custom()
                .maxAttempts(properties.getStoreRetryMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.getStoreRetryInitialBackoffMs(), 2.0))
                .retryExceptions(JobStoreException.class, DataAccessException.class, TransactionException.class)
                .build());
        storeRetry.getEventPublisher().onRetry(event ->
                log.warn("Retrying job store call (attempt {}): {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        metricsConfig.registerDueSetGauge(dueQueue::size);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isLoopEnabled()) {
            log.info("Scheduler loop disabled by configuration");
            return;
        }
        start();
    }

    /**
     * Load the due set from the store and start the loop thread
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Scheduler loop already running");
            return;
        }
        synchronizeWithStore();

        var thread = new Thread(this::runLoop, "reminder-scheduler-loop");
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        log.info("Scheduler loop started with {} due reminders", dueQueue.size());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping scheduler loop");
        dueQueue.wakeUp();
        var thread = loopThread;
        if (thread != null) {
            try {
                thread.join(Duration.ofSeconds(10).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Scheduler loop did not stop in time, interrupting");
                thread.interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runLoop() {
        var syncPeriod = Duration.ofMillis(properties.getSyncPeriodMs());
        while (running.get()) {
            try {
                processDueJobs();
                if (!clock.instant().isBefore(nextSyncAt)) {
                    synchronizeWithStore();
                }
            } catch (Exception e) {
                log.error("Error in scheduler loop iteration: {}", e.getMessage(), e);
            }

            try {
                dueQueue.awaitNext(clock, syncPeriod);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Scheduler loop stopped");
    }

    /**
     * Fire everything due at the current clock reading.
     *
     * @return number of deliveries started
     */
    public int processDueJobs() {
        var now = clock.instant();
        var due = dueQueue.pollDue(now);
        if (due.isEmpty()) {
            log.debug("No reminders due at {}", now);
            return 0;
        }

        log.debug("Processing {} due reminders", due.size());
        var started = 0;
        for (var entry : due) {
            if (processEntry(entry, now)) {
                started++;
            }
        }
        return started;
    }

    private boolean processEntry(DueEntry entry, Instant now) {
        var jobId = entry.getJobId();
        FireDecision decision;
        try {
            decision = storeRetry.executeSupplier(() -> jobFireService.advance(entry, now));
        } catch (JobStoreException | DataAccessException | TransactionException e) {
            log.error("Giving up on reminder {} after store retries: {}", jobId, e.getMessage(), e);
            metricsConfig.recordStoreFailure("fire");
            notificationSink.storeFailure("fire " + jobId, e.getMessage());
            dueQueue.upsert(jobId, now.plusMillis(properties.getSyncPeriodMs()));
            return false;
        } catch (RuntimeException e) {
            var errorType = e.getClass().getSimpleName();
            log.error("Could not advance reminder {}: {}", jobId, e.getMessage(), e);
            metricsConfig.recordDeliveryFailure(errorType);
            notificationSink.executionFailed(jobId, errorType + ": " + e.getMessage());
            dueQueue.upsert(jobId, now.plusMillis(properties.getSyncPeriodMs()));
            return false;
        }

        switch (decision.getAction()) {
            case EXECUTE:
                log.debug("Dispatching reminder {} scheduled at {}", jobId, decision.getScheduledTime());
                jobFireService.dispatch(decision);
                break;
            case MISSED:
                log.warn("Reminder {} missed its run at {} (now {})", jobId, decision.getScheduledTime(), now);
                metricsConfig.recordMissedRun("late");
                notificationSink.missed(jobId, decision.getScheduledTime());
                break;
            case SKIPPED_IN_FLIGHT:
                log.warn("Reminder {} still delivering, skipping run at {}", jobId, decision.getScheduledTime());
                metricsConfig.recordMissedRun("in_flight");
                notificationSink.missed(jobId, decision.getScheduledTime());
                break;
            case STALE:
            default:
                break;
        }

        if (decision.getNextRunTime() != null) {
            dueQueue.upsert(jobId, decision.getNextRunTime());
        }
        return decision.getAction() == FireDecision.Action.EXECUTE;
    }

    /**
     * Rebuild the due set from the store, keeping changes made while the snapshot was read
     */
    public void synchronizeWithStore() {
        var stamp = dueQueue.stamp();
        try {
            var jobs = storeRetry.executeSupplier(jobStore::findScheduled);
            dueQueue.synchronize(jobs.stream()
                    .map(job -> new DueEntry(job.getId(), job.getNextRunTime()))
                    .toList(), stamp);
            log.debug("Due set synchronized, {} reminders scheduled", dueQueue.size());
        } catch (Exception e) {
            log.error("Could not synchronize due set with the store: {}", e.getMessage(), e);
            metricsConfig.recordStoreFailure("sync");
            notificationSink.storeFailure("sync", e.getMessage());
        }
        nextSyncAt = clock.instant().plusMillis(properties.getSyncPeriodMs());
    }

    // === Lifecycle notifications ===

    /**
     * A job was added or its next run time changed
     */
    public void jobScheduled(String jobId, Instant nextRunTime) {
        dueQueue.upsert(jobId, nextRunTime);
    }

    /**
     * A job was paused, completed or removed
     */
    public void jobUnscheduled(String jobId) {
        dueQueue.remove(jobId);
    }

    public Optional<Instant> nextDueTime() {
        return dueQueue.peekNextDueTime();
    }

    public Optional<Instant> dueTimeOf(String jobId) {
        return dueQueue.dueTimeOf(jobId);
    }

    public int dueCount() {
        return dueQueue.size();
    }
}
