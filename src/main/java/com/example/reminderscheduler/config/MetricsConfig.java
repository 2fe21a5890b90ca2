package com.example.reminderscheduler.config;

import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TriggerType;
import com.example.reminderscheduler.exception.JobStoreException;
import com.example.reminderscheduler.service.store.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Metrics configuration for monitoring reminder scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status
 * - Due set size
 * - Delivery times and failures
 * - Missed runs and store failures
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobStore jobStore;

    private final ConcurrentHashMap<JobStatus, AtomicLong> jobCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            jobCounters.put(status, new AtomicLong(0));

            Gauge.builder("reminder_scheduler_jobs", jobCounters.get(status), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of reminder jobs by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from the store
     */
    @Scheduled(fixedDelayString = "${reminder-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : JobStatus.values()) {
                jobCounters.computeIfAbsent(status, s -> new AtomicLong()).set(jobStore.countByStatus(status));
            }
        } catch (JobStoreException e) {
            log.warn("Could not refresh job metrics: {}", e.getMessage());
        }
    }

    /**
     * Expose the in-memory due set size, owned by the scheduler loop
     */
    public void registerDueSetGauge(Supplier<Number> dueSetSize) {
        Gauge.builder("reminder_scheduler_due_jobs", dueSetSize)
                .description("Number of jobs waiting in the due set")
                .register(meterRegistry);
    }

    public Timer.Sample startDeliveryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDelivery(Timer.Sample sample, TriggerType triggerType, boolean success) {
        sample.stop(Timer.builder("reminder_scheduler_delivery_time")
                .tag("trigger", triggerType.getCode())
                .tag("success", String.valueOf(success))
                .description("Reminder delivery time")
                .register(meterRegistry));
    }

    public void recordDeliveryFailure(String errorType) {
        meterRegistry.counter("reminder_scheduler_delivery_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * @param reason {@code late} or {@code in_flight}
     */
    public void recordMissedRun(String reason) {
        meterRegistry.counter("reminder_scheduler_missed_runs", "reason", reason).increment();
    }

    public void recordStoreFailure(String operation) {
        meterRegistry.counter("reminder_scheduler_store_failures", "operation", operation).increment();
    }
}
