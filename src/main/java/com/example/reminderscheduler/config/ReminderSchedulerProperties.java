package com.example.reminderscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the reminder scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reminder-scheduler")
public class ReminderSchedulerProperties {

    /**
     * Start the scheduler loop thread on application ready
     */
    private boolean loopEnabled = true;

    /**
     * Zone used for triggers and dates that do not name one
     */
    @NotBlank
    private String defaultTimezone = "UTC";

    /**
     * How late a run may start before it is reported as missed instead
     */
    @Min(0)
    private int defaultMisfireGraceSeconds = 60;

    /**
     * Upper bound on a single delivery, after which it counts as failed
     */
    @Min(1)
    private int dispatchTimeoutSeconds = 30;

    /**
     * Number of concurrent delivery threads
     */
    @Min(1)
    private int dispatchPoolSize = 8;

    /**
     * Longest the loop sleeps before re-reading the store
     */
    @Min(1000)
    private long syncPeriodMs = 60000;

    @Min(1)
    private int storeRetryMaxAttempts = 3;

    @Min(1)
    private long storeRetryInitialBackoffMs = 500;
}
