package com.example.reminderscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reminder Scheduler Service
 * <p>
 * Schedules one-shot, cron and interval reminders, delivers them through a chat
 * gateway when due, and reports missed or failed runs to Slack.
 */
@EnableScheduling
@SpringBootApplication
public class ReminderSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReminderSchedulerApplication.class, args);
    }
}
