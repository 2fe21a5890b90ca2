package com.example.reminderscheduler.service.alert;

import com.example.reminderscheduler.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.SlackConfig;
import com.slack.api.util.http.SlackHttpClient;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Sends scheduler anomalies to a Slack incoming webhook.
 * <p>
 * Runs asynchronously; delivery problems are logged and never reach the scheduler loop.
 */
@Slf4j
@Service
public class SlackNotificationSink implements NotificationSink {

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:reminder-scheduler}")
    private String applicationName = "reminder-scheduler";

    @Autowired
    public SlackNotificationSink(SlackProperties slackProperties) {
        this(slackProperties, createSlack(slackProperties.getTimeoutSeconds()));
    }

    SlackNotificationSink(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    private static Slack createSlack(int timeoutSeconds) {
        var okHttpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        return Slack.getInstance(new SlackConfig(), new SlackHttpClient(okHttpClient));
    }

    @Async
    @Override
    public void missed(String jobId, Instant scheduledTime) {
        var text = formatMissed(jobId, scheduledTime);
        send(text, "warning", List.of(
                field("Reminder ID", jobId, true),
                field("Scheduled For", DATE_FORMATTER.format(scheduledTime), true)));
    }

    @Async
    @Override
    public void executionFailed(String jobId, String errorDescription) {
        var text = formatExecutionFailed(jobId);
        send(text, "danger", List.of(
                field("Reminder ID", jobId, true),
                field("Error", "```" + truncate(errorDescription, 400) + "```", false)));
    }

    @Async
    @Override
    public void storeFailure(String operation, String errorDescription) {
        var text = formatStoreFailure(operation);
        send(text, "danger", List.of(
                field("Operation", operation, true),
                field("Error", "```" + truncate(errorDescription, 400) + "```", false)));
    }

    static String formatMissed(String jobId, Instant scheduledTime) {
        return ":alarm_clock: *Reminder `" + jobId + "` missed its run at " + DATE_FORMATTER.format(scheduledTime) + "*";
    }

    static String formatExecutionFailed(String jobId) {
        return ":rotating_light: *Reminder `" + jobId + "` could not be delivered*";
    }

    static String formatStoreFailure(String operation) {
        return ":rotating_light: *Reminder store unavailable during " + operation + " - retries exhausted*";
    }

    private void send(String text, String color, List<Field> fields) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Alert not sent: {}", text);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":alarm_clock:")
                    .text(text)
                    .attachments(List.of(
                            Attachment.builder()
                                    .color(color)
                                    .fields(fields)
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.debug("Slack alert sent: {}", text);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert: {}", e.getMessage(), e);
        }
    }

    private static Field field(String title, String value, boolean shortValue) {
        return Field.builder()
                .title(title)
                .value(value)
                .valueShortEnough(shortValue)
                .build();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
