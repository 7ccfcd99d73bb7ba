package com.example.jobrunner.service.alert;

import com.example.jobrunner.config.SlackProperties;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.entity.CronJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending alerts to Slack when cron jobs keep failing
 * or high-priority tasks fail.
 * <p>
 * Alerts never affect the outcome of a run: delivery errors are logged and dropped.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:job-runner}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a cron job whose failure count reached the alert threshold.
     * Runs asynchronously to not block the runner.
     */
    @Async
    public void sendCronJobFailureAlert(CronJob job, String errorMessage) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Cron job {} has failed {} times but no alert was sent.",
                    job.getName(), job.getFailureCount());
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Cron Job Failing - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getName() + " (" + job.getFunctionName() + ")")
                                .titleLink(buildLink("/cron-jobs/" + job.getId()))
                                .fields(Arrays.asList(
                                        field("Job ID", String.valueOf(job.getId()), true),
                                        field("Schedule", job.getScheduleExpression(), true),
                                        field("Failures", String.valueOf(job.getFailureCount()), true),
                                        field("Successful Runs", String.valueOf(job.getExecutionCount()), true),
                                        field("Last Error", "```" + truncate(errorMessage, 400) + "```", false)
                                ))
                                .footer(applicationName + " | The job stays overdue and is retried on every scan")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "cron job " + job.getName());
    }

    /**
     * Send task failure alert (for high-priority tasks)
     */
    @Async
    public void sendTaskFailureAlert(AutomatedTask task, String errorMessage) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Task {} failed but no alert was sent.", task.getId());
            return;
        }

        var title = task.getTaskName() != null ? task.getTaskName() : task.getTaskType();
        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *Automated Task Failed*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .title("Task: " + title)
                                .titleLink(buildLink("/tasks/" + task.getId()))
                                .fields(Arrays.asList(
                                        field("Task ID", String.valueOf(task.getId()), true),
                                        field("Type", task.getTaskType(), true),
                                        field("Priority", String.valueOf(task.getPriority()), true),
                                        field("Recurring", task.getRecurring() != null ? task.getRecurring().getCode() : "none", true),
                                        field("Error", truncate(errorMessage, 300), false)
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "task " + task.getId());
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private void send(Payload payload, String subject) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}", subject, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", subject);
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for {}: {}", subject, e.getMessage(), e);
        }
    }

    private static Field field(String title, String value, boolean shortField) {
        return Field.builder()
                .title(title)
                .value(value)
                .valueShortEnough(shortField)
                .build();
    }

    private String buildLink(String path) {
        var base = slackProperties.getDashboardUrl();
        return base == null || base.isBlank() ? null : base + path;
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
