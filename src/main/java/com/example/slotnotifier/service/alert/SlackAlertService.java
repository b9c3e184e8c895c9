package com.example.slotnotifier.service.alert;

import com.example.slotnotifier.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Sends operational alerts to Slack: notifications that could not be
 * delivered and failures of the scheduler's background jobs.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack = Slack.getInstance();

    @Value("${spring.application.name:slot-notifier}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this.slackProperties = slackProperties;
    }

    /**
     * Alert for a notification that exhausted its delivery attempts.
     * Runs asynchronously so the fire is not held up.
     */
    @Async
    public void sendDeliveryFailedAlert(String jobId, String destination, Integer attempts, String lastError) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Delivery for job {} failed but no alert was sent.", jobId);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":rotating_light:")
                    .text(":rotating_light: *Slot notification could not be delivered*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .title("Job " + jobId)
                                    .titleLink(slackProperties.getDashboardBaseUrl() + "/" + destination + "/executions")
                                    .fields(List.of(
                                            Field.builder()
                                                    .title("Destination")
                                                    .value(destination)
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Attempts")
                                                    .value(String.valueOf(attempts))
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Last Error")
                                                    .value("```" + truncate(lastError, 400) + "```")
                                                    .valueShortEnough(false)
                                                    .build()
                                    ))
                                    .footer(applicationName + " | The job stays scheduled for its next occurrence")
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed delivery of job {}", jobId);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
