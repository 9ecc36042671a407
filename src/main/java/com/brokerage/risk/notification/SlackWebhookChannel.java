package com.brokerage.risk.notification;

import com.brokerage.risk.config.NotificationConfig;
import com.brokerage.risk.exception.NotificationDeliveryException;
import com.brokerage.risk.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to a Slack-compatible incoming webhook as a coloured attachment.
 */
@Component
public class SlackWebhookChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookChannel.class);

    private final NotificationConfig.Slack config;
    private final RestTemplate restTemplate;
    private final AlertMessageFormatter formatter;

    public SlackWebhookChannel(NotificationConfig notificationConfig,
                               @Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                               AlertMessageFormatter formatter) {
        this.config = notificationConfig.getSlack();
        this.restTemplate = restTemplate;
        this.formatter = formatter;
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank();
    }

    @Override
    public void deliver(Alert alert) {
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    config.getWebhookUrl(), buildPayload(alert), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new NotificationDeliveryException(getName(),
                        "Slack webhook returned " + response.getStatusCode());
            }
            log.debug("Slack notification sent for alert={}", alert.getAlertId());
        } catch (RestClientException e) {
            throw new NotificationDeliveryException(getName(), "Slack webhook call failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> buildPayload(Alert alert) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", formatter.color(alert.getSeverity()));
        attachment.put("title", formatter.title(alert));
        attachment.put("text", alert.getMessage());
        attachment.put("fields", List.of(
                field("Entity", alert.getEntityType() + ": " + alert.getEntityId()),
                field("Threshold", formatter.formatValue(alert, alert.getThresholdValue())),
                field("Current Value", formatter.formatValue(alert, alert.getCurrentValue()))));
        attachment.put("footer", "Risk Alert Engine");
        attachment.put("ts", alert.getTimestamp() / 1000);
        return Map.of("attachments", List.of(attachment));
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }
}
