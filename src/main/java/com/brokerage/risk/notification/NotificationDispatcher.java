package com.brokerage.risk.notification;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.model.Alert;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans an alert out to every enabled channel off the processing thread.
 * Each channel has its own retry; once its attempts are used up the alert is
 * dropped for that channel only. The persisted alert is never touched.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationChannel> channels;
    private final Map<String, Retry> retries = new LinkedHashMap<>();
    private final MetricsConfig metricsConfig;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  @Qualifier("notificationRetryConfig") RetryConfig retryConfig,
                                  MetricsConfig metricsConfig) {
        this.channels = channels;
        this.metricsConfig = metricsConfig;
        for (NotificationChannel channel : channels) {
            retries.put(channel.getName(), Retry.of("notification-" + channel.getName(), retryConfig));
            log.info("Notification channel {}: {}", channel.getName(), channel.isEnabled() ? "enabled" : "disabled");
        }
    }

    @Async("notificationExecutor")
    @Observed(name = "notification.dispatch", contextualName = "dispatch-alert")
    public void dispatch(Alert alert) {
        deliverToAll(alert);
    }

    /**
     * Synchronous fan-out.
     *
     * @return number of channels that accepted the alert
     */
    public int deliverToAll(Alert alert) {
        int delivered = 0;
        for (NotificationChannel channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }
            if (deliver(channel, alert)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(NotificationChannel channel, Alert alert) {
        Retry retry = retries.get(channel.getName());
        try {
            retry.executeRunnable(() -> channel.deliver(alert));
            metricsConfig.recordNotification(channel.getName(), "success");
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification(channel.getName(), "error");
            log.error("Dropping {} notification for alert={} ({} {} {}) after {} attempts: {}",
                    channel.getName(), alert.getAlertId(), alert.getAlertType(), alert.getEntityType(),
                    alert.getEntityId(), retry.getRetryConfig().getMaxAttempts(), e.getMessage(), e);
            return false;
        }
    }
}
