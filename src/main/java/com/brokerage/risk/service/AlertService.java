package com.brokerage.risk.service;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.AlertQuery;
import com.brokerage.risk.model.AlertSummary;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.notification.NotificationDispatcher;
import com.brokerage.risk.repository.AlertRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Alert sink and alert log access.
 *
 * {@link #emit} persists first and notifies second. Alerts that could not be
 * persisted are held in memory and written by {@link #flushPending} before the
 * next batch and on shutdown; they are notified once they are persisted.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertRepository alertRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final EngineStatistics statistics;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ConcurrentLinkedQueue<Alert> pending = new ConcurrentLinkedQueue<>();

    public AlertService(AlertRepository alertRepository,
                        NotificationDispatcher notificationDispatcher,
                        EngineStatistics statistics,
                        MetricsConfig metricsConfig,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.statistics = statistics;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @return true if the alert was newly persisted now
     */
    public boolean emit(Alert alert) {
        try {
            return persistAndNotify(alert);
        } catch (TransientStoreException e) {
            pending.add(alert);
            log.error("Could not persist alert {} ({} {}), queued for retry ({} pending): {}",
                    alert.getAlertId(), alert.getAlertType(), alert.getEntityId(), pending.size(), e.getMessage());
            return false;
        }
    }

    /**
     * Retry persisting queued alerts in arrival order; stops at the first failure.
     *
     * @return alerts still pending
     */
    public int flushPending() {
        Alert next;
        while ((next = pending.peek()) != null) {
            try {
                persistAndNotify(next);
                pending.poll();
            } catch (TransientStoreException e) {
                log.warn("Store still unavailable, {} alerts pending: {}", pending.size(), e.getMessage());
                break;
            }
        }
        return pending.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    private boolean persistAndNotify(Alert alert) {
        if (!alertRepository.insertIfAbsent(alert)) {
            log.debug("Alert {} already in the log, not re-notifying", alert.getAlertId());
            return false;
        }
        statistics.incrementAlertsGenerated();
        metricsConfig.recordAlert(alert.getAlertType().name(), alert.getSeverity().name());
        log.warn("[ALERT] {}{}: {}", alert.getSeverity(), alert.isEscalation() ? " (escalation)" : "",
                alert.getMessage());
        notificationDispatcher.dispatch(alert);
        return true;
    }

    @Observed(name = "alerts.query", contextualName = "query-alerts")
    public List<Alert> query(AlertQuery query) {
        return alertRepository.find(query);
    }

    public Optional<Alert> findById(String alertId) {
        return alertRepository.findById(alertId);
    }

    public Optional<Alert> acknowledge(String alertId, String acknowledgedBy) {
        Optional<Alert> updated = alertRepository.acknowledge(alertId, acknowledgedBy, clock.millis());
        updated.ifPresent(a -> log.info("Alert {} acknowledged by {}", alertId, a.getAcknowledgedBy()));
        return updated;
    }

    /**
     * @return the alerts that exist, in request order; unknown ids are skipped
     */
    public List<Alert> acknowledgeAll(List<String> alertIds, String acknowledgedBy) {
        List<Alert> acknowledged = new ArrayList<>();
        for (String alertId : alertIds) {
            acknowledge(alertId, acknowledgedBy).ifPresent(acknowledged::add);
        }
        return acknowledged;
    }

    public AlertSummary summary() {
        List<Alert> all = alertRepository.findAll();

        Map<RiskLevel, Long> bySeverity = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            bySeverity.put(level, 0L);
        }
        Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
        for (AlertType type : AlertType.values()) {
            byType.put(type, 0L);
        }

        long unacknowledged = 0;
        for (Alert alert : all) {
            if (alert.isAcknowledged()) continue;
            unacknowledged++;
            bySeverity.merge(alert.getSeverity(), 1L, Long::sum);
            byType.merge(alert.getAlertType(), 1L, Long::sum);
        }

        return AlertSummary.builder()
                .totalAlerts(all.size())
                .unacknowledgedAlerts(unacknowledged)
                .unacknowledgedBySeverity(bySeverity)
                .unacknowledgedByType(byType)
                .build();
    }
}
