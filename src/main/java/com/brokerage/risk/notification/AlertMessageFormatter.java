package com.brokerage.risk.notification;

import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;

/**
 * Text rendering of an alert shared by all channels.
 */
@Component
public class AlertMessageFormatter {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final Map<RiskLevel, String> SEVERITY_COLORS = new EnumMap<>(RiskLevel.class);

    static {
        SEVERITY_COLORS.put(RiskLevel.LOW, "#36a64f");
        SEVERITY_COLORS.put(RiskLevel.MEDIUM, "#ff9900");
        SEVERITY_COLORS.put(RiskLevel.HIGH, "#ff6600");
        SEVERITY_COLORS.put(RiskLevel.CRITICAL, "#ff0000");
    }

    public String title(Alert alert) {
        return String.format("%s%s - %s", alert.isEscalation() ? "[ESCALATED] " : "",
                alert.getAlertType(), alert.getSeverity());
    }

    public String subject(Alert alert) {
        return "Risk Alert: " + title(alert);
    }

    public String body(Alert alert) {
        return String.format(
                "RISK ALERT - %s%s\n\n" +
                "Type: %s\n" +
                "Entity: %s - %s\n" +
                "Time: %s\n" +
                "Transaction: %d\n\n" +
                "%s\n\n" +
                "Threshold: %s\n" +
                "Current Value: %s",
                alert.getSeverity(),
                alert.isEscalation() ? " (escalated)" : "",
                alert.getAlertType(),
                alert.getEntityType(), alert.getEntityId(),
                TIME_FORMAT.format(Instant.ofEpochMilli(alert.getTimestamp())),
                alert.getTransactionId(),
                alert.getMessage(),
                formatValue(alert, alert.getThresholdValue()),
                formatValue(alert, alert.getCurrentValue()));
    }

    /** Condensed form for SMS. */
    public String shortBody(Alert alert) {
        return String.format(
                "[RISK ALERT] %s\n" +
                "%s: %s\n" +
                "Current: %s / Threshold: %s",
                title(alert),
                alert.getEntityType(), alert.getEntityId(),
                formatValue(alert, alert.getCurrentValue()),
                formatValue(alert, alert.getThresholdValue()));
    }

    public String color(RiskLevel severity) {
        return SEVERITY_COLORS.getOrDefault(severity, "#808080");
    }

    // Velocity values are transaction counts, everything else is money
    public String formatValue(Alert alert, double value) {
        if (alert.getAlertType() == AlertType.HIGH_TRANSACTION_VELOCITY) {
            return String.format("%.0f", value);
        }
        return String.format("$%,.2f", value);
    }
}
