package com.brokerage.risk.model;

import lombok.Builder;
import lombok.Value;

/**
 * Filter over the alert log. Null fields match everything.
 */
@Value
@Builder
public class AlertQuery {

    public static final int DEFAULT_LIMIT = 100;

    Boolean acknowledged;
    RiskLevel severity;
    EntityType entityType;
    AlertType alertType;
    Long since;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public boolean matches(Alert alert) {
        if (acknowledged != null && alert.isAcknowledged() != acknowledged) return false;
        if (severity != null && alert.getSeverity() != severity) return false;
        if (entityType != null && alert.getEntityType() != entityType) return false;
        if (alertType != null && alert.getAlertType() != alertType) return false;
        if (since != null && alert.getTimestamp() < since) return false;
        return true;
    }
}
