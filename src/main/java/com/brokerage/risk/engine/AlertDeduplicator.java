package com.brokerage.risk.engine;

import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a candidate alert is new, an escalation, or a duplicate.
 *
 * Key: (alert type, entity id). A candidate is suppressed when the same key
 * was emitted less than the cooldown earlier, measured on transaction event
 * time, unless its severity is strictly higher than the last emitted one.
 * Suppressed candidates do not extend the cooldown.
 */
@Component
public class AlertDeduplicator {

    public enum Decision {
        NEW,
        ESCALATION,
        SUPPRESSED
    }

    private final long cooldownMillis;
    private final Map<String, Emission> lastEmitted = new ConcurrentHashMap<>();

    public AlertDeduplicator(RiskThresholds thresholds) {
        this.cooldownMillis = thresholds.getAlertCooldown().toMillis();
    }

    public Decision decide(Alert candidate) {
        Decision[] decision = new Decision[1];
        lastEmitted.compute(candidate.dedupKey(), (key, previous) -> {
            long eventTime = candidate.getEventTimestamp();
            if (previous == null || eventTime - previous.eventTimestamp >= cooldownMillis) {
                decision[0] = Decision.NEW;
                return new Emission(eventTime, candidate.getSeverity());
            }
            if (candidate.getSeverity().isMoreSevereThan(previous.severity)) {
                decision[0] = Decision.ESCALATION;
                return new Emission(eventTime, candidate.getSeverity());
            }
            decision[0] = Decision.SUPPRESSED;
            return previous;
        });
        return decision[0];
    }

    public int trackedKeys() {
        return lastEmitted.size();
    }

    private static final class Emission {
        private final long eventTimestamp;
        private final RiskLevel severity;

        private Emission(long eventTimestamp, RiskLevel severity) {
            this.eventTimestamp = eventTimestamp;
            this.severity = severity;
        }
    }
}
