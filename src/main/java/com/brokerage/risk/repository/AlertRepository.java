package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.brokerage.risk.config.AerospikeConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.AlertQuery;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The alert log. Alerts are never deleted; the only update is acknowledgement.
 */
@Repository
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    /**
     * @return true if the alert was written, false if an alert with the same id already exists
     */
    public boolean insertIfAbsent(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getAlertId());
        try {
            client.put(createOnlyPolicy, key, toBins(alert));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.debug("Alert {} already persisted", alert.getAlertId());
                return false;
            }
            throw new TransientStoreException("Failed to insert alert " + alert.getAlertId(), e);
        }
    }

    public Optional<Alert> findById(String alertId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        try {
            Record record = client.get(readPolicy, key);
            return record == null ? Optional.empty() : Optional.of(mapRecord(record));
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to read alert " + alertId, e);
        }
    }

    /**
     * Alerts matching the query, newest first, at most {@code query.limit}.
     */
    public List<Alert> find(AlertQuery query) {
        List<Alert> results = scan(query);
        results.sort(Comparator.comparingLong(Alert::getTimestamp).reversed()
                .thenComparing(Alert::getAlertId));
        return results.size() > query.getLimit() ? new ArrayList<>(results.subList(0, query.getLimit())) : results;
    }

    public List<Alert> findAll() {
        return scan(null);
    }

    /**
     * Mark an alert acknowledged. Acknowledging twice keeps the first
     * acknowledgement.
     *
     * @return the alert after the update, empty if it does not exist
     */
    public Optional<Alert> acknowledge(String alertId, String acknowledgedBy, long acknowledgedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return Optional.empty();

            Alert alert = mapRecord(record);
            if (alert.isAcknowledged()) {
                log.debug("Alert {} already acknowledged by {}", alertId, alert.getAcknowledgedBy());
                return Optional.of(alert);
            }

            Bin ackBin = new Bin("acknowledged", true);
            Bin ackAtBin = new Bin("acknowledgedAt", acknowledgedAt);
            Bin ackByBin = new Bin("acknowledgedBy", acknowledgedBy);
            client.put(writePolicy, key, ackBin, ackAtBin, ackByBin);

            alert.setAcknowledged(true);
            alert.setAcknowledgedAt(acknowledgedAt);
            alert.setAcknowledgedBy(acknowledgedBy);
            return Optional.of(alert);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to acknowledge alert " + alertId, e);
        }
    }

    private List<Alert> scan(AlertQuery query) {
        List<Alert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                    (key, record) -> {
                        try {
                            Alert alert = mapRecord(record);
                            if (query != null && !query.matches(alert)) return;
                            synchronized (results) {
                                results.add(alert);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read alert record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to scan alerts", e);
        }
        return results;
    }

    private Bin[] toBins(Alert alert) {
        return new Bin[] {
                new Bin("alertId", alert.getAlertId()),
                new Bin("timestamp", alert.getTimestamp()),
                new Bin("eventTimestamp", alert.getEventTimestamp()),
                new Bin("alertType", alert.getAlertType().name()),
                new Bin("severity", alert.getSeverity().name()),
                new Bin("entityType", alert.getEntityType().name()),
                new Bin("entityId", alert.getEntityId()),
                new Bin("message", alert.getMessage()),
                new Bin("thresholdValue", alert.getThresholdValue()),
                new Bin("currentValue", alert.getCurrentValue()),
                new Bin("transactionId", alert.getTransactionId()),
                new Bin("escalation", alert.isEscalation()),
                new Bin("acknowledged", alert.isAcknowledged()),
                new Bin("acknowledgedAt", alert.getAcknowledgedAt()),
                new Bin("acknowledgedBy", alert.getAcknowledgedBy() != null ? alert.getAcknowledgedBy() : "")
        };
    }

    private Alert mapRecord(Record record) {
        String acknowledgedBy = record.getString("acknowledgedBy");
        return Alert.builder()
                .alertId(record.getString("alertId"))
                .timestamp(record.getLong("timestamp"))
                .eventTimestamp(record.getLong("eventTimestamp"))
                .alertType(AlertType.valueOf(record.getString("alertType")))
                .severity(RiskLevel.valueOf(record.getString("severity")))
                .entityType(EntityType.valueOf(record.getString("entityType")))
                .entityId(record.getString("entityId"))
                .message(record.getString("message"))
                .thresholdValue(record.getDouble("thresholdValue"))
                .currentValue(record.getDouble("currentValue"))
                .transactionId(record.getLong("transactionId"))
                .escalation(record.getBoolean("escalation"))
                .acknowledged(record.getBoolean("acknowledged"))
                .acknowledgedAt(record.getLong("acknowledgedAt"))
                .acknowledgedBy(acknowledgedBy == null || acknowledgedBy.isEmpty() ? null : acknowledgedBy)
                .build();
    }
}
