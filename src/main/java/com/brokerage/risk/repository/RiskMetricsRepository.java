package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.brokerage.risk.config.AerospikeConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.RiskMetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only series of metrics snapshots, keyed by snapshot timestamp.
 */
@Repository
public class RiskMetricsRepository {

    private static final Logger log = LoggerFactory.getLogger(RiskMetricsRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public RiskMetricsRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void insert(RiskMetricsSnapshot snapshot) {
        Key key = new Key(namespace, AerospikeConfig.SET_RISK_METRICS, snapshot.getTimestamp());

        Bin timestampBin = new Bin("timestamp", snapshot.getTimestamp());
        Bin totalTxnsBin = new Bin("totalTxns", snapshot.getTotalTransactions());
        Bin exposureBin = new Bin("totalExposure", snapshot.getTotalExposure());
        Bin activeClientsBin = new Bin("activeClients", snapshot.getActiveClients());
        Bin activeSymbolsBin = new Bin("activeSymbols", snapshot.getActiveSymbols());
        Bin highClientsBin = new Bin("highRiskClients", snapshot.getHighRiskClients());
        Bin highSymbolsBin = new Bin("highRiskSymbols", snapshot.getHighRiskSymbols());
        Bin alertsBin = new Bin("alertsGenerated", snapshot.getAlertsGenerated());

        try {
            client.put(writePolicy, key, timestampBin, totalTxnsBin, exposureBin,
                    activeClientsBin, activeSymbolsBin, highClientsBin, highSymbolsBin, alertsBin);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to insert metrics snapshot " + snapshot.getTimestamp(), e);
        }
    }

    /**
     * Snapshots taken at or after {@code since} (all if null), newest first.
     */
    public List<RiskMetricsSnapshot> findSince(Long since, int limit) {
        List<RiskMetricsSnapshot> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RISK_METRICS,
                    (key, record) -> {
                        try {
                            if (since != null && record.getLong("timestamp") < since) return;
                            RiskMetricsSnapshot snapshot = mapRecord(record);
                            synchronized (results) {
                                results.add(snapshot);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read metrics snapshot record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to scan metrics snapshots", e);
        }

        results.sort(Comparator.comparingLong(RiskMetricsSnapshot::getTimestamp).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public Optional<RiskMetricsSnapshot> findLatest() {
        List<RiskMetricsSnapshot> latest = findSince(null, 1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    private RiskMetricsSnapshot mapRecord(Record record) {
        return RiskMetricsSnapshot.builder()
                .timestamp(record.getLong("timestamp"))
                .totalTransactions(record.getLong("totalTxns"))
                .totalExposure(record.getDouble("totalExposure"))
                .activeClients(record.getInt("activeClients"))
                .activeSymbols(record.getInt("activeSymbols"))
                .highRiskClients(record.getInt("highRiskClients"))
                .highRiskSymbols(record.getInt("highRiskSymbols"))
                .alertsGenerated(record.getLong("alertsGenerated"))
                .build();
    }
}
