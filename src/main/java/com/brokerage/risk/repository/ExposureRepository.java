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
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class ExposureRepository {

    private static final Logger log = LoggerFactory.getLogger(ExposureRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public ExposureRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void upsert(Exposure exposure) {
        Key key = new Key(namespace, setFor(exposure.getEntityType()), exposure.getEntityId());

        Bin entityIdBin = new Bin("entityId", exposure.getEntityId());
        Bin totalBin = new Bin("totalExposure", exposure.getTotalExposure());
        Bin countBin = new Bin("positionCount", exposure.getPositionCount());
        Bin riskLevelBin = new Bin("riskLevel", exposure.getRiskLevel().name());
        Bin lastUpdatedBin = new Bin("lastUpdated", exposure.getLastUpdated());
        Bin lastTsBin = new Bin("lastTxnTs", exposure.getLastTransactionTimestamp());
        Bin lastIdBin = new Bin("lastTxnId", exposure.getLastTransactionId());

        try {
            client.put(writePolicy, key,
                    entityIdBin, totalBin, countBin, riskLevelBin, lastUpdatedBin, lastTsBin, lastIdBin);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to upsert " + exposure.getEntityType()
                    + " exposure " + exposure.getEntityId(), e);
        }
    }

    public List<Exposure> findAll(EntityType entityType) {
        List<Exposure> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, setFor(entityType),
                    (key, record) -> {
                        try {
                            Exposure exposure = mapRecord(entityType, record);
                            synchronized (results) {
                                results.add(exposure);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read {} exposure record: {}", entityType, e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to scan " + entityType + " exposures", e);
        }
        return results;
    }

    private Exposure mapRecord(EntityType entityType, Record record) {
        String riskLevel = record.getString("riskLevel");
        return Exposure.builder()
                .entityType(entityType)
                .entityId(record.getString("entityId"))
                .totalExposure(record.getDouble("totalExposure"))
                .positionCount(record.getLong("positionCount"))
                .riskLevel(riskLevel != null ? RiskLevel.valueOf(riskLevel) : RiskLevel.LOW)
                .lastUpdated(record.getLong("lastUpdated"))
                .lastTransactionTimestamp(record.getLong("lastTxnTs"))
                .lastTransactionId(record.getLong("lastTxnId"))
                .build();
    }

    private static String setFor(EntityType entityType) {
        switch (entityType) {
            case CLIENT:
                return AerospikeConfig.SET_CLIENT_EXPOSURES;
            case SYMBOL:
                return AerospikeConfig.SET_SYMBOL_EXPOSURES;
            default:
                throw new IllegalArgumentException("No exposure set for entity type " + entityType);
        }
    }
}
