package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.brokerage.risk.config.AerospikeConfig;
import com.brokerage.risk.exception.RiskConfigurationException;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Singleton engine records: the committed feed marker and the thresholds record.
 */
@Repository
public class EngineStateRepository {

    static final String MARKER_KEY = "feed_marker";
    static final String THRESHOLDS_KEY = "thresholds";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public EngineStateRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public Optional<FeedMarker> loadMarker() {
        Key key = new Key(namespace, AerospikeConfig.SET_ENGINE_STATE, MARKER_KEY);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return Optional.empty();
            return Optional.of(new FeedMarker(record.getLong("timestamp"), record.getLong("transactionId")));
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to read feed marker", e);
        }
    }

    public void saveMarker(FeedMarker marker) {
        Key key = new Key(namespace, AerospikeConfig.SET_ENGINE_STATE, MARKER_KEY);
        try {
            client.put(writePolicy, key,
                    new Bin("timestamp", marker.timestamp()),
                    new Bin("transactionId", marker.transactionId()));
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to save feed marker " + marker, e);
        }
    }

    /**
     * The stored thresholds record overlaid on {@code defaults}. Bins missing
     * from the record keep their default.
     *
     * @throws RiskConfigurationException if a stored value has the wrong type
     */
    public Optional<RiskThresholds> loadThresholds(RiskThresholds defaults) {
        Key key = new Key(namespace, AerospikeConfig.SET_ENGINE_STATE, THRESHOLDS_KEY);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to read thresholds record", e);
        }
        if (record == null) return Optional.empty();

        try {
            RiskThresholds.RiskThresholdsBuilder builder = defaults.toBuilder();
            if (record.getValue("clientThresh") != null) {
                builder.clientExposureThreshold(record.getDouble("clientThresh"));
            }
            if (record.getValue("symbolThresh") != null) {
                builder.symbolExposureThreshold(record.getDouble("symbolThresh"));
            }
            if (record.getValue("velocityThresh") != null) {
                builder.velocityThreshold(record.getInt("velocityThresh"));
            }
            if (record.getValue("velocityWindowS") != null) {
                builder.velocityWindowSeconds(record.getLong("velocityWindowS"));
            }
            if (record.getValue("anomalyStddev") != null) {
                builder.anomalyStddevThreshold(record.getDouble("anomalyStddev"));
            }
            return Optional.of(builder.build());
        } catch (ClassCastException e) {
            throw new RiskConfigurationException("Malformed thresholds record: " + e.getMessage(), e);
        }
    }
}
