package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.brokerage.risk.exception.RiskConfigurationException;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngineStateRepositoryTest {

    @Mock private AerospikeClient client;

    private EngineStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new EngineStateRepository(client, "test", new WritePolicy(), new Policy());
    }

    @Test
    void loadMarker_noRecord_isEmpty() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.loadMarker()).isEmpty();
    }

    @Test
    void loadMarker_readsTimestampAndId() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("timestamp", 1_000L);
        bins.put("transactionId", 42L);
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        assertThat(repository.loadMarker()).contains(new FeedMarker(1_000L, 42L));
    }

    @Test
    void saveMarker_storeError_isTransient() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.saveMarker(new FeedMarker(1L, 1L)))
                .isInstanceOf(TransientStoreException.class);
    }

    @Test
    void loadThresholds_overlaysStoredValuesOnDefaults() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("clientThresh", 2_000_000.0);
        bins.put("velocityThresh", 20L);
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));
        RiskThresholds defaults = TestDataFactory.defaultThresholds();

        Optional<RiskThresholds> loaded = repository.loadThresholds(defaults);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getClientExposureThreshold()).isEqualTo(2_000_000.0);
        assertThat(loaded.get().getVelocityThreshold()).isEqualTo(20);
        assertThat(loaded.get().getSymbolExposureThreshold()).isEqualTo(defaults.getSymbolExposureThreshold());
        assertThat(loaded.get().getAnomalyStddevThreshold()).isEqualTo(defaults.getAnomalyStddevThreshold());
    }

    @Test
    void loadThresholds_wrongType_isConfigurationError() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("velocityThresh", "twenty");
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        assertThatThrownBy(() -> repository.loadThresholds(TestDataFactory.defaultThresholds()))
                .isInstanceOf(RiskConfigurationException.class);
    }
}
