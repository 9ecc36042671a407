package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.Transaction;
import com.brokerage.risk.model.TransactionSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class TransactionRepositoryTest {

    @Mock private AerospikeClient client;

    private TransactionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new TransactionRepository(client, "test");
    }

    private static Record record(Long id, Long ts, String clientId) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("transactionId", id);
        bins.put("timestamp", ts);
        bins.put("clientId", clientId);
        bins.put("symbol", "AAPL");
        bins.put("side", "BUY");
        bins.put("quantity", 10L);
        bins.put("price", 100.0);
        bins.put("totalValue", 1000.0);
        bins.put("brokerId", "BROKER_01");
        bins.put("market", "NASDAQ");
        return new Record(bins, 1, 0);
    }

    private void scanReturns(Record... records) {
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            for (Record r : records) {
                callback.scanCallback(new Key("test", "transactions", String.valueOf(r.getValue("transactionId"))), r);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("transactions"), any(ScanCallback.class));
    }

    @Test
    void findSince_ordersByTimestampThenId() {
        scanReturns(record(3L, 2_000L, "C3"), record(2L, 1_000L, "C2"), record(1L, 1_000L, "C1"));

        List<Transaction> result = repository.findSince(FeedMarker.START, 10);

        assertThat(result).extracting(Transaction::getTransactionId).containsExactly(1L, 2L, 3L);
        assertThat(result.get(0).getSide()).isEqualTo(TransactionSide.BUY);
        assertThat(result.get(0).getTotalValue()).isEqualTo(1000.0);
    }

    @Test
    void findSince_excludesMarkerAndEarlier() {
        scanReturns(record(1L, 1_000L, "C1"), record(2L, 1_000L, "C2"), record(3L, 1_500L, "C3"));

        List<Transaction> result = repository.findSince(new FeedMarker(1_000L, 1L), 10);

        assertThat(result).extracting(Transaction::getTransactionId).containsExactly(2L, 3L);
    }

    @Test
    void findSince_appliesLimitAfterOrdering() {
        scanReturns(record(5L, 5_000L, "C5"), record(4L, 4_000L, "C4"), record(3L, 3_000L, "C3"));

        List<Transaction> result = repository.findSince(FeedMarker.START, 2);

        assertThat(result).extracting(Transaction::getTransactionId).containsExactly(3L, 4L);
    }

    @Test
    void findSince_skipsRecordsWithoutId() {
        scanReturns(record(null, 1_000L, "C1"), record(2L, 1_100L, "C2"));

        assertThat(repository.findSince(FeedMarker.START, 10)).hasSize(1);
    }

    @Test
    void findSince_storeError_isTransient() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("transactions"), any(ScanCallback.class));

        assertThatThrownBy(() -> repository.findSince(FeedMarker.START, 10))
                .isInstanceOf(TransientStoreException.class);
    }
}
