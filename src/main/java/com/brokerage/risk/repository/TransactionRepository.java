package com.brokerage.risk.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.ScanPolicy;
import com.brokerage.risk.config.AerospikeConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.Transaction;
import com.brokerage.risk.model.TransactionSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read side of the transaction set written by the external generator.
 */
@Repository
public class TransactionRepository {

    private static final Logger log = LoggerFactory.getLogger(TransactionRepository.class);

    static final Comparator<Transaction> FEED_ORDER = Comparator
            .comparingLong(Transaction::getTimestamp)
            .thenComparingLong(Transaction::getTransactionId);

    private final AerospikeClient client;
    private final String namespace;

    public TransactionRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    /**
     * Transactions strictly after {@code marker}, ordered by timestamp then id,
     * at most {@code limit} of them. Records without an id or timestamp cannot
     * be placed in the feed and are skipped.
     */
    public List<Transaction> findSince(FeedMarker marker, int limit) {
        List<Transaction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.filterExp = Exp.build(Exp.ge(Exp.intBin("timestamp"), Exp.val(marker.timestamp())));

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTIONS,
                    (key, record) -> {
                        if (record.getValue("transactionId") == null || record.getValue("timestamp") == null) {
                            log.warn("Skipping transaction record without id/timestamp: key={}", key.userKey);
                            return;
                        }
                        Transaction txn = mapRecord(record);
                        if (!txn.position().isAfter(marker)) return;
                        synchronized (results) {
                            results.add(txn);
                        }
                    });
        } catch (AerospikeException e) {
            throw new TransientStoreException("Failed to read transactions since " + marker, e);
        }

        results.sort(FEED_ORDER);
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private Transaction mapRecord(Record record) {
        return Transaction.builder()
                .transactionId(record.getLong("transactionId"))
                .timestamp(record.getLong("timestamp"))
                .clientId(record.getString("clientId"))
                .symbol(record.getString("symbol"))
                .side(TransactionSide.parse(record.getString("side")))
                .quantity(record.getLong("quantity"))
                .price(record.getDouble("price"))
                .totalValue(record.getDouble("totalValue"))
                .brokerId(record.getString("brokerId"))
                .market(record.getString("market"))
                .build();
    }
}
