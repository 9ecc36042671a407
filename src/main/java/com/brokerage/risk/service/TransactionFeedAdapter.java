package com.brokerage.risk.service;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.config.RiskThresholdConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.FeedBatch;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.Transaction;
import com.brokerage.risk.repository.TransactionRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pulls the next batch of transactions after a marker. Safe to call
 * repeatedly with the same marker.
 */
@Service
public class TransactionFeedAdapter {

    private static final Logger log = LoggerFactory.getLogger(TransactionFeedAdapter.class);

    private final TransactionRepository transactionRepository;
    private final Retry feedRetry;
    private final MetricsConfig metricsConfig;
    private final int batchSize;

    public TransactionFeedAdapter(TransactionRepository transactionRepository,
                                  @Qualifier("feedRetry") Retry feedRetry,
                                  MetricsConfig metricsConfig,
                                  RiskThresholdConfig config) {
        this.transactionRepository = transactionRepository;
        this.feedRetry = feedRetry;
        this.metricsConfig = metricsConfig;
        this.batchSize = config.getPipeline().getBatchSize();
    }

    /**
     * @throws TransientStoreException once the retry budget is exhausted; the
     *                                 caller keeps its marker
     */
    public FeedBatch poll(FeedMarker since) {
        List<Transaction> transactions;
        try {
            transactions = Retry.decorateSupplier(feedRetry,
                    () -> transactionRepository.findSince(since, batchSize)).get();
        } catch (TransientStoreException e) {
            metricsConfig.recordFeedFailure();
            log.error("Feed read after {} failed after {} attempts: {}",
                    since, feedRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw e;
        }

        if (transactions.isEmpty()) {
            return FeedBatch.empty(since);
        }
        FeedMarker newMarker = transactions.get(transactions.size() - 1).position();
        log.debug("Polled {} transactions after {}, new marker {}", transactions.size(), since, newMarker);
        return new FeedBatch(transactions, newMarker);
    }
}
