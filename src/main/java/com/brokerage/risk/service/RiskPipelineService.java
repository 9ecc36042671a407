package com.brokerage.risk.service;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.engine.AlertDeduplicator;
import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.engine.RuleEngine;
import com.brokerage.risk.exception.DataIntegrityException;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.BatchResult;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.ExposureUpdate;
import com.brokerage.risk.model.FeedBatch;
import com.brokerage.risk.model.FeedMarker;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;
import com.brokerage.risk.repository.EngineStateRepository;
import com.brokerage.risk.repository.ExposureRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One cycle of the detection pipeline: poll, validate, aggregate, evaluate,
 * emit, checkpoint.
 *
 * Aggregation runs in two parallel phases. Phase 1 partitions the batch by
 * client (client exposure, velocity), phase 2 by symbol (symbol exposure,
 * anomaly). Each partition is processed in feed order by a single worker, so
 * every key sees its transactions in order. Rule evaluation, deduplication and
 * emission then run sequentially in feed order.
 *
 * The read position advances after every successful poll. The persisted
 * checkpoint only advances once every changed aggregate has been written and
 * no alert is waiting to be persisted, so a restart never skips unsaved work.
 * Transactions re-read after a restart are ignored by the aggregate
 * watermarks.
 */
@Service
public class RiskPipelineService {

    private static final Logger log = LoggerFactory.getLogger(RiskPipelineService.class);

    private final TransactionFeedAdapter feedAdapter;
    private final TransactionValidator validator;
    private final ExposureAggregator exposureAggregator;
    private final VelocityTracker velocityTracker;
    private final AnomalyDetector anomalyDetector;
    private final RuleEngine ruleEngine;
    private final AlertDeduplicator deduplicator;
    private final AlertService alertService;
    private final ExposureRepository exposureRepository;
    private final EngineStateRepository engineStateRepository;
    private final EngineStatistics statistics;
    private final MetricsConfig metricsConfig;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;

    private final ReentrantLock batchLock = new ReentrantLock();
    private volatile FeedMarker position = FeedMarker.START;
    private volatile FeedMarker committedMarker = FeedMarker.START;

    public RiskPipelineService(TransactionFeedAdapter feedAdapter,
                               TransactionValidator validator,
                               ExposureAggregator exposureAggregator,
                               VelocityTracker velocityTracker,
                               AnomalyDetector anomalyDetector,
                               RuleEngine ruleEngine,
                               AlertDeduplicator deduplicator,
                               AlertService alertService,
                               ExposureRepository exposureRepository,
                               EngineStateRepository engineStateRepository,
                               EngineStatistics statistics,
                               MetricsConfig metricsConfig,
                               @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
                               Clock clock) {
        this.feedAdapter = feedAdapter;
        this.validator = validator;
        this.exposureAggregator = exposureAggregator;
        this.velocityTracker = velocityTracker;
        this.anomalyDetector = anomalyDetector;
        this.ruleEngine = ruleEngine;
        this.deduplicator = deduplicator;
        this.alertService = alertService;
        this.exposureRepository = exposureRepository;
        this.engineStateRepository = engineStateRepository;
        this.statistics = statistics;
        this.metricsConfig = metricsConfig;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    /**
     * Load persisted exposures and the committed marker. Rolling windows
     * (velocity, anomaly) start empty.
     */
    public void restoreState() {
        batchLock.lock();
        try {
            exposureAggregator.restore(exposureRepository.findAll(EntityType.CLIENT));
            exposureAggregator.restore(exposureRepository.findAll(EntityType.SYMBOL));
            FeedMarker marker = engineStateRepository.loadMarker().orElse(FeedMarker.START);
            committedMarker = marker;
            position = marker;
            log.info("Pipeline restored at marker {}", marker);
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * @throws TransientStoreException if the feed could not be read; the read
     *                                 position is unchanged
     */
    @Observed(name = "pipeline.batch", contextualName = "process-batch")
    public BatchResult processNextBatch() {
        batchLock.lock();
        try {
            alertService.flushPending();

            FeedBatch batch = feedAdapter.poll(position);
            if (batch.isEmpty()) {
                checkpoint();
                return BatchResult.empty(position);
            }

            List<Transaction> valid = new ArrayList<>(batch.size());
            int skipped = 0;
            for (Transaction txn : batch.transactions()) {
                try {
                    validator.validate(txn);
                    valid.add(txn);
                } catch (DataIntegrityException e) {
                    skipped++;
                    statistics.incrementSkipped();
                    metricsConfig.recordTransactionSkipped("malformed");
                    log.warn("Skipping malformed transaction id={} client={} symbol={}: {}",
                            txn.getTransactionId(), txn.getClientId(), txn.getSymbol(), e.getMessage());
                }
            }

            List<EvaluationContext> contexts = new ArrayList<>(valid.size());
            for (int i = 0; i < valid.size(); i++) {
                contexts.add(EvaluationContext.builder().build());
            }

            runPartitioned(valid, Transaction::getClientId, i -> applyClientPhase(valid.get(i), contexts.get(i)));
            runPartitioned(valid, Transaction::getSymbol, i -> applySymbolPhase(valid.get(i), contexts.get(i)));

            int processed = 0;
            int replayed = 0;
            int alerts = 0;
            int suppressed = 0;
            for (int i = 0; i < valid.size(); i++) {
                Transaction txn = valid.get(i);
                EvaluationContext context = contexts.get(i);
                if (context.isReplay()) {
                    replayed++;
                    continue;
                }
                processed++;
                for (RuleResult result : ruleEngine.evaluateAll(txn, context)) {
                    if (!result.isTriggered()) continue;
                    Alert alert = Alert.fromRuleResult(result, txn, clock.millis());
                    if (alert.getEntityType() != EntityType.SYSTEM) {
                        AlertDeduplicator.Decision decision = deduplicator.decide(alert);
                        if (decision == AlertDeduplicator.Decision.SUPPRESSED) {
                            suppressed++;
                            statistics.incrementAlertsSuppressed();
                            metricsConfig.recordAlertSuppressed(alert.getAlertType().name());
                            log.debug("Suppressed {} for {} (txn {}) within cooldown",
                                    alert.getAlertType(), alert.getEntityId(), txn.getTransactionId());
                            continue;
                        }
                        alert.setEscalation(decision == AlertDeduplicator.Decision.ESCALATION);
                    }
                    if (alertService.emit(alert)) {
                        alerts++;
                    }
                }
            }

            statistics.addProcessed(processed);
            metricsConfig.recordTransactionsProcessed(processed);
            metricsConfig.updateFeedLag(Math.max(0, clock.millis() - batch.newMarker().timestamp()));
            if (replayed > 0) {
                log.info("Ignored {} already-applied transactions", replayed);
            }

            position = batch.newMarker();
            checkpoint();

            BatchResult result = new BatchResult(batch.size(), processed, skipped, replayed, alerts, suppressed, position);
            log.debug("Batch done: {}", result);
            return result;
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Wait for any in-flight batch, then persist pending alerts, changed
     * aggregates and the marker.
     *
     * @return true if the checkpoint reached the current read position
     */
    public boolean flushAndCheckpoint() {
        batchLock.lock();
        try {
            int stillPending = alertService.flushPending();
            if (stillPending > 0) {
                log.error("{} alerts could not be persisted before checkpoint", stillPending);
            }
            return checkpoint();
        } finally {
            batchLock.unlock();
        }
    }

    public FeedMarker getPosition() {
        return position;
    }

    public FeedMarker getCommittedMarker() {
        return committedMarker;
    }

    private void applyClientPhase(Transaction txn, EvaluationContext context) {
        ExposureUpdate update;
        try {
            update = exposureAggregator.applyToClient(txn);
            context.setClientExposure(update);
        } catch (RuntimeException e) {
            log.error("Client aggregation failed for txn {} (client={}): {}",
                    txn.getTransactionId(), txn.getClientId(), e.getMessage(), e);
            context.recordFailure(AlertType.HIGH_CLIENT_EXPOSURE, e);
            context.recordFailure(AlertType.HIGH_TRANSACTION_VELOCITY, e);
            return;
        }
        if (!update.applied()) {
            return;
        }
        try {
            context.setVelocityCount(velocityTracker.record(txn.getClientId(), txn.getTimestamp()));
        } catch (RuntimeException e) {
            log.error("Velocity tracking failed for txn {} (client={}): {}",
                    txn.getTransactionId(), txn.getClientId(), e.getMessage(), e);
            context.recordFailure(AlertType.HIGH_TRANSACTION_VELOCITY, e);
        }
    }

    private void applySymbolPhase(Transaction txn, EvaluationContext context) {
        ExposureUpdate update;
        try {
            update = exposureAggregator.applyToSymbol(txn);
            context.setSymbolExposure(update);
        } catch (RuntimeException e) {
            log.error("Symbol aggregation failed for txn {} (symbol={}): {}",
                    txn.getTransactionId(), txn.getSymbol(), e.getMessage(), e);
            context.recordFailure(AlertType.HIGH_SYMBOL_EXPOSURE, e);
            context.recordFailure(AlertType.ANOMALY_DETECTED, e);
            return;
        }
        if (!update.applied()) {
            return;
        }
        try {
            context.setAnomalyScore(anomalyDetector.score(txn.getSymbol(), txn.getTotalValue()));
        } catch (RuntimeException e) {
            log.error("Anomaly scoring failed for txn {} (symbol={}): {}",
                    txn.getTransactionId(), txn.getSymbol(), e.getMessage(), e);
            context.recordFailure(AlertType.ANOMALY_DETECTED, e);
        }
    }

    /**
     * Group transaction indexes by key, keeping feed order inside each group,
     * run each group as one task and wait for all of them.
     */
    private void runPartitioned(List<Transaction> transactions, Function<Transaction, String> keyOf,
                                IndexTask task) {
        Map<String, List<Integer>> partitions = new LinkedHashMap<>();
        for (int i = 0; i < transactions.size(); i++) {
            partitions.computeIfAbsent(keyOf.apply(transactions.get(i)), k -> new ArrayList<>()).add(i);
        }

        List<Future<?>> futures = new ArrayList<>(partitions.size());
        for (List<Integer> indexes : partitions.values()) {
            futures.add(pipelineExecutor.submit(() -> {
                for (int index : indexes) {
                    task.run(index);
                }
            }));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for pipeline workers", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Pipeline worker failed", e.getCause());
            }
        }
    }

    private boolean checkpoint() {
        List<Exposure> dirty = exposureAggregator.drainDirty();
        for (int i = 0; i < dirty.size(); i++) {
            try {
                exposureRepository.upsert(dirty.get(i));
            } catch (TransientStoreException e) {
                List<Exposure> unsaved = dirty.subList(i, dirty.size());
                exposureAggregator.markDirty(unsaved);
                log.error("Failed to persist {} exposures, checkpoint held at {}: {}",
                        unsaved.size(), committedMarker, e.getMessage());
                return false;
            }
        }

        if (alertService.pendingCount() > 0) {
            log.warn("{} alerts pending, checkpoint held at {}", alertService.pendingCount(), committedMarker);
            return false;
        }
        if (position.equals(committedMarker)) {
            return true;
        }
        try {
            engineStateRepository.saveMarker(position);
            committedMarker = position;
            return true;
        } catch (TransientStoreException e) {
            log.error("Failed to save feed marker {}: {}", position, e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface IndexTask {
        void run(int index);
    }
}
