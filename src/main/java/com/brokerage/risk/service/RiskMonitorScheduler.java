package com.brokerage.risk.service;

import com.brokerage.risk.config.RiskThresholdConfig;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.BatchResult;
import com.brokerage.risk.model.EngineStatus;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.RiskThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the pipeline from a single poller thread with a fixed delay between
 * cycles. A cycle that fills a whole batch is followed immediately by
 * another, so a backlog drains without waiting for the interval.
 *
 * Shutdown stops polling, lets the in-flight batch finish, then persists
 * pending alerts, changed aggregates and the feed marker.
 */
@Component
public class RiskMonitorScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RiskMonitorScheduler.class);

    private final RiskPipelineService pipeline;
    private final RiskThresholdConfig config;
    private final RiskThresholds thresholds;
    private final EngineStatistics statistics;
    private final ExposureAggregator exposureAggregator;
    private final AlertService alertService;
    private final AtomicLong cycles = new AtomicLong();

    private ScheduledExecutorService poller;
    private volatile boolean running;

    public RiskMonitorScheduler(RiskPipelineService pipeline,
                                RiskThresholdConfig config,
                                RiskThresholds thresholds,
                                EngineStatistics statistics,
                                ExposureAggregator exposureAggregator,
                                AlertService alertService) {
        this.pipeline = pipeline;
        this.config = config;
        this.thresholds = thresholds;
        this.statistics = statistics;
        this.exposureAggregator = exposureAggregator;
        this.alertService = alertService;
    }

    @Override
    public void start() {
        RiskThresholdConfig.Pipeline settings = config.getPipeline();
        if (!settings.isEnabled()) {
            log.info("Risk monitoring pipeline is DISABLED (risk.pipeline.enabled=false)");
            return;
        }

        pipeline.restoreState();
        poller = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("risk-poller-"));
        running = true;
        poller.scheduleWithFixedDelay(this::runCycle, 0, settings.getPollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Risk monitoring started: poll every {}ms, batch size {}, {} workers",
                settings.getPollIntervalMs(), settings.getBatchSize(), settings.getWorkerThreads());
    }

    /**
     * One scheduled cycle. Never throws: an exception would cancel the
     * periodic task.
     */
    void runCycle() {
        int batchSize = config.getPipeline().getBatchSize();
        try {
            BatchResult result;
            do {
                if (!running) return;
                result = pipeline.processNextBatch();
            } while (result.polled() >= batchSize);
        } catch (TransientStoreException e) {
            log.warn("Transaction feed unavailable, retrying from {} next cycle: {}",
                    pipeline.getPosition(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Risk pipeline cycle failed at {}: {}", pipeline.getPosition(), e.getMessage(), e);
        }

        int logEvery = Math.max(1, config.getPipeline().getStatsLogEveryCycles());
        if (cycles.incrementAndGet() % logEvery == 0) {
            log.info("Engine stats: processed={}, skipped={}, alerts={}, suppressed={}, clients={}, symbols={}, marker={}",
                    statistics.getTransactionsProcessed(), statistics.getTransactionsSkipped(),
                    statistics.getAlertsGenerated(), statistics.getAlertsSuppressed(),
                    exposureAggregator.trackedCount(EntityType.CLIENT),
                    exposureAggregator.trackedCount(EntityType.SYMBOL),
                    pipeline.getCommittedMarker());
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping risk monitoring");
        running = false;
        poller.shutdown();
        try {
            if (!poller.awaitTermination(config.getPipeline().getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("In-flight batch did not finish within {}s", config.getPipeline().getShutdownTimeoutSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the in-flight batch");
        }

        if (pipeline.flushAndCheckpoint()) {
            log.info("Risk monitoring stopped, checkpoint at {}", pipeline.getCommittedMarker());
        } else {
            log.error("Risk monitoring stopped without a full checkpoint: position={}, committed={}",
                    pipeline.getPosition(), pipeline.getCommittedMarker());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public EngineStatus status() {
        return EngineStatus.builder()
                .running(running)
                .committedMarker(pipeline.getCommittedMarker())
                .transactionsProcessed(statistics.getTransactionsProcessed())
                .transactionsSkipped(statistics.getTransactionsSkipped())
                .alertsGenerated(statistics.getAlertsGenerated())
                .alertsSuppressed(statistics.getAlertsSuppressed())
                .pendingAlerts(alertService.pendingCount())
                .trackedClients(exposureAggregator.trackedCount(EntityType.CLIENT))
                .trackedSymbols(exposureAggregator.trackedCount(EntityType.SYMBOL))
                .thresholds(thresholds)
                .build();
    }
}
