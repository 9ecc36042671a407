package com.brokerage.risk.service;

import com.brokerage.risk.config.RiskThresholdConfig;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.RiskMetricsSnapshot;
import com.brokerage.risk.repository.RiskMetricsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Periodically writes one {@link RiskMetricsSnapshot} built from aggregate
 * copies. Never mutates engine state and never blocks the pipeline beyond the
 * per-aggregate copy.
 */
@Service
public class MetricsSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSnapshotService.class);

    private final ExposureAggregator exposureAggregator;
    private final EngineStatistics statistics;
    private final RiskMetricsRepository riskMetricsRepository;
    private final RiskThresholdConfig config;
    private final Clock clock;

    public MetricsSnapshotService(ExposureAggregator exposureAggregator,
                                  EngineStatistics statistics,
                                  RiskMetricsRepository riskMetricsRepository,
                                  RiskThresholdConfig config,
                                  Clock clock) {
        this.exposureAggregator = exposureAggregator;
        this.config = config;
        this.statistics = statistics;
        this.riskMetricsRepository = riskMetricsRepository;
        this.clock = clock;
    }

    public RiskMetricsSnapshot capture() {
        List<Exposure> clients = exposureAggregator.snapshotAll(EntityType.CLIENT);
        List<Exposure> symbols = exposureAggregator.snapshotAll(EntityType.SYMBOL);

        long totalTransactions = 0;
        double totalExposure = 0.0;
        int activeClients = 0;
        int highRiskClients = 0;
        // every applied transaction counts once against its client
        for (Exposure client : clients) {
            totalTransactions += client.getPositionCount();
            totalExposure += client.getTotalExposure();
            if (client.getTotalExposure() > 0) activeClients++;
            if (client.getRiskLevel().isHighRisk()) highRiskClients++;
        }

        int activeSymbols = 0;
        int highRiskSymbols = 0;
        for (Exposure symbol : symbols) {
            if (symbol.getTotalExposure() > 0) activeSymbols++;
            if (symbol.getRiskLevel().isHighRisk()) highRiskSymbols++;
        }

        return RiskMetricsSnapshot.builder()
                .timestamp(clock.millis())
                .totalTransactions(totalTransactions)
                .totalExposure(totalExposure)
                .activeClients(activeClients)
                .activeSymbols(activeSymbols)
                .highRiskClients(highRiskClients)
                .highRiskSymbols(highRiskSymbols)
                .alertsGenerated(statistics.getAlertsGenerated())
                .build();
    }

    @Scheduled(fixedRateString = "${risk.snapshot.interval-seconds:50}",
               initialDelayString = "${risk.snapshot.interval-seconds:50}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledSnapshot() {
        if (!config.getSnapshot().isEnabled()) {
            return;
        }
        takeSnapshot();
    }

    /**
     * @return the written snapshot, empty if the store rejected it
     */
    public Optional<RiskMetricsSnapshot> takeSnapshot() {
        RiskMetricsSnapshot snapshot = capture();
        try {
            riskMetricsRepository.insert(snapshot);
            log.info("Metrics snapshot: txns={}, exposure=${}, clients={} ({} high risk), symbols={} ({} high risk), alerts={}",
                    snapshot.getTotalTransactions(), String.format("%,.0f", snapshot.getTotalExposure()),
                    snapshot.getActiveClients(), snapshot.getHighRiskClients(),
                    snapshot.getActiveSymbols(), snapshot.getHighRiskSymbols(), snapshot.getAlertsGenerated());
            return Optional.of(snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to write metrics snapshot: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
