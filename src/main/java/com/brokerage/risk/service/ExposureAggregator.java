package com.brokerage.risk.service;

import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.ExposureUpdate;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the live exposure aggregates, one per client and one per symbol.
 * Aggregates are created on first use and never removed during a run.
 *
 * Each aggregate has its own lock; mutation and copying happen under it, so a
 * reader always sees a state that existed at some instant. Callers only ever
 * receive copies.
 *
 * A transaction at or below an aggregate's watermark (the position of the last
 * transaction applied to it) is ignored, which makes redelivery harmless.
 */
@Service
public class ExposureAggregator {

    private static final Logger log = LoggerFactory.getLogger(ExposureAggregator.class);

    private final RiskThresholds thresholds;
    private final Clock clock;
    private final Map<String, AggregateState> clients = new ConcurrentHashMap<>();
    private final Map<String, AggregateState> symbols = new ConcurrentHashMap<>();

    public ExposureAggregator(RiskThresholds thresholds, Clock clock) {
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public ExposureUpdate applyToClient(Transaction txn) {
        return apply(EntityType.CLIENT, txn.getClientId(), txn);
    }

    public ExposureUpdate applyToSymbol(Transaction txn) {
        return apply(EntityType.SYMBOL, txn.getSymbol(), txn);
    }

    /**
     * Apply to both aggregates, client first.
     *
     * @return the client update followed by the symbol update
     */
    public List<ExposureUpdate> apply(Transaction txn) {
        return List.of(applyToClient(txn), applyToSymbol(txn));
    }

    public Optional<Exposure> snapshot(EntityType entityType, String entityId) {
        AggregateState state = states(entityType).get(entityId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    /**
     * Copies of every aggregate of the given type, largest exposure first.
     */
    public List<Exposure> snapshotAll(EntityType entityType) {
        Collection<AggregateState> values = states(entityType).values();
        List<Exposure> copies = new ArrayList<>(values.size());
        for (AggregateState state : values) {
            copies.add(state.copy());
        }
        copies.sort(Comparator.comparingDouble(Exposure::getTotalExposure).reversed()
                .thenComparing(Exposure::getEntityId));
        return copies;
    }

    public int trackedCount(EntityType entityType) {
        return states(entityType).size();
    }

    /**
     * Seed aggregates from persisted records. Only used before processing starts.
     */
    public void restore(List<Exposure> persisted) {
        for (Exposure exposure : persisted) {
            if (exposure.getEntityType() != EntityType.CLIENT && exposure.getEntityType() != EntityType.SYMBOL) {
                log.warn("Ignoring persisted exposure with entity type {} for {}",
                        exposure.getEntityType(), exposure.getEntityId());
                continue;
            }
            Exposure restored = exposure.toBuilder()
                    .riskLevel(thresholds.classify(exposure.getEntityType(), exposure.getTotalExposure()))
                    .build();
            states(exposure.getEntityType()).put(exposure.getEntityId(), new AggregateState(restored));
        }
        log.info("Restored {} client and {} symbol exposures", clients.size(), symbols.size());
    }

    /**
     * Copies of every aggregate changed since the last drain, clearing the dirty flags.
     */
    public List<Exposure> drainDirty() {
        List<Exposure> dirty = new ArrayList<>();
        drainDirty(clients.values(), dirty);
        drainDirty(symbols.values(), dirty);
        return dirty;
    }

    /**
     * Flag aggregates for the next drain again, e.g. after a failed upsert.
     */
    public void markDirty(List<Exposure> exposures) {
        for (Exposure exposure : exposures) {
            AggregateState state = states(exposure.getEntityType()).get(exposure.getEntityId());
            if (state != null) {
                state.lock.lock();
                try {
                    state.dirty = true;
                } finally {
                    state.lock.unlock();
                }
            }
        }
    }

    private ExposureUpdate apply(EntityType entityType, String entityId, Transaction txn) {
        AggregateState state = states(entityType).computeIfAbsent(entityId,
                id -> new AggregateState(Exposure.builder().entityType(entityType).entityId(id).build()));

        state.lock.lock();
        try {
            Exposure live = state.exposure;
            if (!txn.position().isAfter(live.watermark())) {
                log.debug("Ignoring replayed transaction {} for {} {} (watermark {})",
                        txn.getTransactionId(), entityType, entityId, live.watermark());
                return ExposureUpdate.ignored(live.toBuilder().build());
            }

            RiskLevel previousLevel = live.getRiskLevel();
            double total = live.getTotalExposure() + txn.getTotalValue();
            live.setTotalExposure(total);
            live.setPositionCount(live.getPositionCount() + 1);
            live.setRiskLevel(thresholds.classify(entityType, total));
            live.setLastUpdated(clock.millis());
            live.setLastTransactionTimestamp(txn.getTimestamp());
            live.setLastTransactionId(txn.getTransactionId());
            state.dirty = true;

            return new ExposureUpdate(live.toBuilder().build(), previousLevel, true);
        } finally {
            state.lock.unlock();
        }
    }

    private void drainDirty(Collection<AggregateState> states, List<Exposure> out) {
        for (AggregateState state : states) {
            state.lock.lock();
            try {
                if (state.dirty) {
                    out.add(state.exposure.toBuilder().build());
                    state.dirty = false;
                }
            } finally {
                state.lock.unlock();
            }
        }
    }

    private Map<String, AggregateState> states(EntityType entityType) {
        switch (entityType) {
            case CLIENT:
                return clients;
            case SYMBOL:
                return symbols;
            default:
                throw new IllegalArgumentException("No exposure aggregates for entity type " + entityType);
        }
    }

    private static final class AggregateState {
        private final ReentrantLock lock = new ReentrantLock();
        private final Exposure exposure;
        private boolean dirty;

        private AggregateState(Exposure exposure) {
            this.exposure = exposure;
        }

        private Exposure copy() {
            lock.lock();
            try {
                return exposure.toBuilder().build();
            } finally {
                lock.unlock();
            }
        }
    }
}
