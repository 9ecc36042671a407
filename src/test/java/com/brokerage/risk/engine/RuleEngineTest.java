package com.brokerage.risk.engine;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.engine.evaluators.AnomalyEvaluator;
import com.brokerage.risk.engine.evaluators.ClientExposureEvaluator;
import com.brokerage.risk.engine.evaluators.SymbolExposureEvaluator;
import com.brokerage.risk.engine.evaluators.TransactionVelocityEvaluator;
import com.brokerage.risk.model.*;
import com.brokerage.risk.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleEngineTest {

    @Mock private MetricsConfig metricsConfig;

    private final RiskThresholds thresholds = TestDataFactory.defaultThresholds();
    private final Transaction txn = TestDataFactory.createTransactionOfValue(1, "CLIENT_001", "AAPL", 1_200_000);

    private RuleEngine engineWith(RuleEvaluator... evaluators) {
        return new RuleEngine(List.of(evaluators), Tracer.NOOP, metricsConfig);
    }

    private List<RuleEvaluator> allEvaluators() {
        return List.of(new AnomalyEvaluator(thresholds), new TransactionVelocityEvaluator(thresholds),
                new SymbolExposureEvaluator(thresholds), new ClientExposureEvaluator(thresholds));
    }

    @Test
    void evaluateAll_runsFamiliesInFixedOrder() {
        RuleEngine engine = new RuleEngine(allEvaluators(), Tracer.NOOP, metricsConfig);

        List<RuleResult> results = engine.evaluateAll(txn, EvaluationContext.builder().build());

        assertThat(results).extracting(RuleResult::getAlertType).containsExactly(
                AlertType.HIGH_CLIENT_EXPOSURE, AlertType.HIGH_SYMBOL_EXPOSURE,
                AlertType.HIGH_TRANSACTION_VELOCITY, AlertType.ANOMALY_DETECTED);
        assertThat(results).noneMatch(RuleResult::isTriggered);
    }

    @Test
    void evaluateAll_twelveHundredThousandClientExposure_singleCriticalAlert() {
        RuleEngine engine = new RuleEngine(allEvaluators(), Tracer.NOOP, metricsConfig);
        Exposure client = TestDataFactory.createExposure(EntityType.CLIENT, "CLIENT_001", 1_200_000, RiskLevel.CRITICAL);
        Exposure symbol = TestDataFactory.createExposure(EntityType.SYMBOL, "AAPL", 200_000, RiskLevel.LOW);
        EvaluationContext context = EvaluationContext.builder()
                .clientExposure(new ExposureUpdate(client, RiskLevel.LOW, true))
                .symbolExposure(new ExposureUpdate(symbol, RiskLevel.LOW, true))
                .velocityCount(1)
                .anomalyScore(AnomalyScore.insufficient("AAPL", 1_200_000, 0, 0, 0))
                .build();

        List<RuleResult> triggered = engine.evaluateAll(txn, context).stream()
                .filter(RuleResult::isTriggered)
                .toList();

        assertThat(triggered).hasSize(1);
        assertThat(triggered.get(0).getAlertType()).isEqualTo(AlertType.HIGH_CLIENT_EXPOSURE);
        assertThat(triggered.get(0).getSeverity()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void evaluateAll_evaluatorThrows_yieldsSystemResultAndContinues() {
        RuleEvaluator failing = mock(RuleEvaluator.class);
        when(failing.getSupportedAlertType()).thenReturn(AlertType.HIGH_CLIENT_EXPOSURE);
        when(failing.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));
        RuleEngine engine = engineWith(failing, new TransactionVelocityEvaluator(thresholds));

        List<RuleResult> results = engine.evaluateAll(txn, EvaluationContext.builder().velocityCount(3).build());

        assertThat(results).hasSize(2);
        RuleResult failure = results.get(0);
        assertThat(failure.isTriggered()).isTrue();
        assertThat(failure.getEntityType()).isEqualTo(EntityType.SYSTEM);
        assertThat(failure.getEntityId()).isEqualTo(RuleResult.SYSTEM_ENTITY_ID);
        assertThat(failure.getSeverity()).isEqualTo(RiskLevel.HIGH);
        assertThat(failure.getReason()).contains("boom").contains("CLIENT_001");
        assertThat(results.get(1).getAlertType()).isEqualTo(AlertType.HIGH_TRANSACTION_VELOCITY);
        verify(metricsConfig).recordRuleFailure("HIGH_CLIENT_EXPOSURE");
    }

    @Test
    void evaluateAll_upstreamFailure_skipsEvaluator() {
        RuleEvaluator velocity = spy(new TransactionVelocityEvaluator(thresholds));
        RuleEngine engine = engineWith(velocity);
        EvaluationContext context = EvaluationContext.builder().build();
        context.recordFailure(AlertType.HIGH_TRANSACTION_VELOCITY, new RuntimeException("window corrupted"));

        List<RuleResult> results = engine.evaluateAll(txn, context);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getEntityType()).isEqualTo(EntityType.SYSTEM);
        assertThat(results.get(0).getReason()).contains("window corrupted");
        verify(velocity, never()).evaluate(any(), any());
    }
}
