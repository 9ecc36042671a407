package com.brokerage.risk.engine;

import com.brokerage.risk.config.MetricsConfig;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every rule family against a transaction in the fixed order of
 * {@link AlertType}: client exposure, symbol exposure, velocity, anomaly.
 * Each family is looked up in a registry of {@link RuleEvaluator}s.
 *
 * A family that cannot be evaluated, because its evaluator threw or because
 * the aggregation phase feeding it failed, yields a SYSTEM result instead of
 * being dropped.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<AlertType, RuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleEvaluator> evaluators, Tracer tracer, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(AlertType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedAlertType(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedAlertType(), evaluator.getClass().getSimpleName());
        }
        for (AlertType type : AlertType.values()) {
            if (!evaluatorMap.containsKey(type)) {
                log.warn("No evaluator registered for alert type {}", type);
            }
        }
    }

    /**
     * @return one result per registered family, in evaluation order
     */
    public List<RuleResult> evaluateAll(Transaction txn, EvaluationContext context) {
        List<RuleResult> results = new ArrayList<>(AlertType.values().length);

        for (AlertType type : AlertType.values()) {
            RuleEvaluator evaluator = evaluatorMap.get(type);
            if (evaluator == null) {
                continue;
            }

            Exception upstreamFailure = context.getFailures().get(type);
            if (upstreamFailure != null) {
                metricsConfig.recordRuleFailure(type.name());
                results.add(RuleResult.evaluationFailure(type, txn, upstreamFailure));
                continue;
            }

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + type)
                    .tag("rule.type", type.name())
                    .tag("txn.id", String.valueOf(txn.getTransactionId()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleResult result = evaluator.evaluate(txn, context);
                results.add(result);

                ruleSpan.tag("rule.triggered", String.valueOf(result.isTriggered()));
                if (result.isTriggered()) {
                    log.debug("Rule triggered: {} for {} {} txn {}, severity={}, reason={}",
                            type, result.getEntityType(), result.getEntityId(), txn.getTransactionId(),
                            result.getSeverity(), result.getReason());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating {} for txn {} (client={}, symbol={}): {}",
                        type, txn.getTransactionId(), txn.getClientId(), txn.getSymbol(), e.getMessage(), e);
                metricsConfig.recordRuleFailure(type.name());
                results.add(RuleResult.evaluationFailure(type, txn, e));
            } finally {
                ruleSpan.end();
            }
        }

        return results;
    }
}
