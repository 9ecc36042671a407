package com.brokerage.risk.engine;

import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;

/**
 * Interface for all rule evaluators.
 * Each implementation handles one alert family.
 */
public interface RuleEvaluator {

    /**
     * The alert family this evaluator produces.
     */
    AlertType getSupportedAlertType();

    /**
     * Decide trigger/no-trigger for one transaction.
     *
     * @param txn     the transaction being evaluated
     * @param context aggregation results for this transaction
     * @return the evaluation result for this rule family
     */
    RuleResult evaluate(Transaction txn, EvaluationContext context);
}
