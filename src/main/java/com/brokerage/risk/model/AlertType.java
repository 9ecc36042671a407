package com.brokerage.risk.model;

/**
 * Alert families. Declaration order is the order in which the rule engine
 * evaluates them for every transaction.
 */
public enum AlertType {
    HIGH_CLIENT_EXPOSURE,
    HIGH_SYMBOL_EXPOSURE,
    HIGH_TRANSACTION_VELOCITY,
    ANOMALY_DETECTED
}
