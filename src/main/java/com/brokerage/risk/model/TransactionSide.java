package com.brokerage.risk.model;

public enum TransactionSide {
    BUY,
    SELL;

    /**
     * Lenient parse used when mapping store records. Returns null for unknown
     * values so validation can reject the record with its identifying fields.
     */
    public static TransactionSide parse(String value) {
        if (value == null) return null;
        try {
            return TransactionSide.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
