package com.brokerage.risk.service;

import com.brokerage.risk.exception.DataIntegrityException;
import com.brokerage.risk.model.Transaction;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed feed records before they reach any aggregate.
 */
@Component
public class TransactionValidator {

    // Relative tolerance between totalValue and quantity x price
    static final double TOTAL_VALUE_TOLERANCE = 1e-6;

    /**
     * @throws DataIntegrityException describing the first problem found
     */
    public void validate(Transaction txn) {
        long id = txn.getTransactionId();
        if (id <= 0) {
            throw new DataIntegrityException(id, "transaction id must be positive");
        }
        if (txn.getTimestamp() <= 0) {
            throw new DataIntegrityException(id, "timestamp must be positive");
        }
        if (isBlank(txn.getClientId())) {
            throw new DataIntegrityException(id, "clientId is missing");
        }
        if (isBlank(txn.getSymbol())) {
            throw new DataIntegrityException(id, "symbol is missing");
        }
        if (txn.getSide() == null) {
            throw new DataIntegrityException(id, "side must be BUY or SELL");
        }
        if (txn.getQuantity() <= 0) {
            throw new DataIntegrityException(id, "quantity must be > 0, was " + txn.getQuantity());
        }
        if (!(txn.getPrice() > 0) || Double.isInfinite(txn.getPrice())) {
            throw new DataIntegrityException(id, "price must be > 0, was " + txn.getPrice());
        }
        double expected = txn.getQuantity() * txn.getPrice();
        if (Math.abs(txn.getTotalValue() - expected) > TOTAL_VALUE_TOLERANCE * Math.max(1.0, expected)) {
            throw new DataIntegrityException(id, String.format(
                    "totalValue %.2f does not equal quantity x price %.2f", txn.getTotalValue(), expected));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
