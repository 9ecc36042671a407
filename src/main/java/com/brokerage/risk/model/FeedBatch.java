package com.brokerage.risk.model;

import java.util.List;

/**
 * One poll of the feed. {@code newMarker} is the position of the last
 * transaction in the batch, or the polled marker when the batch is empty.
 */
public record FeedBatch(List<Transaction> transactions, FeedMarker newMarker) {

    public static FeedBatch empty(FeedMarker marker) {
        return new FeedBatch(List.of(), marker);
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    public int size() {
        return transactions.size();
    }
}
