package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Comparator;

/**
 * Position in the transaction feed: the (timestamp, id) of the last transaction
 * handed to the engine. Ordering is by timestamp, then id, so the marker advances
 * strictly even when several transactions share a timestamp.
 */
@Schema(description = "Feed position of the last processed transaction")
public record FeedMarker(
        @Schema(description = "Transaction timestamp in epoch milliseconds", example = "1739886764000")
        long timestamp,
        @Schema(description = "Transaction id", example = "42017")
        long transactionId) implements Comparable<FeedMarker> {

    public static final FeedMarker START = new FeedMarker(0L, 0L);

    private static final Comparator<FeedMarker> ORDER =
            Comparator.comparingLong(FeedMarker::timestamp).thenComparingLong(FeedMarker::transactionId);

    @Override
    public int compareTo(FeedMarker other) {
        return ORDER.compare(this, other);
    }

    public boolean isAfter(FeedMarker other) {
        return other == null || compareTo(other) > 0;
    }
}
