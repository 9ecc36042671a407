package com.brokerage.risk.model;

/**
 * Outcome of one pipeline cycle.
 *
 * @param polled     records returned by the feed
 * @param processed  transactions applied to at least one aggregate
 * @param skipped    malformed records
 * @param replayed   transactions already applied before (at or below every watermark)
 * @param alerts     alerts newly persisted
 * @param suppressed candidates dropped by the cooldown
 * @param position   feed position after the batch
 */
public record BatchResult(int polled, int processed, int skipped, int replayed,
                          int alerts, int suppressed, FeedMarker position) {

    public static BatchResult empty(FeedMarker position) {
        return new BatchResult(0, 0, 0, 0, 0, 0, position);
    }
}
