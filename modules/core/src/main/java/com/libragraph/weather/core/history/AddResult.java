package com.libragraph.weather.core.history;

/**
 * Summary of a {@link HistoryCatalog#add} batch.
 *
 * @param requested  distinct dates requested
 * @param added      dates fetched and committed
 * @param skipped    dates already present, not fetched
 * @param stopReason why the batch ended early, or {@code null} if it ran to completion
 */
public record AddResult(int requested, int added, int skipped, String stopReason) {

    public boolean isStopped() {
        return stopReason != null;
    }
}
