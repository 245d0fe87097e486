package com.libragraph.weather.core.history;

import java.time.LocalDate;

/**
 * Per-date callback of {@link HistoryCatalog#add}. Called once per missing date, in
 * ascending order, before anything is written for that date. Returning
 * {@link FetchResult.Stopped} or throwing ends the batch.
 */
@FunctionalInterface
public interface HistoryFetcher {

    FetchResult fetch(LocalDate date);
}
