package com.libragraph.weather.core.history;

import com.libragraph.weather.types.Location;

import java.time.LocalDate;

/**
 * Source of raw weather history, typically a remote weather API client.
 *
 * <p>Payloads are opaque; the catalog stores them without interpretation.
 */
@FunctionalInterface
public interface HistoryProvider {

    FetchResult fetch(Location location, LocalDate date);
}
