/**
 * Pure Java value types shared across all weather modules.
 *
 * <p>Holds the calendar algebra ({@link com.libragraph.weather.types.DateRange},
 * {@link com.libragraph.weather.types.SeasonProjector}) and the identities used to
 * name stored history ({@link com.libragraph.weather.types.Location},
 * {@link com.libragraph.weather.types.HistoryKey}).
 * No framework dependencies.
 */
package com.libragraph.weather.types;
