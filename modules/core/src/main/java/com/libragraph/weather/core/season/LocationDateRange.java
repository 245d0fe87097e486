package com.libragraph.weather.core.season;

import com.libragraph.weather.types.DateRange;
import com.libragraph.weather.types.Location;

import java.util.Objects;

/**
 * A location's history selected for season comparison.
 */
public record LocationDateRange(Location location, DateRange range) {

    public LocationDateRange {
        Objects.requireNonNull(location, "location cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }
}
