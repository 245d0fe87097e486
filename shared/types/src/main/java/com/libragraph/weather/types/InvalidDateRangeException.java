package com.libragraph.weather.types;

import java.time.LocalDate;

/**
 * Thrown when a date range is constructed with a high date before its low date.
 */
public class InvalidDateRangeException extends IllegalArgumentException {

    private final LocalDate low;
    private final LocalDate high;

    public InvalidDateRangeException(LocalDate low, LocalDate high) {
        super("DateRange: high date (" + high + ") cannot be less than low date (" + low + ")");
        this.low = low;
        this.high = high;
    }

    public LocalDate low() {
        return low;
    }

    public LocalDate high() {
        return high;
    }
}
