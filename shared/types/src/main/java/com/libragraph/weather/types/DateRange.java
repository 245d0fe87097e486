package com.libragraph.weather.types;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Inclusive range of calendar dates.
 *
 * <p>A single date is represented with {@code low == high}.
 */
public record DateRange(LocalDate low, LocalDate high) {

    public DateRange {
        Objects.requireNonNull(low, "low date is required");
        if (high == null) {
            high = low;
        } else if (high.isBefore(low)) {
            throw new InvalidDateRangeException(low, high);
        }
    }

    /**
     * Creates a range covering a single date.
     */
    public static DateRange of(LocalDate date) {
        return new DateRange(date, date);
    }

    public static DateRange of(LocalDate low, LocalDate high) {
        return new DateRange(low, high);
    }

    /**
     * Returns true if {@code other} lies entirely within this range.
     */
    public boolean contains(DateRange other) {
        Objects.requireNonNull(other, "other cannot be null");
        return !low.isAfter(other.low) && !high.isBefore(other.high);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(low) && !date.isAfter(high);
    }

    /**
     * Number of days between low and high; zero for a single-date range.
     */
    public long totalDays() {
        return ChronoUnit.DAYS.between(low, high);
    }

    public boolean spansYears() {
        return low.getYear() < high.getYear();
    }

    /**
     * Every date from low to high inclusive, ascending. Each call returns a new stream.
     */
    public Stream<LocalDate> dates() {
        return Stream.iterate(low, d -> !d.isAfter(high), d -> d.plusDays(1));
    }

    /**
     * Projects this range onto the year-agnostic season timeline.
     *
     * @see SeasonProjector#project(DateRange)
     */
    public DateRange asNeutralDateRange() {
        return SeasonProjector.project(this);
    }

    @Override
    public String toString() {
        return "DateRange(low=" + low + ",high=" + high + ")";
    }
}
