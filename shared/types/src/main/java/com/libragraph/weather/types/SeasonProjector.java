package com.libragraph.weather.types;

import java.time.LocalDate;
import java.time.Month;

/**
 * Maps date ranges onto a year-agnostic timeline of two synthetic years.
 *
 * <p>The low date is moved into {@link #EPOCH_YEAR}; the high date is moved into
 * {@code EPOCH_YEAR} or, when the range crosses a year boundary, the year after.
 * Neither synthetic year is a leap year so February 29 becomes February 28.
 *
 * <p>Month slots number the 24 months of the two synthetic years 1..24, so
 * January of the second year is slot 13.
 */
public final class SeasonProjector {

    public static final int EPOCH_YEAR = 1;

    public static final int MONTHS_PER_YEAR = 12;

    public static final int SLOT_COUNT = 2 * MONTHS_PER_YEAR;

    private SeasonProjector() {
    }

    public static DateRange project(DateRange range) {
        LocalDate low = neutralDate(EPOCH_YEAR, range.low());
        LocalDate high = neutralDate(range.spansYears() ? EPOCH_YEAR + 1 : EPOCH_YEAR, range.high());
        return new DateRange(low, high);
    }

    /**
     * First month slot occupied by the range.
     */
    public static int startSlot(DateRange range) {
        return project(range).low().getMonthValue();
    }

    /**
     * Last month slot occupied by the range, in 13..24 when the range spans years.
     */
    public static int endSlot(DateRange range) {
        int month = project(range).high().getMonthValue();
        return range.spansYears() ? month + MONTHS_PER_YEAR : month;
    }

    /**
     * Calendar month represented by a slot in 1..24.
     */
    public static Month slotMonth(int slot) {
        if (slot < 1 || slot > SLOT_COUNT) {
            throw new IllegalArgumentException("slot must be in 1.." + SLOT_COUNT + ", got: " + slot);
        }
        return Month.of((slot - 1) % MONTHS_PER_YEAR + 1);
    }

    private static LocalDate neutralDate(int year, LocalDate date) {
        int day = date.getMonth() == Month.FEBRUARY && date.getDayOfMonth() == 29 ? 28 : date.getDayOfMonth();
        return LocalDate.of(year, date.getMonth(), day);
    }
}
