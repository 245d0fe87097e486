package com.libragraph.weather.core.season;

import com.libragraph.weather.types.DateRange;
import com.libragraph.weather.types.SeasonProjector;

import java.time.LocalDate;
import java.time.Month;
import java.util.stream.IntStream;

/**
 * Contiguous run of month slots {@code [startSlot, endSlot]} on the season timeline.
 */
public record SeasonWindow(int startSlot, int endSlot) {

    public SeasonWindow {
        if (startSlot < 1 || endSlot > SeasonProjector.SLOT_COUNT || startSlot > endSlot) {
            throw new IllegalArgumentException("Invalid season window [" + startSlot + ", " + endSlot + "]");
        }
    }

    public Month startMonth() {
        return SeasonProjector.slotMonth(startSlot);
    }

    public Month endMonth() {
        return SeasonProjector.slotMonth(endSlot);
    }

    /**
     * Number of months in the window.
     */
    public int length() {
        return endSlot - startSlot + 1;
    }

    public boolean contains(int slot) {
        return slot >= startSlot && slot <= endSlot;
    }

    public IntStream slots() {
        return IntStream.rangeClosed(startSlot, endSlot);
    }

    /**
     * The window as a neutral date range, from the first day of the start month to the
     * last day of the end month.
     */
    public DateRange asNeutralDateRange() {
        LocalDate low = slotDate(startSlot).withDayOfMonth(1);
        LocalDate endMonth = slotDate(endSlot);
        return DateRange.of(low, endMonth.withDayOfMonth(endMonth.lengthOfMonth()));
    }

    private static LocalDate slotDate(int slot) {
        int year = slot > SeasonProjector.MONTHS_PER_YEAR ? SeasonProjector.EPOCH_YEAR + 1 : SeasonProjector.EPOCH_YEAR;
        return LocalDate.of(year, SeasonProjector.slotMonth(slot), 1);
    }

    @Override
    public String toString() {
        return "[" + startMonth() + ".." + endMonth() + "]";
    }
}
