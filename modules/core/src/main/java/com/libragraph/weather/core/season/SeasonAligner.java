package com.libragraph.weather.core.season;

import com.libragraph.weather.types.DateRange;
import com.libragraph.weather.types.SeasonProjector;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the season window shared by histories from different years and locations.
 *
 * <p>Each range is projected onto the two synthetic years of the season timeline and
 * marks the month slots it covers. A range that does not cross a year boundary lands in
 * the first synthetic year; where the rest of the inputs occupy the same months of the
 * second year it is moved forward twelve months to line up with them. The occupied
 * slots must then form exactly one run, which becomes the window.
 */
public final class SeasonAligner {

    private static final Logger log = Logger.getLogger(SeasonAligner.class);

    private SeasonAligner() {
    }

    /**
     * @throws IllegalArgumentException       if {@code inputs} is empty
     * @throws NoCommonSeasonWindowException   if no slot is occupied
     * @throws AmbiguousSeasonWindowException  if the occupied slots form more than one run
     */
    public static SeasonAlignment align(List<LocationDateRange> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one location date range is required");
        }

        List<Set<Integer>> slotTable = slotTable(inputs);
        reconcile(slotTable, inputs);

        List<SeasonWindow> runs = occupiedRuns(slotTable);
        if (runs.isEmpty()) {
            throw new NoCommonSeasonWindowException("No month is occupied by " + inputs);
        }
        if (runs.size() > 1) {
            throw new AmbiguousSeasonWindowException(runs);
        }

        SeasonWindow window = runs.get(0);
        List<SeasonAlignment.Mapping> mappings = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            mappings.add(new SeasonAlignment.Mapping(inputs.get(i), slotsWithin(window, slotTable, i)));
        }
        log.debugf("Aligned %d range(s) on %s", inputs.size(), window);
        return new SeasonAlignment(window, mappings);
    }

    /**
     * Index 0 is unused; each slot holds the indexes of the inputs occupying it.
     */
    private static List<Set<Integer>> slotTable(List<LocationDateRange> inputs) {
        List<Set<Integer>> table = new ArrayList<>(SeasonProjector.SLOT_COUNT + 1);
        for (int slot = 0; slot <= SeasonProjector.SLOT_COUNT; slot++) {
            table.add(new LinkedHashSet<>());
        }
        for (int i = 0; i < inputs.size(); i++) {
            DateRange range = inputs.get(i).range();
            for (int slot = SeasonProjector.startSlot(range); slot <= SeasonProjector.endSlot(range); slot++) {
                table.get(slot).add(i);
            }
        }
        return table;
    }

    /**
     * Moves inputs that do not cross a year boundary from a partially occupied month of the
     * first year into the same month of the second year, when that month is occupied.
     */
    private static void reconcile(List<Set<Integer>> table, List<LocationDateRange> inputs) {
        for (int slot = 1; slot <= SeasonProjector.MONTHS_PER_YEAR; slot++) {
            Set<Integer> current = table.get(slot);
            if (current.isEmpty() || current.size() == inputs.size()) {
                continue;
            }
            Set<Integer> nextYear = table.get(slot + SeasonProjector.MONTHS_PER_YEAR);
            if (nextYear.isEmpty()) {
                continue;
            }
            List<Integer> moved = new ArrayList<>();
            for (Integer index : current) {
                if (!inputs.get(index).range().spansYears()) {
                    moved.add(index);
                }
            }
            nextYear.addAll(moved);
            current.removeAll(moved);
        }
    }

    private static List<SeasonWindow> occupiedRuns(List<Set<Integer>> table) {
        List<SeasonWindow> runs = new ArrayList<>();
        int start = 0;
        for (int slot = 1; slot <= SeasonProjector.SLOT_COUNT; slot++) {
            boolean occupied = !table.get(slot).isEmpty();
            if (occupied && start == 0) {
                start = slot;
            } else if (!occupied && start != 0) {
                runs.add(new SeasonWindow(start, slot - 1));
                start = 0;
            }
        }
        if (start != 0) {
            runs.add(new SeasonWindow(start, SeasonProjector.SLOT_COUNT));
        }
        return runs;
    }

    private static MonthSlotMap slotsWithin(SeasonWindow window, List<Set<Integer>> table, int index) {
        return MonthSlotMap.of(window.slots().filter(slot -> table.get(slot).contains(index)).toArray());
    }
}
