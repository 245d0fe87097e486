package com.libragraph.weather.core.season;

import java.util.List;
import java.util.Optional;

/**
 * Result of aligning several histories onto one season window.
 *
 * @param window   the single run of occupied month slots
 * @param mappings one entry per input, in input order
 */
public record SeasonAlignment(SeasonWindow window, List<Mapping> mappings) {

    /**
     * The slots within the window that one input occupies.
     */
    public record Mapping(LocationDateRange source, MonthSlotMap slots) {
    }

    public SeasonAlignment {
        mappings = List.copyOf(mappings);
    }

    public Optional<Mapping> mappingFor(LocationDateRange source) {
        return mappings.stream().filter(m -> m.source().equals(source)).findFirst();
    }

    /**
     * The part of the window occupied by every input.
     *
     * @return empty when no slot is shared by all inputs, or the shared slots are not contiguous
     */
    public Optional<SeasonWindow> commonWindow() {
        int start = 0;
        int end = 0;
        for (int slot = window.startSlot(); slot <= window.endSlot(); slot++) {
            if (!occupiedByAll(slot)) {
                continue;
            }
            if (start == 0) {
                start = slot;
            } else if (slot != end + 1) {
                return Optional.empty();
            }
            end = slot;
        }
        return start == 0 ? Optional.empty() : Optional.of(new SeasonWindow(start, end));
    }

    private boolean occupiedByAll(int slot) {
        return mappings.stream().allMatch(m -> m.slots().isOccupied(slot));
    }
}
