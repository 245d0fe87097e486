package com.libragraph.weather.core.season;

import java.util.List;

/**
 * Thrown when the occupied month slots form more than one run.
 */
public class AmbiguousSeasonWindowException extends SeasonAlignmentException {

    private final List<SeasonWindow> candidates;

    public AmbiguousSeasonWindowException(List<SeasonWindow> candidates) {
        super("Date ranges do not share a single season window, candidates: " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    /**
     * The separate runs that were found, in slot order.
     */
    public List<SeasonWindow> candidates() {
        return candidates;
    }
}
