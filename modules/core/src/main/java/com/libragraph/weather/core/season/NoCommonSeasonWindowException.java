package com.libragraph.weather.core.season;

/**
 * Thrown when no month slot is occupied after reconciliation.
 */
public class NoCommonSeasonWindowException extends SeasonAlignmentException {

    public NoCommonSeasonWindowException(String message) {
        super(message);
    }
}
