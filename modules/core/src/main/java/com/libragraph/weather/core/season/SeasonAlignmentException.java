package com.libragraph.weather.core.season;

/**
 * Base exception for season alignment failures. The caller must choose different inputs.
 */
public class SeasonAlignmentException extends RuntimeException {

    public SeasonAlignmentException(String message) {
        super(message);
    }
}
