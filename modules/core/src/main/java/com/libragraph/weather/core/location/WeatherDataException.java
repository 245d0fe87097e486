package com.libragraph.weather.core.location;

/**
 * Thrown when the locations manifest or the data directory is inconsistent.
 */
public class WeatherDataException extends RuntimeException {

    public WeatherDataException(String message) {
        super(message);
    }

    public WeatherDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
