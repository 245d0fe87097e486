package com.libragraph.weather.core.history;

import com.libragraph.weather.types.Location;

import java.time.LocalDate;

/**
 * Thrown when a history batch fails part way. Every date before {@link #date()} that
 * was fetched is already committed; {@link #added()} says how many.
 */
public class HistoryAddException extends RuntimeException {

    private final Location location;
    private final LocalDate date;
    private final int added;

    public HistoryAddException(Location location, LocalDate date, int added, String message, Throwable cause) {
        super(location.name() + " " + date + ": " + message + " (" + added + " date(s) added)", cause);
        this.location = location;
        this.date = date;
        this.added = added;
    }

    public Location location() {
        return location;
    }

    public LocalDate date() {
        return date;
    }

    public int added() {
        return added;
    }
}
