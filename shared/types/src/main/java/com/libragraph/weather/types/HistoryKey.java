package com.libragraph.weather.types;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Storage key of one day of a location's history.
 *
 * <p>String format: {@code {alias}/{alias}-{YYYYMMDD}.{extension}}, for example
 * {@code boise_id/boise_id-20230115.json}.
 */
public record HistoryKey(String alias, LocalDate date, String extension) {

    public static final String DEFAULT_EXTENSION = "json";

    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public HistoryKey {
        Objects.requireNonNull(alias, "alias cannot be null");
        Objects.requireNonNull(date, "date cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
        alias = alias.toLowerCase(Locale.ROOT);
        if (alias.isBlank() || alias.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Invalid history alias: '" + alias + "'");
        }
        if (extension.isBlank()) {
            throw new IllegalArgumentException("extension cannot be blank");
        }
    }

    public static HistoryKey of(Location location, LocalDate date) {
        return new HistoryKey(location.alias(), date, DEFAULT_EXTENSION);
    }

    public static HistoryKey of(Location location, LocalDate date, String extension) {
        return new HistoryKey(location.alias(), date, extension);
    }

    /**
     * Parses a storage key back into a HistoryKey.
     *
     * @throws IllegalArgumentException if the key does not follow the history naming convention
     */
    public static HistoryKey parse(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        int slash = key.lastIndexOf('/');
        String basename = slash < 0 ? key : key.substring(slash + 1);

        int dot = basename.lastIndexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException("Invalid history key (no extension): " + key);
        }
        String stem = basename.substring(0, dot);
        String extension = basename.substring(dot + 1);

        int dash = stem.lastIndexOf('-');
        if (dash < 0) {
            throw new IllegalArgumentException("Invalid history key (no '-' separator): " + key);
        }
        String alias = stem.substring(0, dash);
        String ymd = stem.substring(dash + 1);
        if (ymd.length() != 8) {
            throw new IllegalArgumentException("Invalid history key (bad date): " + key);
        }

        LocalDate date;
        try {
            date = LocalDate.parse(ymd, BASIC_DATE);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid history key (bad date): " + key, e);
        }

        if (slash >= 0 && !key.substring(0, slash).equalsIgnoreCase(alias)) {
            throw new IllegalArgumentException("Invalid history key (directory does not match alias): " + key);
        }

        return new HistoryKey(alias, date, extension);
    }

    public boolean isFor(Location location) {
        return alias.equals(location.alias());
    }

    /**
     * Returns the storage key representation.
     */
    @Override
    public String toString() {
        return alias + "/" + alias + "-" + date.format(BASIC_DATE) + "." + extension;
    }
}
