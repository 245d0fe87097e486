package com.libragraph.weather.types;

import java.util.Locale;
import java.util.Objects;

/**
 * A named place whose weather history is stored and compared.
 *
 * <p>Identity is the {@code name} and {@code alias} pair; coordinates and time zone
 * are descriptive only. The alias is case-folded on construction because it names
 * the location's archive and history keys.
 */
public record Location(String name, String alias, String longitude, String latitude, String tz) {

    public Location {
        name = required("name", name);
        alias = required("alias", alias).toLowerCase(Locale.ROOT);
        longitude = required("longitude", longitude);
        latitude = required("latitude", latitude);
        tz = required("tz", tz);
    }

    public boolean isName(String value) {
        return name.equalsIgnoreCase(value);
    }

    public boolean isAlias(String value) {
        return alias.equalsIgnoreCase(value);
    }

    /**
     * Returns true if the value matches either the name or the alias, ignoring case.
     */
    public boolean isConsidered(String value) {
        return value != null && (isName(value) || isAlias(value));
    }

    public Location withAlias(String newAlias) {
        return new Location(name, newAlias, longitude, latitude, tz);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Location other)) return false;
        return name.equals(other.name) && alias.equals(other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias);
    }

    private static String required(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("The location " + field + " is required.");
        }
        return value;
    }
}
