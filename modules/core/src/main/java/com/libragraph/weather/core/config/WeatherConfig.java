package com.libragraph.weather.core.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings of a weather data directory, read from MicroProfile Config.
 *
 * <p>Keys and defaults:
 * <ul>
 *   <li>{@code weather.data-dir}: {@code weather_data}</li>
 *   <li>{@code weather.locations-file}: {@code locations.json}, relative to the data directory</li>
 *   <li>{@code weather.history.extension}: {@code json}</li>
 *   <li>{@code weather.loader.worker-count}: {@code 4}</li>
 * </ul>
 */
public record WeatherConfig(Path dataDir, String locationsFile, String historyExtension, int loaderWorkerCount) {

    public static final String DATA_DIR = "weather.data-dir";
    public static final String LOCATIONS_FILE = "weather.locations-file";
    public static final String HISTORY_EXTENSION = "weather.history.extension";
    public static final String LOADER_WORKER_COUNT = "weather.loader.worker-count";

    public static final String DEFAULT_DATA_DIR = "weather_data";
    public static final String DEFAULT_LOCATIONS_FILE = "locations.json";
    public static final String DEFAULT_HISTORY_EXTENSION = "json";
    public static final int DEFAULT_LOADER_WORKER_COUNT = 4;

    public WeatherConfig {
        Objects.requireNonNull(dataDir, "dataDir cannot be null");
        if (locationsFile == null || locationsFile.isBlank()) {
            throw new IllegalArgumentException(LOCATIONS_FILE + " cannot be blank");
        }
        if (historyExtension == null || historyExtension.isBlank()) {
            throw new IllegalArgumentException(HISTORY_EXTENSION + " cannot be blank");
        }
        if (loaderWorkerCount < 1) {
            throw new IllegalArgumentException(LOADER_WORKER_COUNT + " must be >= 1, got: " + loaderWorkerCount);
        }
    }

    /**
     * Defaults for the given data directory.
     */
    public static WeatherConfig of(Path dataDir) {
        return new WeatherConfig(dataDir, DEFAULT_LOCATIONS_FILE, DEFAULT_HISTORY_EXTENSION,
                DEFAULT_LOADER_WORKER_COUNT);
    }

    /**
     * Reads the configuration visible to the current thread's class loader.
     */
    public static WeatherConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static WeatherConfig from(Config config) {
        return new WeatherConfig(
                Path.of(config.getOptionalValue(DATA_DIR, String.class).orElse(DEFAULT_DATA_DIR)),
                config.getOptionalValue(LOCATIONS_FILE, String.class).orElse(DEFAULT_LOCATIONS_FILE),
                config.getOptionalValue(HISTORY_EXTENSION, String.class).orElse(DEFAULT_HISTORY_EXTENSION),
                config.getOptionalValue(LOADER_WORKER_COUNT, Integer.class).orElse(DEFAULT_LOADER_WORKER_COUNT));
    }

    public Path locationsPath() {
        return dataDir.resolve(locationsFile);
    }

    /**
     * Archive holding one location's history.
     */
    public Path archivePath(String alias) {
        return dataDir.resolve(alias + ".zip");
    }
}
