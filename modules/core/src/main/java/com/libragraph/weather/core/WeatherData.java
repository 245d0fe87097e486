package com.libragraph.weather.core;

import com.libragraph.weather.core.config.WeatherConfig;
import com.libragraph.weather.core.history.AddResult;
import com.libragraph.weather.core.history.HistoryCatalog;
import com.libragraph.weather.core.history.HistoryLoader;
import com.libragraph.weather.core.history.HistoryProvider;
import com.libragraph.weather.core.location.LocationManifest;
import com.libragraph.weather.core.location.WeatherDataException;
import com.libragraph.weather.core.storage.ArchiveBlobStore;
import com.libragraph.weather.core.storage.ArchiveProperties;
import com.libragraph.weather.core.storage.StorageException;
import com.libragraph.weather.types.DateRange;
import com.libragraph.weather.types.Location;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A weather data directory: the locations manifest plus one history archive per location.
 *
 * <p>Catalogs are opened on first use and kept until the location is removed or this
 * instance is closed. Query methods on a location without an archive return empty
 * results rather than creating one.
 */
public class WeatherData implements AutoCloseable {

    private static final Logger log = Logger.getLogger(WeatherData.class);

    private final WeatherConfig config;
    private final LocationManifest manifest;
    private final Map<Location, HistoryCatalog> catalogs = new ConcurrentHashMap<>();

    public WeatherData(WeatherConfig config) {
        this.config = config;
        log.debugf("Initializing weather data from %s", config.locationsPath());
        this.manifest = LocationManifest.load(config.locationsPath());
    }

    public static WeatherData open(Path dataDir) {
        return new WeatherData(WeatherConfig.of(dataDir));
    }

    public Path dataDir() {
        return config.dataDir();
    }

    public WeatherConfig config() {
        return config;
    }

    // -- locations --

    public List<Location> locations() {
        return manifest.locations();
    }

    public Optional<Location> getLocation(String nameOrAlias) {
        return manifest.get(nameOrAlias);
    }

    /**
     * Adds the location and saves the manifest.
     *
     * @throws WeatherDataException if a location with the same name or alias exists
     */
    public void addLocation(Location location) {
        manifest.add(location);
        manifest.save();
    }

    /**
     * Removes the location from the manifest and deletes its history archive.
     *
     * @return false if the location is unknown
     */
    public boolean removeLocation(Location location) {
        Optional<Location> known = manifest.get(location.name());
        if (known.isEmpty()) {
            return false;
        }
        Location existing = known.get();
        manifest.remove(existing.name());
        manifest.save();

        HistoryCatalog catalog = catalogs.remove(existing);
        if (catalog != null) {
            catalog.clearCache();
        }
        Path archive = archivePath(existing);
        try {
            if (Files.deleteIfExists(archive)) {
                log.infof("Deleted %s history %s", existing.name(), archive);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete history archive: " + archive, e);
        }
        return true;
    }

    /**
     * Changes a location's alias.
     *
     * @return false if the location is unknown
     * @throws WeatherDataException if the location already has history stored under its current alias
     */
    public boolean updateLocation(String name, String alias) {
        Optional<Location> known = manifest.get(name);
        if (known.isEmpty()) {
            return false;
        }
        Location existing = known.get();
        Location updated = existing.withAlias(alias);
        if (updated.alias().equals(existing.alias())) {
            return true;
        }
        if (historyExists(existing)) {
            throw new WeatherDataException("Cannot change alias of " + existing.name()
                    + ", history is stored as " + archivePath(existing));
        }
        catalogs.remove(existing);
        manifest.modify(updated);
        manifest.save();
        return true;
    }

    // -- history --

    public boolean historyExists(Location location) {
        return Files.exists(archivePath(location));
    }

    public List<LocalDate> historyDates(Location location) {
        return historyDates(location, null, null);
    }

    /**
     * Stored dates within {@code [from, to]}; a null bound is open.
     */
    public List<LocalDate> historyDates(Location location, LocalDate from, LocalDate to) {
        return existingCatalog(location).map(c -> c.dates(from, to)).orElseGet(List::of);
    }

    public List<DateRange> historyDateRanges(Location location) {
        return existingCatalog(location).map(HistoryCatalog::historyDateRanges).orElseGet(List::of);
    }

    public ArchiveProperties historyProperties(Location location) {
        return existingCatalog(location).map(HistoryCatalog::properties).orElse(ArchiveProperties.EMPTY);
    }

    /**
     * Archive properties of every location, ordered by location name.
     */
    public List<Map.Entry<Location, ArchiveProperties>> allHistoryProperties() {
        List<Location> sorted = new ArrayList<>(locations());
        sorted.sort(Comparator.comparing(Location::name));
        List<Map.Entry<Location, ArchiveProperties>> properties = new ArrayList<>(sorted.size());
        for (Location location : sorted) {
            properties.add(Map.entry(location, historyProperties(location)));
        }
        return properties;
    }

    /**
     * Fetches and stores the missing dates, creating the archive if needed.
     */
    public AddResult addHistory(Location location, List<LocalDate> dates, HistoryProvider provider) {
        if (dates.isEmpty()) {
            log.warnf("There are no %s history dates to add", location.name());
            return new AddResult(0, 0, 0, null);
        }
        return catalog(location).add(dates, provider);
    }

    public AddResult addHistory(Location location, DateRange range, HistoryProvider provider) {
        return catalog(location).add(range, provider);
    }

    /**
     * Adds history for several locations concurrently on the configured number of workers.
     */
    public Map<Location, HistoryLoader.LoadOutcome> addHistory(Map<Location, List<LocalDate>> dates,
                                                               HistoryProvider provider)
            throws InterruptedException {
        List<HistoryLoader.LoadRequest> requests = new ArrayList<>(dates.size());
        dates.forEach((location, days) -> requests.add(new HistoryLoader.LoadRequest(catalog(location), days)));
        try (HistoryLoader loader = new HistoryLoader(config.loaderWorkerCount())) {
            return loader.load(requests, provider);
        }
    }

    /**
     * Reads the stored days within the range, keyed by date in ascending order.
     */
    public Map<LocalDate, byte[]> readHistory(Location location, DateRange range) {
        Optional<HistoryCatalog> catalog = existingCatalog(location);
        if (catalog.isEmpty()) {
            return Map.of();
        }
        return catalog.get().read(catalog.get().dates(range.low(), range.high()));
    }

    /**
     * Reads every stored day of every location into the store caches.
     */
    public void preload() {
        for (Location location : locations()) {
            existingCatalog(location).ifPresent(c -> {
                c.read(c.dates());
                log.debugf("Preloaded %s history", location.name());
            });
        }
    }

    /**
     * Saves the manifest if it changed and drops the open catalogs.
     */
    @Override
    public void close() {
        manifest.save();
        catalogs.values().forEach(HistoryCatalog::clearCache);
        catalogs.clear();
    }

    private Path archivePath(Location location) {
        return config.archivePath(location.alias());
    }

    private HistoryCatalog catalog(Location location) {
        return catalogs.computeIfAbsent(location, l ->
                new HistoryCatalog(ArchiveBlobStore.open(archivePath(l)), l, config.historyExtension()));
    }

    private Optional<HistoryCatalog> existingCatalog(Location location) {
        HistoryCatalog open = catalogs.get(location);
        if (open != null) {
            return Optional.of(open);
        }
        return historyExists(location) ? Optional.of(catalog(location)) : Optional.empty();
    }
}
