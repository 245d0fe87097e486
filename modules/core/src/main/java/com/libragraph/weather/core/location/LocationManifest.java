package com.libragraph.weather.core.location;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.weather.types.Location;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The known locations, persisted as {@code {"locations": [...]}}.
 *
 * <p>A location is matched by name or alias, case-insensitively. Changes are held in
 * memory until {@link #save()}, which only writes when something changed.
 */
public class LocationManifest {

    private static final Logger log = Logger.getLogger(LocationManifest.class);

    public static final String ROOT = "locations";

    private final Path path;
    private final ObjectMapper objectMapper;
    private final List<Location> locations = new ArrayList<>();
    private boolean dirty;

    private LocationManifest(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static LocationManifest load(Path path) {
        return load(path, defaultObjectMapper());
    }

    /**
     * Reads the manifest, or starts an empty one if the file does not exist.
     *
     * @throws WeatherDataException if the file cannot be parsed, a location is incomplete,
     *                              or a location appears twice
     */
    public static LocationManifest load(Path path, ObjectMapper objectMapper) {
        Objects.requireNonNull(path, "path cannot be null");
        LocationManifest manifest = new LocationManifest(path, objectMapper);
        if (!Files.exists(path)) {
            log.debugf("%s not found, starting with no locations", path);
            return manifest;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new WeatherDataException("Failed to read " + path, e);
        }
        JsonNode entries = root == null ? null : root.get(ROOT);
        if (entries == null || !entries.isArray() || entries.isEmpty()) {
            log.warnf("Locations root '%s' was not found in %s", ROOT, path);
            return manifest;
        }
        for (JsonNode entry : entries) {
            Location location;
            try {
                location = objectMapper.treeToValue(entry, Location.class);
            } catch (IOException | IllegalArgumentException e) {
                throw new WeatherDataException("Invalid location in " + path + ": " + entry, e);
            }
            if (manifest.indexOf(matching(location)) >= 0) {
                throw new WeatherDataException("Duplicate location in '" + ROOT + "': name='"
                        + location.name() + "' alias='" + location.alias() + "'");
            }
            manifest.locations.add(location);
        }
        log.debugf("Loaded %d location(s) from %s", manifest.locations.size(), path);
        return manifest;
    }

    public Path path() {
        return path;
    }

    public synchronized List<Location> locations() {
        return List.copyOf(locations);
    }

    public synchronized int size() {
        return locations.size();
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized boolean contains(String nameOrAlias) {
        return indexOf(loc -> loc.isConsidered(nameOrAlias)) >= 0;
    }

    public synchronized Optional<Location> get(String nameOrAlias) {
        int idx = indexOf(loc -> loc.isConsidered(nameOrAlias));
        return idx < 0 ? Optional.empty() : Optional.of(locations.get(idx));
    }

    /**
     * @throws WeatherDataException if a location with the same name or alias exists
     */
    public synchronized void add(Location location) {
        Objects.requireNonNull(location, "location cannot be null");
        if (indexOf(matching(location)) >= 0) {
            throw new WeatherDataException("'" + location.name() + "' already exists");
        }
        locations.add(location);
        dirty = true;
    }

    /**
     * Replaces the location with the same name, or failing that the same alias.
     *
     * @return false if there is no such location
     */
    public synchronized boolean modify(Location location) {
        Objects.requireNonNull(location, "location cannot be null");
        int idx = indexOf(loc -> loc.isName(location.name()));
        if (idx < 0) {
            idx = indexOf(matching(location));
        }
        if (idx < 0) {
            return false;
        }
        locations.set(idx, location);
        dirty = true;
        return true;
    }

    /**
     * @return false if there is no such location
     */
    public synchronized boolean remove(String nameOrAlias) {
        int idx = indexOf(loc -> loc.isConsidered(nameOrAlias));
        if (idx < 0) {
            return false;
        }
        locations.remove(idx);
        dirty = true;
        return true;
    }

    /**
     * Writes the manifest if it changed, through a temporary file moved into place.
     */
    public synchronized void save() {
        if (!dirty) {
            return;
        }
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode entries = root.putArray(ROOT);
        locations.forEach(location -> entries.add(objectMapper.valueToTree(location)));

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new WeatherDataException("Failed to save " + path, e);
        }
        dirty = false;
        log.infof("Saved %d location(s) to %s", locations.size(), path);
    }

    private static Predicate<Location> matching(Location location) {
        return loc -> loc.isConsidered(location.name()) || loc.isConsidered(location.alias());
    }

    private int indexOf(Predicate<Location> matcher) {
        for (int i = 0; i < locations.size(); i++) {
            if (matcher.test(locations.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
