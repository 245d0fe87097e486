package com.libragraph.weather.core.location;

import com.libragraph.weather.types.Location;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class LocationManifestTest {

    private static final Location BOISE = new Location("Boise, ID", "boise_id", "-116.2", "43.6", "America/Boise");
    private static final Location OMAHA = new Location("Omaha, NE", "omaha_ne", "-95.9", "41.3", "America/Chicago");

    @TempDir
    Path tempDir;

    private Path manifestFile() {
        return tempDir.resolve("locations.json");
    }

    // --- load ---

    @Test
    void missingFileStartsEmpty() {
        LocationManifest manifest = LocationManifest.load(manifestFile());

        assertThat(manifest.locations()).isEmpty();
        assertThat(manifest.isDirty()).isFalse();
    }

    @Test
    void loadsLocationsAndFoldsAlias() throws IOException {
        Files.writeString(manifestFile(), """
                {
                  "locations": [
                    {"name": "Boise, ID", "alias": "Boise_ID", "longitude": "-116.2", "latitude": "43.6",
                     "tz": "America/Boise", "zips": ["83702"]}
                  ]
                }
                """);

        LocationManifest manifest = LocationManifest.load(manifestFile());

        assertThat(manifest.locations()).containsExactly(BOISE);
        assertThat(manifest.get("BOISE_ID")).contains(BOISE);
    }

    @Test
    void missingRootLoadsNothing() throws IOException {
        Files.writeString(manifestFile(), "{\"places\": []}");

        assertThat(LocationManifest.load(manifestFile()).size()).isZero();
    }

    @Test
    void duplicateLocationIsRejected() throws IOException {
        Files.writeString(manifestFile(), """
                {"locations": [
                  {"name": "Boise, ID", "alias": "boise_id", "longitude": "-116.2", "latitude": "43.6", "tz": "America/Boise"},
                  {"name": "Boise, ID", "alias": "boise_id", "longitude": "-116.2", "latitude": "43.6", "tz": "America/Boise"}
                ]}
                """);

        assertThatThrownBy(() -> LocationManifest.load(manifestFile()))
                .isInstanceOf(WeatherDataException.class)
                .hasMessageContaining("Duplicate location")
                .hasMessageContaining("boise_id");
    }

    @Test
    void incompleteLocationIsRejected() throws IOException {
        Files.writeString(manifestFile(), "{\"locations\": [{\"name\": \"Boise, ID\", \"alias\": \"boise_id\"}]}");

        assertThatThrownBy(() -> LocationManifest.load(manifestFile()))
                .isInstanceOf(WeatherDataException.class)
                .hasMessageContaining("Invalid location");
    }

    @Test
    void malformedJsonIsRejected() throws IOException {
        Files.writeString(manifestFile(), "{\"locations\": [");

        assertThatThrownBy(() -> LocationManifest.load(manifestFile()))
                .isInstanceOf(WeatherDataException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    // --- edits ---

    @Test
    void addSaveAndReload() {
        LocationManifest manifest = LocationManifest.load(manifestFile());
        manifest.add(BOISE);
        manifest.add(OMAHA);
        assertThat(manifest.isDirty()).isTrue();

        manifest.save();

        assertThat(manifest.isDirty()).isFalse();
        assertThat(manifestFile().resolveSibling("locations.json.tmp")).doesNotExist();
        assertThat(LocationManifest.load(manifestFile()).locations()).containsExactly(BOISE, OMAHA);
    }

    @Test
    void addRejectsMatchingNameOrAlias() {
        LocationManifest manifest = LocationManifest.load(manifestFile());
        manifest.add(BOISE);

        assertThatThrownBy(() -> manifest.add(BOISE.withAlias("boise")))
                .isInstanceOf(WeatherDataException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> manifest.add(new Location("Boise", "boise_id", "0", "0", "UTC")))
                .isInstanceOf(WeatherDataException.class);
    }

    @Test
    void modifyReplacesAliasByName() {
        LocationManifest manifest = LocationManifest.load(manifestFile());
        manifest.add(BOISE);
        manifest.save();

        assertThat(manifest.modify(BOISE.withAlias("treasure_valley"))).isTrue();
        assertThat(manifest.modify(OMAHA)).isFalse();

        assertThat(manifest.isDirty()).isTrue();
        assertThat(manifest.get("Boise, ID")).map(Location::alias).contains("treasure_valley");
        assertThat(manifest.contains("boise_id")).isFalse();
    }

    @Test
    void removeByNameOrAlias() {
        LocationManifest manifest = LocationManifest.load(manifestFile());
        manifest.add(BOISE);
        manifest.add(OMAHA);

        assertThat(manifest.remove("OMAHA_NE")).isTrue();
        assertThat(manifest.remove("Tampa, FL")).isFalse();
        assertThat(manifest.locations()).containsExactly(BOISE);
    }

    @Test
    void saveWithoutChangesDoesNotWrite() {
        LocationManifest.load(manifestFile()).save();

        assertThat(manifestFile()).doesNotExist();
    }
}
