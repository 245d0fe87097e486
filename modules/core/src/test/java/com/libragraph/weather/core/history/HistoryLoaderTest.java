package com.libragraph.weather.core.history;

import com.libragraph.weather.core.storage.ArchiveBlobStore;
import com.libragraph.weather.types.Location;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

class HistoryLoaderTest {

    private static final Location BOISE = new Location("Boise, ID", "boise_id", "-116.2", "43.6", "America/Boise");
    private static final Location OMAHA = new Location("Omaha, NE", "omaha_ne", "-95.9", "41.3", "America/Chicago");
    private static final Location TAMPA = new Location("Tampa, FL", "tampa_fl", "-82.5", "27.9", "America/New_York");

    private static final List<LocalDate> JANUARY_1_TO_3 = List.of(
            LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 2), LocalDate.of(2023, 1, 3));

    @TempDir
    Path tempDir;

    private HistoryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new HistoryLoader(2);
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private HistoryCatalog catalog(Location location) {
        return new HistoryCatalog(ArchiveBlobStore.open(tempDir.resolve(location.alias() + ".zip")), location);
    }

    private static FetchResult record(Location location, LocalDate date) {
        return FetchResult.recorded((location.alias() + ":" + date).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsEveryLocation() throws InterruptedException {
        HistoryCatalog boise = catalog(BOISE);
        HistoryCatalog omaha = catalog(OMAHA);
        HistoryCatalog tampa = catalog(TAMPA);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        Map<Location, HistoryLoader.LoadOutcome> outcomes = loader.load(List.of(
                new HistoryLoader.LoadRequest(boise, JANUARY_1_TO_3),
                new HistoryLoader.LoadRequest(omaha, JANUARY_1_TO_3),
                new HistoryLoader.LoadRequest(tampa, JANUARY_1_TO_3.subList(0, 1))), (location, date) -> {
            threads.add(Thread.currentThread().getName());
            return record(location, date);
        });

        assertThat(outcomes.keySet()).containsExactly(BOISE, OMAHA, TAMPA);
        assertThat(outcomes.values()).allMatch(HistoryLoader.LoadOutcome::succeeded);
        assertThat(outcomes.get(OMAHA).result().added()).isEqualTo(3);
        assertThat(outcomes.get(TAMPA).result().added()).isEqualTo(1);
        assertThat(boise.dates()).containsExactlyElementsOf(JANUARY_1_TO_3);
        assertThat(omaha.read(LocalDate.of(2023, 1, 2)))
                .isEqualTo("omaha_ne:2023-01-02".getBytes(StandardCharsets.UTF_8));
        assertThat(threads).allMatch(name -> name.startsWith("history-loader-"));
    }

    @Test
    void failureInOneLocationDoesNotAffectOthers() throws InterruptedException {
        HistoryCatalog boise = catalog(BOISE);
        HistoryCatalog omaha = catalog(OMAHA);

        Map<Location, HistoryLoader.LoadOutcome> outcomes = loader.load(List.of(
                new HistoryLoader.LoadRequest(boise, JANUARY_1_TO_3),
                new HistoryLoader.LoadRequest(omaha, JANUARY_1_TO_3)), (location, date) ->
                location.equals(BOISE) && date.getDayOfMonth() == 2
                        ? FetchResult.failed("quota exceeded")
                        : record(location, date));

        HistoryLoader.LoadOutcome failed = outcomes.get(BOISE);
        assertThat(failed.succeeded()).isFalse();
        assertThat(failed.error()).isInstanceOfSatisfying(HistoryAddException.class,
                e -> assertThat(e.added()).isEqualTo(1));
        assertThat(boise.dates()).containsExactly(LocalDate.of(2023, 1, 1));

        assertThat(outcomes.get(OMAHA).succeeded()).isTrue();
        assertThat(omaha.dates()).containsExactlyElementsOf(JANUARY_1_TO_3);
    }

    @Test
    void stoppedLocationReportsReason() throws InterruptedException {
        HistoryCatalog boise = catalog(BOISE);

        Map<Location, HistoryLoader.LoadOutcome> outcomes = loader.load(
                List.of(new HistoryLoader.LoadRequest(boise, JANUARY_1_TO_3)),
                (location, date) -> FetchResult.stopped("daily limit"));

        assertThat(outcomes.get(BOISE).succeeded()).isTrue();
        assertThat(outcomes.get(BOISE).result().stopReason()).isEqualTo("daily limit");
        assertThat(boise.dates()).isEmpty();
    }

    @Test
    void duplicateLocationIsRejected() {
        HistoryCatalog boise = catalog(BOISE);

        assertThatIllegalArgumentException()
                .isThrownBy(() -> loader.load(List.of(
                        new HistoryLoader.LoadRequest(boise, JANUARY_1_TO_3),
                        new HistoryLoader.LoadRequest(boise, JANUARY_1_TO_3)), HistoryLoaderTest::record))
                .withMessageContaining("Boise, ID");
    }

    @Test
    void workerCountMustBePositive() {
        assertThatIllegalArgumentException().isThrownBy(() -> new HistoryLoader(0));
        assertThat(loader.workerCount()).isEqualTo(2);
    }
}
