package com.libragraph.weather.core.history;

import com.libragraph.weather.types.Location;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adds history for several locations at once on a fixed pool of workers.
 *
 * <p>Each location has its own archive, so batches never contend. A failure in one
 * location is reported in its {@link LoadOutcome} and does not affect the others.
 * Interrupting the calling thread cancels the outstanding batches; each stops before
 * its next provider call.
 */
public class HistoryLoader implements AutoCloseable {

    private static final Logger log = Logger.getLogger(HistoryLoader.class);

    private final ExecutorService executor;
    private final int workerCount;

    public record LoadRequest(HistoryCatalog catalog, List<LocalDate> dates) {
        public LoadRequest {
            Objects.requireNonNull(catalog, "catalog cannot be null");
            dates = List.copyOf(dates);
        }
    }

    public record LoadOutcome(Location location, AddResult result, Throwable error) {

        public boolean succeeded() {
            return error == null;
        }

        static LoadOutcome success(Location location, AddResult result) {
            return new LoadOutcome(location, result, null);
        }

        static LoadOutcome failure(Location location, Throwable error) {
            return new LoadOutcome(location, null, error);
        }
    }

    public HistoryLoader(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
        }
        this.workerCount = workerCount;
        this.executor = Executors.newFixedThreadPool(workerCount, new LoaderThreadFactory());
    }

    public int workerCount() {
        return workerCount;
    }

    /**
     * Runs every request and waits for all of them.
     *
     * @return one outcome per location, in request order
     * @throws IllegalArgumentException if two requests target the same location
     * @throws InterruptedException     if interrupted while waiting; outstanding batches are cancelled
     */
    public Map<Location, LoadOutcome> load(List<LoadRequest> requests, HistoryProvider provider)
            throws InterruptedException {
        Objects.requireNonNull(provider, "provider cannot be null");

        Map<Location, LoadRequest> byLocation = new LinkedHashMap<>();
        for (LoadRequest request : requests) {
            Location location = request.catalog().location();
            if (byLocation.putIfAbsent(location, request) != null) {
                throw new IllegalArgumentException("Duplicate load request for " + location.name());
            }
        }

        Map<Location, Future<AddResult>> futures = new LinkedHashMap<>();
        byLocation.forEach((location, request) ->
                futures.put(location, executor.submit(() -> request.catalog().add(request.dates(), provider))));
        log.infof("Loading history for %d location(s) on %d worker(s)", futures.size(), workerCount);

        Map<Location, LoadOutcome> outcomes = new LinkedHashMap<>();
        try {
            for (Map.Entry<Location, Future<AddResult>> entry : futures.entrySet()) {
                Location location = entry.getKey();
                try {
                    AddResult result = entry.getValue().get();
                    log.infof("%s: %d added, %d skipped%s", location.name(), result.added(), result.skipped(),
                            result.isStopped() ? " (stopped: " + result.stopReason() + ")" : "");
                    outcomes.put(location, LoadOutcome.success(location, result));
                } catch (ExecutionException e) {
                    log.errorf(e.getCause(), "History load failed for %s", location.name());
                    outcomes.put(location, LoadOutcome.failure(location, e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            log.warn("History load interrupted, cancelling outstanding locations");
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        }
        return outcomes;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                List<Runnable> dropped = new ArrayList<>(executor.shutdownNow());
                log.warnf("HistoryLoader forced shutdown, %d queued batch(es) dropped", dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class LoaderThreadFactory implements ThreadFactory {

        private final AtomicInteger next = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "history-loader-" + next.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
