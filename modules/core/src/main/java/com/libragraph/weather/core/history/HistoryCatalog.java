package com.libragraph.weather.core.history;

import com.libragraph.weather.core.storage.ArchiveProperties;
import com.libragraph.weather.core.storage.BlobStore;
import com.libragraph.weather.types.DateRange;
import com.libragraph.weather.types.HistoryKey;
import com.libragraph.weather.types.Location;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One location's weather history, stored one blob per day in a {@link BlobStore}.
 *
 * <p>The set of known dates is parsed from the store's keys on first use and cached
 * until the next successful {@link #add}.
 */
public class HistoryCatalog {

    private static final Logger log = Logger.getLogger(HistoryCatalog.class);

    static final String INTERRUPTED = "interrupted";

    private final BlobStore store;
    private final Location location;
    private final String extension;

    private volatile List<LocalDate> dates;

    public HistoryCatalog(BlobStore store, Location location) {
        this(store, location, HistoryKey.DEFAULT_EXTENSION);
    }

    public HistoryCatalog(BlobStore store, Location location, String extension) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.location = Objects.requireNonNull(location, "location cannot be null");
        this.extension = Objects.requireNonNull(extension, "extension cannot be null");
    }

    public Location location() {
        return location;
    }

    public BlobStore store() {
        return store;
    }

    /**
     * Storage key of the given day.
     */
    public String keyFor(LocalDate date) {
        return HistoryKey.of(location, date, extension).toString();
    }

    public boolean exists(LocalDate date) {
        return store.exists(keyFor(date));
    }

    /**
     * All stored dates, ascending.
     */
    public List<LocalDate> dates() {
        return knownDates();
    }

    /**
     * Stored dates within {@code [from, to]}, ascending. A null bound is open.
     */
    public List<LocalDate> dates(LocalDate from, LocalDate to) {
        List<LocalDate> all = knownDates();
        if (from == null && to == null) {
            return all;
        }
        return all.stream()
                .filter(d -> from == null || !d.isBefore(from))
                .filter(d -> to == null || !d.isAfter(to))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Merges the stored dates into maximal runs of consecutive days.
     */
    public List<DateRange> historyDateRanges() {
        List<LocalDate> all = knownDates();
        List<DateRange> ranges = new ArrayList<>();
        if (all.isEmpty()) {
            return ranges;
        }
        LocalDate first = all.get(0);
        LocalDate last = first;
        for (LocalDate current : all.subList(1, all.size())) {
            if (current.isAfter(last.plusDays(1))) {
                ranges.add(DateRange.of(first, last));
                first = current;
            }
            last = current;
        }
        ranges.add(DateRange.of(first, last));
        return ranges;
    }

    /**
     * Fetches and stores each requested date that is not already stored.
     *
     * <p>Dates are processed in ascending order, each committed in its own write
     * transaction, so a failure only loses the date being processed. The batch ends
     * early, without error, when the fetcher returns {@link FetchResult.Stopped} or the
     * thread is interrupted.
     *
     * @throws HistoryAddException if the fetcher fails or a date cannot be stored
     */
    public AddResult add(Collection<LocalDate> requested, HistoryFetcher fetcher) {
        Objects.requireNonNull(fetcher, "fetcher cannot be null");
        SortedSet<LocalDate> ordered = new TreeSet<>(requested);
        int added = 0;
        int skipped = 0;
        try {
            for (LocalDate date : ordered) {
                String key = keyFor(date);
                if (store.exists(key)) {
                    log.warnf("%s history for %s already exists, skipping", location.name(), date);
                    skipped++;
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warnf("%s history add interrupted before %s", location.name(), date);
                    return new AddResult(ordered.size(), added, skipped, INTERRUPTED);
                }

                FetchResult result;
                try {
                    result = fetcher.fetch(date);
                } catch (RuntimeException e) {
                    throw new HistoryAddException(location, date, added, "fetch failed", e);
                }

                if (result instanceof FetchResult.Recorded recorded) {
                    try {
                        store.useTransaction(tx -> tx.write(key, recorded.payload()));
                    } catch (RuntimeException e) {
                        throw new HistoryAddException(location, date, added, "failed to store history", e);
                    }
                    added++;
                } else if (result instanceof FetchResult.Stopped stopped) {
                    log.warnf("%s history add stopped at %s: %s", location.name(), date, stopped.reason());
                    return new AddResult(ordered.size(), added, skipped, stopped.reason());
                } else if (result instanceof FetchResult.Failed failed) {
                    log.errorf("%s history for %s failed: %s", location.name(), date, failed.message());
                    throw new HistoryAddException(location, date, added, failed.message(), failed.cause());
                } else {
                    throw new HistoryAddException(location, date, added, "fetcher returned no result", null);
                }
            }
            log.debugf("%s: added %d, skipped %d of %d date(s)", location.name(), added, skipped, ordered.size());
            return new AddResult(ordered.size(), added, skipped, null);
        } finally {
            if (added > 0) {
                invalidateDates();
            }
        }
    }

    /**
     * Fetches missing dates from a provider.
     */
    public AddResult add(Collection<LocalDate> requested, HistoryProvider provider) {
        Objects.requireNonNull(provider, "provider cannot be null");
        return add(requested, (HistoryFetcher) date -> provider.fetch(location, date));
    }

    public AddResult add(DateRange range, HistoryProvider provider) {
        return add(range.dates().collect(Collectors.toList()), provider);
    }

    /**
     * Reads one day's payload.
     *
     * @throws com.libragraph.weather.core.storage.BlobNotFoundException if the date is not stored
     */
    public byte[] read(LocalDate date) {
        return store.read(keyFor(date));
    }

    /**
     * Reads several days through one reader, keyed by date in the order given.
     */
    public Map<LocalDate, byte[]> read(Collection<LocalDate> requested) {
        Map<LocalDate, byte[]> contents = new LinkedHashMap<>();
        try (BlobStore.Reader reader = store.reader()) {
            for (LocalDate date : requested) {
                contents.put(date, reader.read(keyFor(date)));
            }
        }
        return contents;
    }

    public ArchiveProperties properties() {
        return store.properties();
    }

    public void clearCache() {
        store.clearCache();
        invalidateDates();
    }

    /**
     * Takes the scan lock so a scan that started before a commit cannot publish after this.
     */
    private synchronized void invalidateDates() {
        dates = null;
    }

    private List<LocalDate> knownDates() {
        List<LocalDate> current = dates;
        if (current == null) {
            synchronized (this) {
                current = dates;
                if (current == null) {
                    current = scan();
                    dates = current;
                }
            }
        }
        return current;
    }

    private List<LocalDate> scan() {
        SortedSet<LocalDate> found = new TreeSet<>();
        for (String key : store.keys()) {
            HistoryKey parsed;
            try {
                parsed = HistoryKey.parse(key);
            } catch (IllegalArgumentException e) {
                log.debugf("Ignoring %s in %s: %s", key, store.path(), e.getMessage());
                continue;
            }
            if (parsed.isFor(location)) {
                found.add(parsed.date());
            } else {
                log.debugf("Ignoring %s in %s: not %s history", key, store.path(), location.alias());
            }
        }
        return List.copyOf(found);
    }
}
