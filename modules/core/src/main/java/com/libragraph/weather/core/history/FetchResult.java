package com.libragraph.weather.core.history;

import java.util.Objects;

/**
 * Outcome of fetching one day of history from a provider.
 */
public sealed interface FetchResult {

    /** The provider returned the day's payload, stored as-is. */
    record Recorded(byte[] payload) implements FetchResult {
        public Recorded {
            Objects.requireNonNull(payload, "payload cannot be null");
        }
    }

    /** The provider asked to stop fetching, e.g. a usage limit was reached. Not an error. */
    record Stopped(String reason) implements FetchResult {}

    /** The provider could not supply the day. */
    record Failed(String message, Throwable cause) implements FetchResult {}

    static FetchResult recorded(byte[] payload) {
        return new Recorded(payload);
    }

    static FetchResult stopped(String reason) {
        return new Stopped(reason);
    }

    static FetchResult failed(String message) {
        return new Failed(message, null);
    }

    static FetchResult failed(Throwable cause) {
        return new Failed(cause.getMessage(), cause);
    }
}
