package com.ryuqq.fanout.adapter.inmemory.api;

import java.time.Instant;

/**
 * A single raw sample of a stored series.
 *
 * @param timestamp sample time
 * @param value sample value
 * @author Fanout Team
 * @since 1.0.0
 */
public record Datapoint(Instant timestamp, double value) {

    public Datapoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public static Datapoint of(Instant timestamp, double value) {
        return new Datapoint(timestamp, value);
    }
}
