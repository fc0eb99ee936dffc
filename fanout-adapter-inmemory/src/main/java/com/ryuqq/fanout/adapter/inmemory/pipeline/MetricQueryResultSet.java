package com.ryuqq.fanout.adapter.inmemory.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Parsed per-query result, before it is shaped into frames.
 *
 * @param id query id
 * @param label series label
 * @param timestamps bucket timestamps
 * @param values bucket values
 * @param errorMessage embedded per-query error (null when the query succeeded)
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricQueryResultSet(
    String id,
    String label,
    List<Instant> timestamps,
    List<Double> values,
    String errorMessage
) {

    public MetricQueryResultSet {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean hasError() {
        return errorMessage != null;
    }
}
