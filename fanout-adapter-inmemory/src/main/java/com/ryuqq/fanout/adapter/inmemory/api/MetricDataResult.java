package com.ryuqq.fanout.adapter.inmemory.api;

import java.time.Instant;
import java.util.List;

/**
 * Result of one {@link MetricDataQuery}.
 *
 * @param id id of the query that produced this result
 * @param label series label
 * @param timestamps bucket start times, ascending
 * @param values aggregated bucket values
 * @param statusCode {@link #COMPLETE} or {@link #INTERNAL_ERROR}
 * @param message error message when the status is not complete (null otherwise)
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricDataResult(
    String id,
    String label,
    List<Instant> timestamps,
    List<Double> values,
    String statusCode,
    String message
) {

    public static final String COMPLETE = "Complete";
    public static final String INTERNAL_ERROR = "InternalError";

    public MetricDataResult {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        values = values == null ? List.of() : List.copyOf(values);
        if (statusCode == null) {
            statusCode = COMPLETE;
        }
    }

    public static MetricDataResult complete(String id, String label, List<Instant> timestamps, List<Double> values) {
        return new MetricDataResult(id, label, timestamps, values, COMPLETE, null);
    }

    public static MetricDataResult failed(String id, String label, String message) {
        return new MetricDataResult(id, label, List.of(), List.of(), INTERNAL_ERROR, message);
    }

    public boolean isComplete() {
        return COMPLETE.equals(statusCode);
    }
}
