package com.ryuqq.fanout.adapter.inmemory.api;

import java.util.Map;

/**
 * Native query understood by {@link InMemoryMetricsClient}.
 *
 * @param id query id, unique within one request
 * @param namespace metric namespace
 * @param metricName metric name
 * @param dimensions dimension filter (immutable copy)
 * @param statistic bucket aggregation
 * @param periodSeconds bucket width in seconds (positive)
 * @param label display label of the resulting series
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricDataQuery(
    String id,
    String namespace,
    String metricName,
    Map<String, String> dimensions,
    Statistic statistic,
    int periodSeconds,
    String label
) {

    public MetricDataQuery {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName cannot be null or blank");
        }
        if (statistic == null) {
            throw new IllegalArgumentException("statistic cannot be null");
        }
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("periodSeconds must be positive (current: " + periodSeconds + ")");
        }
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        label = label == null || label.isBlank() ? metricName : label;
    }
}
