package com.ryuqq.fanout.adapter.inmemory.api;

import java.util.List;
import java.util.Map;

/**
 * A metric series held by {@link InMemoryMetricsApi}.
 *
 * <p>A series is identified by namespace, metric name and dimensions. Queries match a
 * series when namespace and metric name are equal and every queried dimension is present
 * on the series with the same value.</p>
 *
 * @param namespace metric namespace (e.g. "AWS/EC2")
 * @param metricName metric name (e.g. "CPUUtilization")
 * @param dimensions series dimensions (immutable copy)
 * @param datapoints raw samples (immutable copy)
 * @author Fanout Team
 * @since 1.0.0
 */
public record StoredSeries(
    String namespace,
    String metricName,
    Map<String, String> dimensions,
    List<Datapoint> datapoints
) {

    public StoredSeries {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName cannot be null or blank");
        }
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        datapoints = datapoints == null ? List.of() : List.copyOf(datapoints);
    }

    /**
     * Checks whether this series satisfies a query's identity.
     *
     * @param namespace queried namespace
     * @param metricName queried metric name
     * @param queriedDimensions queried dimensions (subset match)
     * @return true if the series matches
     */
    public boolean matches(String namespace, String metricName, Map<String, String> queriedDimensions) {
        if (!this.namespace.equals(namespace) || !this.metricName.equals(metricName)) {
            return false;
        }
        for (Map.Entry<String, String> dimension : queriedDimensions.entrySet()) {
            if (!dimension.getValue().equals(dimensions.get(dimension.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
