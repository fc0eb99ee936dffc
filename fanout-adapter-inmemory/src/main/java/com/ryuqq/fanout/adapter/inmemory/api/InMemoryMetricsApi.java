package com.ryuqq.fanout.adapter.inmemory.api;

import com.ryuqq.fanout.core.model.Region;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory multi-region metrics service for testing and reference purposes.
 *
 * <p>Each region holds its own set of {@link StoredSeries}. A region must be registered
 * (explicitly, or implicitly by storing a series) before a client can be resolved for it.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Series:</strong> ConcurrentHashMap&lt;Region, CopyOnWriteArrayList&lt;StoredSeries&gt;&gt;</li>
 *   <li><strong>Region failures:</strong> ConcurrentHashMap&lt;Region, RegionFailure&gt; - every call to the region is rejected</li>
 *   <li><strong>Metric failures:</strong> ConcurrentHashMap&lt;Region, Map&lt;String, String&gt;&gt; - per-metric error messages embedded in results</li>
 *   <li><strong>Call counters:</strong> ConcurrentHashMap&lt;Region, AtomicInteger&gt;</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMetricsApi api = new InMemoryMetricsApi();
 * api.putSeries(Region.of("us-east-1"), new StoredSeries(
 *     "AWS/EC2", "CPUUtilization", Map.of("InstanceId", "i-123"), datapoints));
 *
 * // Every call to eu-west-1 fails with a 503
 * api.failRegion(Region.of("eu-west-1"), 503, "Service Unavailable");
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class InMemoryMetricsApi {

    private final Map<Region, List<StoredSeries>> series = new ConcurrentHashMap<>();
    private final Map<Region, RegionFailure> regionFailures = new ConcurrentHashMap<>();
    private final Map<Region, Map<String, String>> metricFailures = new ConcurrentHashMap<>();
    private final Map<Region, AtomicInteger> callCounts = new ConcurrentHashMap<>();

    /**
     * Configured rejection of every call to a region.
     *
     * @param statusCode HTTP status code reported by the service
     * @param message service error message
     */
    record RegionFailure(int statusCode, String message) {
    }

    /**
     * Registers a region without any series.
     *
     * @param region the region to register
     * @throws IllegalArgumentException if region is null or the default placeholder
     */
    public void registerRegion(Region region) {
        requireConcrete(region);
        series.computeIfAbsent(region, r -> new CopyOnWriteArrayList<>());
    }

    /**
     * Stores a series in a region, registering the region if necessary.
     *
     * @param region target region
     * @param storedSeries the series to store
     * @throws IllegalArgumentException if an argument is null
     */
    public void putSeries(Region region, StoredSeries storedSeries) {
        requireConcrete(region);
        if (storedSeries == null) {
            throw new IllegalArgumentException("storedSeries cannot be null");
        }
        series.computeIfAbsent(region, r -> new CopyOnWriteArrayList<>()).add(storedSeries);
    }

    /**
     * Makes every subsequent call to the region fail with a service error.
     *
     * @param region target region (registered if necessary)
     * @param statusCode HTTP status code to report
     * @param message error message to report
     */
    public void failRegion(Region region, int statusCode, String message) {
        registerRegion(region);
        regionFailures.put(region, new RegionFailure(statusCode, message));
    }

    /**
     * Makes queries for one metric in the region return an embedded error.
     *
     * @param region target region (registered if necessary)
     * @param metricName metric whose results fail
     * @param message error message embedded in the result
     */
    public void failMetric(Region region, String metricName, String message) {
        registerRegion(region);
        metricFailures.computeIfAbsent(region, r -> new ConcurrentHashMap<>()).put(metricName, message);
    }

    public boolean isRegistered(Region region) {
        return region != null && series.containsKey(region);
    }

    /**
     * Returns a snapshot of the series stored in a region.
     *
     * @param region the region
     * @return stored series, empty if the region is unknown
     */
    public List<StoredSeries> seriesIn(Region region) {
        List<StoredSeries> stored = series.get(region);
        return stored == null ? List.of() : List.copyOf(stored);
    }

    /**
     * Number of metric data calls received by a region.
     *
     * @param region the region
     * @return call count
     */
    public int callCount(Region region) {
        AtomicInteger count = callCounts.get(region);
        return count == null ? 0 : count.get();
    }

    /**
     * Clears all regions, series, failures and counters.
     */
    public void clear() {
        series.clear();
        regionFailures.clear();
        metricFailures.clear();
        callCounts.clear();
    }

    RegionFailure regionFailure(Region region) {
        return regionFailures.get(region);
    }

    String metricFailure(Region region, String metricName) {
        Map<String, String> failures = metricFailures.get(region);
        return failures == null ? null : failures.get(metricName);
    }

    int recordCall(Region region) {
        return callCounts.computeIfAbsent(region, r -> new AtomicInteger()).incrementAndGet();
    }

    private static void requireConcrete(Region region) {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (region.isDefault()) {
            throw new IllegalArgumentException("region must be concrete, not the default placeholder");
        }
    }
}
