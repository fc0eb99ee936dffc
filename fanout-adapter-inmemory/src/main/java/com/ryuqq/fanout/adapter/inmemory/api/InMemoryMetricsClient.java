package com.ryuqq.fanout.adapter.inmemory.api;

import com.ryuqq.fanout.core.error.RemoteServiceRequestException;
import com.ryuqq.fanout.core.model.Region;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Region-bound client of {@link InMemoryMetricsApi}.
 *
 * <p>Evaluates each query of a request against the region's stored series: datapoints of all
 * matching series inside {@code [startTime, endTime)} are grouped into period buckets anchored
 * at {@code startTime} and aggregated with the query's statistic.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class InMemoryMetricsClient {

    private final Region region;
    private final InMemoryMetricsApi api;

    /**
     * Creates a client bound to a region.
     *
     * @param region the region this client talks to
     * @param api the backing service
     * @throws IllegalArgumentException if an argument is null
     */
    public InMemoryMetricsClient(Region region, InMemoryMetricsApi api) {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        this.region = region;
        this.api = api;
    }

    public Region getRegion() {
        return region;
    }

    /**
     * Evaluates a metric data request.
     *
     * @param request the request
     * @return one result per query, in query order
     * @throws RemoteServiceRequestException if the region is configured to reject calls
     */
    public MetricDataResponse getMetricData(MetricDataRequest request) throws RemoteServiceRequestException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        int call = api.recordCall(region);
        String requestId = region.getName() + "-" + call;

        InMemoryMetricsApi.RegionFailure failure = api.regionFailure(region);
        if (failure != null) {
            throw new RemoteServiceRequestException(failure.message(), failure.statusCode(), requestId);
        }

        List<StoredSeries> stored = api.seriesIn(region);
        List<MetricDataResult> results = new ArrayList<>(request.queries().size());
        for (MetricDataQuery query : request.queries()) {
            results.add(evaluate(query, stored, request.startTime(), request.endTime()));
        }
        return new MetricDataResponse(results, requestId);
    }

    private MetricDataResult evaluate(MetricDataQuery query, List<StoredSeries> stored, Instant start, Instant end) {
        String failure = api.metricFailure(region, query.metricName());
        if (failure != null) {
            return MetricDataResult.failed(query.id(), query.label(), failure);
        }

        long periodMillis = Duration.ofSeconds(query.periodSeconds()).toMillis();
        Map<Instant, List<Double>> buckets = new TreeMap<>();
        for (StoredSeries series : stored) {
            if (!series.matches(query.namespace(), query.metricName(), query.dimensions())) {
                continue;
            }
            for (Datapoint datapoint : series.datapoints()) {
                Instant timestamp = datapoint.timestamp();
                if (timestamp.isBefore(start) || !timestamp.isBefore(end)) {
                    continue;
                }
                long offset = Duration.between(start, timestamp).toMillis();
                Instant bucket = start.plusMillis(offset - offset % periodMillis);
                buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(datapoint.value());
            }
        }

        List<Instant> timestamps = new ArrayList<>(buckets.size());
        List<Double> values = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, List<Double>> bucket : buckets.entrySet()) {
            timestamps.add(bucket.getKey());
            values.add(query.statistic().aggregate(bucket.getValue()));
        }
        return MetricDataResult.complete(query.id(), query.label(), timestamps, values);
    }
}
