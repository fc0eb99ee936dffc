package com.ryuqq.fanout.adapter.inmemory.api;

import com.ryuqq.fanout.core.error.RemoteServiceRequestException;
import com.ryuqq.fanout.core.model.Region;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryMetricsClient 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class InMemoryMetricsClientTest {

    private static final Region REGION = Region.of("us-east-1");
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = START.plusSeconds(300);

    private InMemoryMetricsApi api;
    private InMemoryMetricsClient client;

    @BeforeEach
    void setUp() {
        api = new InMemoryMetricsApi();
        api.putSeries(REGION, new StoredSeries("AWS/EC2", "CPUUtilization", Map.of("InstanceId", "i-1"), List.of(
            Datapoint.of(START, 10.0),
            Datapoint.of(START.plusSeconds(30), 20.0),
            Datapoint.of(START.plusSeconds(60), 40.0),
            Datapoint.of(START.minusSeconds(10), 99.0),
            Datapoint.of(END, 99.0)
        )));
        api.putSeries(REGION, new StoredSeries("AWS/EC2", "CPUUtilization", Map.of("InstanceId", "i-2"), List.of(
            Datapoint.of(START.plusSeconds(10), 30.0)
        )));
        client = new InMemoryMetricsClient(REGION, api);
    }

    private static MetricDataQuery query(String id, Map<String, String> dimensions, Statistic statistic) {
        return new MetricDataQuery(id, "AWS/EC2", "CPUUtilization", dimensions, statistic, 60, null);
    }

    @Test
    void getMetricData_BucketsByPeriodAndAggregates() throws Exception {
        // Given
        MetricDataRequest request = new MetricDataRequest(START, END,
            List.of(query("a", Map.of("InstanceId", "i-1"), Statistic.AVERAGE)));

        // When
        MetricDataResponse response = client.getMetricData(request);

        // Then
        MetricDataResult result = response.results().get(0);
        assertTrue(result.isComplete());
        assertEquals(List.of(START, START.plusSeconds(60)), result.timestamps());
        assertEquals(List.of(15.0, 40.0), result.values());
        assertEquals("CPUUtilization", result.label());
    }

    @Test
    void getMetricData_DimensionSubsetMatchesAllSeries() throws Exception {
        // Given: no dimension filter, both instances match
        MetricDataRequest request = new MetricDataRequest(START, END,
            List.of(query("a", Map.of(), Statistic.SAMPLE_COUNT), query("b", Map.of(), Statistic.MAXIMUM)));

        // When
        MetricDataResponse response = client.getMetricData(request);

        // Then
        assertEquals(List.of(3.0, 1.0), response.results().get(0).values());
        assertEquals(List.of(30.0, 40.0), response.results().get(1).values());
    }

    @Test
    void getMetricData_NoMatchingSeries_ReturnsEmptyCompleteResult() throws Exception {
        // Given
        MetricDataRequest request = new MetricDataRequest(START, END,
            List.of(new MetricDataQuery("a", "AWS/RDS", "FreeableMemory", Map.of(), Statistic.SUM, 60, "mem")));

        // When
        MetricDataResult result = client.getMetricData(request).results().get(0);

        // Then
        assertTrue(result.isComplete());
        assertTrue(result.values().isEmpty());
        assertEquals("mem", result.label());
    }

    @Test
    void getMetricData_FailedRegion_ThrowsRemoteServiceRequestException() {
        // Given
        api.failRegion(REGION, 503, "Service Unavailable");
        MetricDataRequest request = new MetricDataRequest(START, END,
            List.of(query("a", Map.of(), Statistic.AVERAGE)));

        // When & Then
        RemoteServiceRequestException exception = assertThrows(RemoteServiceRequestException.class,
            () -> client.getMetricData(request));
        assertEquals(503, exception.getStatusCode());
        assertEquals("us-east-1-1", exception.getRequestId());
        assertEquals(1, api.callCount(REGION));
    }

    @Test
    void getMetricData_FailedMetric_EmbedsError() throws Exception {
        // Given
        api.failMetric(REGION, "CPUUtilization", "metric is throttled");
        MetricDataRequest request = new MetricDataRequest(START, END,
            List.of(query("a", Map.of(), Statistic.AVERAGE)));

        // When
        MetricDataResult result = client.getMetricData(request).results().get(0);

        // Then
        assertFalse(result.isComplete());
        assertEquals(MetricDataResult.INTERNAL_ERROR, result.statusCode());
        assertEquals("metric is throttled", result.message());
    }

    @Test
    void aggregate_AllStatistics() {
        List<Double> values = List.of(1.0, 2.0, 6.0);

        assertEquals(3.0, Statistic.AVERAGE.aggregate(values));
        assertEquals(9.0, Statistic.SUM.aggregate(values));
        assertEquals(1.0, Statistic.MINIMUM.aggregate(values));
        assertEquals(6.0, Statistic.MAXIMUM.aggregate(values));
        assertEquals(3.0, Statistic.SAMPLE_COUNT.aggregate(values));
        assertEquals(Statistic.SAMPLE_COUNT, Statistic.fromLabel("SampleCount"));
        assertNull(Statistic.fromLabel("p99"));
    }

    @Test
    void registerRegion_DefaultPlaceholder_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> api.registerRegion(Region.of("default")));
    }
}
