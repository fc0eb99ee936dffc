package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.core.error.ShapeException;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.Frame;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameResultShaper 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class FrameResultShaperTest {

    private static final Region REGION = Region.of("eu-west-1");
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final TimeRange RANGE = TimeRange.of(T0, T0.plusSeconds(120));

    private final FrameResultShaper shaper = new FrameResultShaper();

    private static RegionGroup group() {
        return new RegionGroup(REGION, List.of(
            new MetricQuery(QueryId.of("a"), REGION, RANGE, Map.of("dimension.InstanceId", "i-9")),
            new MetricQuery(QueryId.of("b"), REGION, RANGE, Map.of())
        ));
    }

    @Test
    void shape_BuildsOneFramePerQuery() throws Exception {
        // Given: one point outside the range is dropped
        List<MetricQueryResultSet> resultSets = List.of(
            new MetricQueryResultSet("a", "cpu", List.of(T0, T0.plusSeconds(60), T0.plusSeconds(120)),
                List.of(1.0, 2.0, 3.0), null)
        );

        // When
        Map<QueryId, DataResponse> shaped = shaper.shape(resultSets, group(), RANGE);

        // Then
        Frame frame = shaped.get(QueryId.of("a")).frames().get(0);
        assertEquals("cpu", frame.name());
        assertEquals(List.of(1.0, 2.0), frame.values());
        assertEquals(Map.of("InstanceId", "i-9", "region", "eu-west-1"), frame.labels());
    }

    @Test
    void shape_EmbeddedError_BecomesErrorResponse() throws Exception {
        // Given
        List<MetricQueryResultSet> resultSets = List.of(
            new MetricQueryResultSet("b", "b", List.of(), List.of(), "metric is throttled"));

        // When
        DataResponse response = shaper.shape(resultSets, group(), RANGE).get(QueryId.of("b"));

        // Then
        assertTrue(response.hasError());
        assertInstanceOf(MetricQueryFailedException.class, response.error());
        assertTrue(response.error().getMessage().contains("metric is throttled"));
    }

    @Test
    void shape_ResultSetOutsideGroup_ThrowsShapeException() {
        // Given
        List<MetricQueryResultSet> resultSets = List.of(
            new MetricQueryResultSet("zzz", null, List.of(), List.of(), null));

        // When & Then
        ShapeException exception = assertThrows(ShapeException.class,
            () -> shaper.shape(resultSets, group(), RANGE));
        assertEquals("FANOUT-SHAPE", exception.getErrorCode());
    }
}
