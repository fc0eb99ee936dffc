package com.ryuqq.fanout.application.engine;

import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.TaggedResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryDataResponse 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class QueryDataResponseTest {

    private static final Region REGION = Region.of("eu-west-1");

    @Test
    void empty_NoResponsesNoFaults() {
        QueryDataResponse response = QueryDataResponse.empty();

        assertEquals(0, response.size());
        assertFalse(response.hasFaults());
    }

    @Test
    void new_ResponsesAndFaults_Immutable() {
        // Given
        DataResponse data = DataResponse.of(List.of());
        TaggedResult fault = TaggedResult.fault(REGION, new IllegalStateException("boom"));

        // When
        QueryDataResponse response = new QueryDataResponse(Map.of(QueryId.of("A"), data), List.of(fault));

        // Then
        assertSame(data, response.get(QueryId.of("A")));
        assertNull(response.get(QueryId.of("B")));
        assertTrue(response.hasFaults());
        assertThrows(UnsupportedOperationException.class, () -> response.responses().clear());
        assertThrows(UnsupportedOperationException.class, () -> response.faults().clear());
    }

    @Test
    void new_KeyedResultInFaults_ThrowsException() {
        TaggedResult keyed = TaggedResult.of(REGION, QueryId.of("A"), DataResponse.of(List.of()));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new QueryDataResponse(Map.of(), List.of(keyed)));
        assertTrue(exception.getMessage().contains("faults can only hold fault results"));
    }
}
