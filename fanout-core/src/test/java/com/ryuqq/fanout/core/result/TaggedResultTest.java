package com.ryuqq.fanout.core.result;

import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaggedResult 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class TaggedResultTest {

    private static final Region REGION = Region.of("us-east-1");

    @Test
    void of_ValidValues_CreatesKeyedResult() {
        // Given
        DataResponse response = DataResponse.of(List.of());

        // When
        TaggedResult result = TaggedResult.of(REGION, QueryId.of("A"), response);

        // Then
        assertFalse(result.isFault());
        assertEquals(QueryId.of("A"), result.queryId());
        assertEquals(REGION, result.region());
        assertSame(response, result.response());
    }

    @Test
    void of_NullQueryId_ThrowsException() {
        DataResponse response = DataResponse.of(List.of());

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> TaggedResult.of(REGION, null, response));
        assertTrue(exception.getMessage().contains("queryId cannot be null"));
    }

    @Test
    void fault_WithError_HasNoQueryId() {
        // Given
        IllegalStateException error = new IllegalStateException("boom");

        // When
        TaggedResult result = TaggedResult.fault(REGION, error);

        // Then
        assertTrue(result.isFault());
        assertNull(result.queryId());
        assertTrue(result.response().hasError());
        assertSame(error, result.response().error());
    }

    @Test
    void new_NullRegionOrResponse_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new TaggedResult(null, QueryId.of("A"), DataResponse.of(List.of())));
        assertThrows(IllegalArgumentException.class,
            () -> new TaggedResult(REGION, QueryId.of("A"), null));
    }
}
