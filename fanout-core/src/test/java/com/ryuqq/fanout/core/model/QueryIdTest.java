package com.ryuqq.fanout.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryId Value Object 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class QueryIdTest {

    @Test
    void of_ValidValue_CreatesQueryId() {
        // When
        QueryId queryId = QueryId.of("cpu_p99");

        // Then
        assertEquals("cpu_p99", queryId.getValue());
        assertEquals("QueryId{cpu_p99}", queryId.toString());
    }

    @Test
    void of_SameValue_EqualAndSameHashCode() {
        assertEquals(QueryId.of("A"), QueryId.of("A"));
        assertEquals(QueryId.of("A").hashCode(), QueryId.of("A").hashCode());
        assertNotEquals(QueryId.of("A"), QueryId.of("a"));
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> QueryId.of(null));
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
        assertThrows(IllegalArgumentException.class, () -> QueryId.of("  "));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String value = "q".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> QueryId.of(value));
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }
}
