package com.ryuqq.fanout.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RegionGroup 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class RegionGroupTest {

    private static final Region US_EAST_1 = Region.of("us-east-1");
    private static final TimeRange RANGE = TimeRange.of(
        Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T01:00:00Z"));

    private static MetricQuery query(String id, Region region) {
        return new MetricQuery(QueryId.of(id), region, RANGE, Map.of());
    }

    @Test
    void queryIds_PreservesRequestOrder() {
        // Given
        RegionGroup group = new RegionGroup(US_EAST_1, List.of(query("B", US_EAST_1), query("A", US_EAST_1)));

        // Then
        assertEquals(List.of(QueryId.of("B"), QueryId.of("A")), group.queryIds());
        assertEquals(2, group.size());
    }

    @Test
    void constructor_Empty_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RegionGroup(US_EAST_1, List.of()));
    }

    @Test
    void constructor_ForeignRegionQuery_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new RegionGroup(US_EAST_1, List.of(query("A", Region.of("eu-west-1")))));
        assertTrue(exception.getMessage().contains("targets eu-west-1"));
    }
}
