package com.ryuqq.fanout.adapter.inmemory.api;

import java.time.Instant;
import java.util.List;

/**
 * One metric data call covering a time window and a set of queries.
 *
 * @param startTime inclusive window start
 * @param endTime exclusive window end
 * @param queries queries evaluated in this call (immutable copy)
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricDataRequest(
    Instant startTime,
    Instant endTime,
    List<MetricDataQuery> queries
) {

    /**
     * Maximum number of queries accepted in a single call.
     */
    public static final int MAX_QUERIES = 500;

    public MetricDataRequest {
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (!startTime.isBefore(endTime)) {
            throw new IllegalArgumentException("startTime must be before endTime");
        }
        queries = queries == null ? List.of() : List.copyOf(queries);
    }
}
