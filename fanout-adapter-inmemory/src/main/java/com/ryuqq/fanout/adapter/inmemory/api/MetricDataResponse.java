package com.ryuqq.fanout.adapter.inmemory.api;

import java.util.List;

/**
 * Response of one metric data call.
 *
 * @param results per-query results (immutable copy)
 * @param requestId id assigned to the call
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricDataResponse(List<MetricDataResult> results, String requestId) {

    public MetricDataResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
