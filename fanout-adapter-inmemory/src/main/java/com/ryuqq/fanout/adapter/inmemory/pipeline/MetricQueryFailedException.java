package com.ryuqq.fanout.adapter.inmemory.pipeline;

/**
 * Per-query error reported by the metrics service, embedded in a query's {@code DataResponse}.
 *
 * <p>Never thrown by the pipeline; it only travels inside a result.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class MetricQueryFailedException extends Exception {

    private final String queryId;

    public MetricQueryFailedException(String queryId, String message) {
        super("metric query " + queryId + " failed: " + message);
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }
}
