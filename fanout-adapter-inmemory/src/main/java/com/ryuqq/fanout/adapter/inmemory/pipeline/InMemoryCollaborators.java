package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsApi;
import com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsClient;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataQuery;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataRequest;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResponse;
import com.ryuqq.fanout.core.spi.Collaborators;

import java.time.Duration;

/**
 * Factory for the reference pipeline wired to an {@link InMemoryMetricsApi}.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMetricsApi api = new InMemoryMetricsApi();
 * TimeSeriesQueryEngine engine = new RegionFanOutRunner&lt;&gt;(
 *     InMemoryCollaborators.create(api), new FanOutConfig());
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class InMemoryCollaborators {

    private InMemoryCollaborators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Collaborators<InMemoryMetricsClient, MetricDataQuery, MetricDataRequest, MetricDataResponse, MetricQueryResultSet>
            create(InMemoryMetricsApi api) {
        return create(api, Duration.ZERO);
    }

    /**
     * Creates the pipeline with a simulated call latency.
     *
     * @param api backing service
     * @param latency simulated latency of every remote call
     * @return collaborators ready for a fan-out runner
     */
    public static Collaborators<InMemoryMetricsClient, MetricDataQuery, MetricDataRequest, MetricDataResponse, MetricQueryResultSet>
            create(InMemoryMetricsApi api, Duration latency) {
        return new Collaborators<>(
            new InMemoryClientProvider(api),
            new MetricDataQueryTranslator(),
            new MetricDataRequestBuilder(),
            new InMemoryRemoteExecutor(latency),
            new MetricDataResponseTranslator(),
            new FrameResultShaper()
        );
    }
}
