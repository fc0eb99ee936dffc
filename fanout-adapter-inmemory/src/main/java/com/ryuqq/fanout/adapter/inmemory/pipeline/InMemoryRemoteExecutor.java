package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsClient;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataRequest;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResponse;
import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.spi.RemoteExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sends a {@link MetricDataRequest} through an {@link InMemoryMetricsClient}.
 *
 * <p>An optional simulated latency is spent waiting on the cancellation context, so a call
 * in flight fails promptly with {@link CallException} once the context is cancelled.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class InMemoryRemoteExecutor implements RemoteExecutor<InMemoryMetricsClient, MetricDataRequest, MetricDataResponse> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteExecutor.class);

    private final Duration latency;

    public InMemoryRemoteExecutor() {
        this(Duration.ZERO);
    }

    /**
     * @param latency simulated call latency (zero or positive)
     * @throws IllegalArgumentException if latency is null or negative
     */
    public InMemoryRemoteExecutor(Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency cannot be null or negative");
        }
        this.latency = latency;
    }

    @Override
    public MetricDataResponse execute(CancellationContext context, InMemoryMetricsClient client, MetricDataRequest request)
            throws CallException {
        if (context.isCancelled()) {
            throw new CallException("request to " + client.getRegion() + " cancelled before sending", context.cause());
        }
        if (!latency.isZero()) {
            awaitLatency(context, client);
        }
        MetricDataResponse response = client.getMetricData(request);
        log.debug("Metric data call to {} returned {} results (requestId: {})",
            client.getRegion(), response.results().size(), response.requestId());
        return response;
    }

    private void awaitLatency(CancellationContext context, InMemoryMetricsClient client) throws CallException {
        try {
            if (context.awaitCancellation(latency.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CallException("request to " + client.getRegion() + " cancelled in flight", context.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallException("request to " + client.getRegion() + " interrupted", e);
        }
    }
}
