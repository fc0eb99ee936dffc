package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsApi;
import com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsClient;
import com.ryuqq.fanout.core.error.ClientResolutionException;
import com.ryuqq.fanout.core.model.ClientContext;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.spi.ClientProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves one cached {@link InMemoryMetricsClient} per registered region.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class InMemoryClientProvider implements ClientProvider<InMemoryMetricsClient> {

    private final InMemoryMetricsApi api;
    private final Map<Region, InMemoryMetricsClient> clients = new ConcurrentHashMap<>();

    public InMemoryClientProvider(InMemoryMetricsApi api) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        this.api = api;
    }

    @Override
    public InMemoryMetricsClient resolve(Region region, ClientContext clientContext) throws ClientResolutionException {
        if (region == null || !api.isRegistered(region)) {
            throw new ClientResolutionException("unknown region: " + region);
        }
        return clients.computeIfAbsent(region, r -> new InMemoryMetricsClient(r, api));
    }
}
