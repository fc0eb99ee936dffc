package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.error.ClientResolutionException;
import com.ryuqq.fanout.core.error.RemoteServiceRequestException;
import com.ryuqq.fanout.core.model.ClientContext;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.Frame;
import com.ryuqq.fanout.core.spi.Collaborators;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted pipeline collaborators for contract tests.
 *
 * <p>All type parameters are {@code String}: the client handle is {@code "client:<region>"},
 * native queries are query ids, the request is the comma-joined ids, the response is
 * {@code "<region>|<request>"}, and every
 * successful query yields one frame named after its id.</p>
 *
 * <p>Each region follows a {@link RegionBehavior} (default {@link RegionBehavior#SUCCEED}).
 * The collaborators record resolved regions, remote calls and observed cancellations.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedCollaborators scripted = new ScriptedCollaborators();
 * scripted.script(Region.of("eu-west-1"), RegionBehavior.FAIL_REMOTE);
 * TimeSeriesQueryEngine engine = new RegionFanOutRunner&lt;&gt;(scripted.collaborators(), new FanOutConfig());
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class ScriptedCollaborators {

    private static final long BLOCK_TIMEOUT_MS = 5000;
    private static final String RESPONSE_SEPARATOR = "|";

    private final Map<Region, RegionBehavior> behaviors = new ConcurrentHashMap<>();
    private final Map<Region, AtomicInteger> resolveCounts = new ConcurrentHashMap<>();
    private final Map<Region, AtomicInteger> callCounts = new ConcurrentHashMap<>();
    private final Set<Region> cancelledCalls = ConcurrentHashMap.newKeySet();
    private final Semaphore callsStarted = new Semaphore(0);

    /**
     * Assigns a behavior to a region.
     *
     * @param region target region
     * @param behavior behavior to follow
     * @return this instance for chaining
     */
    public ScriptedCollaborators script(Region region, RegionBehavior behavior) {
        behaviors.put(region, behavior);
        return this;
    }

    /**
     * Builds the collaborator bundle backed by this script.
     *
     * @return collaborators for a fan-out runner
     */
    public Collaborators<String, String, String, String, String> collaborators() {
        return new Collaborators<>(
            this::resolve,
            this::translate,
            (timeRange, queries) -> String.join(",", queries),
            this::execute,
            this::parse,
            this::shape
        );
    }

    private String resolve(Region region, ClientContext clientContext)
            throws ClientResolutionException {
        resolveCounts.computeIfAbsent(region, r -> new AtomicInteger()).incrementAndGet();
        if (behaviorOf(region) == RegionBehavior.FAIL_CLIENT) {
            throw new ClientResolutionException("no client for region " + region);
        }
        return "client:" + region.getName();
    }

    private List<String> translate(RegionGroup group) {
        List<String> ids = new ArrayList<>(group.size());
        for (QueryId id : group.queryIds()) {
            ids.add(id.getValue());
        }
        return ids;
    }

    private String execute(CancellationContext context, String client, String request) throws CallException {
        Region region = Region.of(client.substring("client:".length()));
        callCounts.computeIfAbsent(region, r -> new AtomicInteger()).incrementAndGet();
        callsStarted.release();

        switch (behaviorOf(region)) {
            case FAIL_CALL:
                throw new CallException("connection reset by " + region);
            case FAIL_REMOTE:
                throw new RemoteServiceRequestException("Throttling: Rate exceeded", 400, "req-" + region.getName());
            case BLOCK_UNTIL_CANCELLED:
                return awaitCancellation(context, region, request);
            default:
                return region.getName() + RESPONSE_SEPARATOR + request;
        }
    }

    private String awaitCancellation(CancellationContext context, Region region, String request) throws CallException {
        try {
            if (context.awaitCancellation(BLOCK_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                cancelledCalls.add(region);
                throw new CallException("request to " + region + " cancelled", context.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallException("request to " + region + " interrupted", e);
        }
        return region.getName() + RESPONSE_SEPARATOR + request;
    }

    private List<String> parse(String response, List<String> queries) {
        Region region = Region.of(response.substring(0, response.indexOf(RESPONSE_SEPARATOR)));
        if (behaviorOf(region) == RegionBehavior.RUNTIME_FAULT) {
            throw new IllegalStateException("malformed response from " + region);
        }
        return queries;
    }

    private Map<QueryId, DataResponse> shape(List<String> resultSets, RegionGroup group,
                                             TimeRange timeRange) {
        if (behaviorOf(group.region()) == RegionBehavior.ERROR_FAULT) {
            throw new AssertionError("shaper invariant broken in " + group.region());
        }
        Map<QueryId, DataResponse> shaped = new LinkedHashMap<>();
        for (String id : resultSets) {
            Frame frame = new Frame(id, Map.of("region", group.region().getName()),
                List.of(timeRange.from()), List.of(1.0));
            shaped.put(QueryId.of(id), DataResponse.of(List.of(frame)));
        }
        return shaped;
    }

    private RegionBehavior behaviorOf(Region region) {
        return behaviors.getOrDefault(region, RegionBehavior.SUCCEED);
    }

    public int resolveCount(Region region) {
        AtomicInteger count = resolveCounts.get(region);
        return count == null ? 0 : count.get();
    }

    public int callCount(Region region) {
        AtomicInteger count = callCounts.get(region);
        return count == null ? 0 : count.get();
    }

    public int totalResolveCount() {
        int total = 0;
        for (AtomicInteger count : resolveCounts.values()) {
            total += count.get();
        }
        return total;
    }

    public boolean observedCancellation(Region region) {
        return cancelledCalls.contains(region);
    }

    /**
     * Waits until the given number of remote calls has started.
     *
     * @param calls number of calls
     * @param timeoutMs maximum wait in milliseconds
     * @return true if the calls started in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCallsStarted(int calls, long timeoutMs) throws InterruptedException {
        return callsStarted.tryAcquire(calls, timeoutMs, TimeUnit.MILLISECONDS);
    }
}
