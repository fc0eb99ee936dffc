package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.hook.FanOutHook;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.statemachine.TaskState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe {@link FanOutHook} that records every notification for assertions.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class RecordingFanOutHook implements FanOutHook {

    /**
     * One recorded task state transition.
     *
     * @param region task region
     * @param from previous state
     * @param to new state
     */
    public record Transition(Region region, TaskState from, TaskState to) {
    }

    private final List<Transition> transitions = new CopyOnWriteArrayList<>();
    private final List<TaggedResult> emitted = new CopyOnWriteArrayList<>();
    private final List<QueryExecutionException> failures = new CopyOnWriteArrayList<>();
    private final AtomicInteger completedBatches = new AtomicInteger();

    @Override
    public void onTaskStateChanged(Region region, TaskState from, TaskState to) {
        transitions.add(new Transition(region, from, to));
    }

    @Override
    public void onResultEmitted(TaggedResult result) {
        emitted.add(result);
    }

    @Override
    public void onBatchCompleted(int responseCount, int faultCount) {
        completedBatches.incrementAndGet();
    }

    @Override
    public void onBatchFailed(QueryExecutionException error) {
        failures.add(error);
    }

    public List<Transition> transitions() {
        return List.copyOf(transitions);
    }

    /**
     * Regions whose task was dispatched, in dispatch order.
     *
     * @return dispatched regions
     */
    public List<Region> dispatchedRegions() {
        List<Region> regions = new ArrayList<>();
        for (Transition transition : transitions) {
            if (transition.to() == TaskState.DISPATCHED) {
                regions.add(transition.region());
            }
        }
        return regions;
    }

    /**
     * Final state reached by a region's task.
     *
     * @param region the region
     * @return the last terminal state, or null if the task never finished
     */
    public TaskState terminalStateOf(Region region) {
        TaskState terminal = null;
        for (Transition transition : transitions) {
            if (transition.region().equals(region) && transition.to().isTerminal()) {
                terminal = transition.to();
            }
        }
        return terminal;
    }

    public List<TaggedResult> emitted() {
        return List.copyOf(emitted);
    }

    /**
     * Emitted fault results (results without a query id).
     *
     * @return fault results in emission order
     */
    public List<TaggedResult> emittedFaults() {
        List<TaggedResult> faults = new ArrayList<>();
        for (TaggedResult result : emitted) {
            if (result.isFault()) {
                faults.add(result);
            }
        }
        return faults;
    }

    public List<QueryExecutionException> failures() {
        return List.copyOf(failures);
    }

    public int completedBatches() {
        return completedBatches.get();
    }
}
