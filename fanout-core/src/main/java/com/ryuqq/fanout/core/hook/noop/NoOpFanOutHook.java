package com.ryuqq.fanout.core.hook.noop;

import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.hook.FanOutHook;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.statemachine.TaskState;

/**
 * FanOutHook NoOp 구현.
 *
 * <p>아무 동작도 하지 않습니다. 훅을 지정하지 않은 러너의 기본값입니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class NoOpFanOutHook implements FanOutHook {

    @Override
    public void onTaskStateChanged(Region region, TaskState from, TaskState to) {
        // NoOp
    }

    @Override
    public void onResultEmitted(TaggedResult result) {
        // NoOp
    }

    @Override
    public void onBatchCompleted(int responseCount, int faultCount) {
        // NoOp
    }

    @Override
    public void onBatchFailed(QueryExecutionException error) {
        // NoOp
    }
}
