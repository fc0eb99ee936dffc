package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.hook.FanOutHook;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.statemachine.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 훅 예외를 삼키고 로그만 남기는 래퍼.
 */
final class SafeFanOutHook implements FanOutHook {

    private static final Logger log = LoggerFactory.getLogger(SafeFanOutHook.class);

    private final FanOutHook delegate;

    SafeFanOutHook(FanOutHook delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void onTaskStateChanged(Region region, TaskState from, TaskState to) {
        try {
            delegate.onTaskStateChanged(region, from, to);
        } catch (RuntimeException e) {
            log.warn("FanOutHook.onTaskStateChanged failed for {} ({} → {})", region, from, to, e);
        }
    }

    @Override
    public void onResultEmitted(TaggedResult result) {
        try {
            delegate.onResultEmitted(result);
        } catch (RuntimeException e) {
            log.warn("FanOutHook.onResultEmitted failed for {}", result.region(), e);
        }
    }

    @Override
    public void onBatchCompleted(int responseCount, int faultCount) {
        try {
            delegate.onBatchCompleted(responseCount, faultCount);
        } catch (RuntimeException e) {
            log.warn("FanOutHook.onBatchCompleted failed", e);
        }
    }

    @Override
    public void onBatchFailed(QueryExecutionException error) {
        try {
            delegate.onBatchFailed(error);
        } catch (RuntimeException e) {
            log.warn("FanOutHook.onBatchFailed failed", e);
        }
    }
}
