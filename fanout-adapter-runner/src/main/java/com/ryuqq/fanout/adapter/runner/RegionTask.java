package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.BuildException;
import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.error.ClientResolutionException;
import com.ryuqq.fanout.core.error.ParseException;
import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.error.RecoveredFaultException;
import com.ryuqq.fanout.core.error.ShapeException;
import com.ryuqq.fanout.core.error.TranslationException;
import com.ryuqq.fanout.core.hook.FanOutHook;
import com.ryuqq.fanout.core.model.ClientContext;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.spi.Collaborators;
import com.ryuqq.fanout.core.statemachine.TaskState;
import com.ryuqq.fanout.core.statemachine.TaskStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 리전 하나의 파이프라인을 실행하는 워커 태스크.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * DISPATCHED
 *   → clientProvider.resolve()          CLIENT_RESOLVED
 *   → queryTranslator.translate()       TRANSLATED
 *   → requestBuilder.build()            REQUEST_BUILT
 *   → (취소 확인) remoteExecutor.execute() CALL_EXECUTED
 *   → responseTranslator.parse()        RESPONSE_PARSED
 *   → resultShaper.shape() + emit       RESULTS_EMITTED
 *   → COMPLETED
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>일반 오류(QueryExecutionException): ABORTED로 전이 후 그대로 던짐. 결과는 발행하지 않음</li>
 *   <li>런타임 장애(Exception): FAULTED로 전이 후 fault 결과 하나를 발행하고 정상 반환</li>
 *   <li>런타임 장애(Error): FAULTED로 전이, 로그만 남기고 결과는 버림</li>
 * </ul>
 *
 * @param <C> 클라이언트 핸들 타입
 * @param <Q> 고유 쿼리 타입
 * @param <R> 요청 페이로드 타입
 * @param <P> 응답 페이로드 타입
 * @param <S> 쿼리별 결과 셋 타입
 * @author Fanout Team
 * @since 1.0.0
 */
final class RegionTask<C, Q, R, P, S> implements TaskGroup.GroupTask {

    private static final Logger log = LoggerFactory.getLogger(RegionTask.class);

    private final String batchId;
    private final RegionGroup group;
    private final TimeRange timeRange;
    private final ClientContext clientContext;
    private final Collaborators<C, Q, R, P, S> collaborators;
    private final CancellationContext context;
    private final ResultCollector collector;
    private final FanOutHook hook;

    private TaskState state = TaskState.CREATED;

    RegionTask(
        String batchId,
        RegionGroup group,
        TimeRange timeRange,
        ClientContext clientContext,
        Collaborators<C, Q, R, P, S> collaborators,
        CancellationContext context,
        ResultCollector collector,
        FanOutHook hook
    ) {
        this.batchId = batchId;
        this.group = group;
        this.timeRange = timeRange;
        this.clientContext = clientContext;
        this.collaborators = collaborators;
        this.context = context;
        this.collector = collector;
        this.hook = hook;
    }

    @Override
    public void run() throws QueryExecutionException {
        FanOutMdc.setTask(batchId, region());
        try {
            moveTo(TaskState.DISPATCHED);
            runPipeline();
            moveTo(TaskState.COMPLETED);
        } catch (QueryExecutionException e) {
            log.warn("Region task for {} aborted at {}: {}", region(), state, e.getMessage());
            moveTo(TaskState.ABORTED);
            throw e;
        } catch (Throwable fault) {
            recover(fault);
        } finally {
            FanOutMdc.clear();
        }
    }

    private void runPipeline() throws QueryExecutionException {
        C client = collaborators.clientProvider().resolve(region(), clientContext);
        if (client == null) {
            throw new ClientResolutionException("no client available for region " + region());
        }
        moveTo(TaskState.CLIENT_RESOLVED);

        List<Q> nativeQueries = collaborators.queryTranslator().translate(group);
        if (nativeQueries == null) {
            throw new TranslationException("query translator returned no queries for region " + region());
        }
        moveTo(TaskState.TRANSLATED);

        R request = collaborators.requestBuilder().build(timeRange, nativeQueries);
        if (request == null) {
            throw new BuildException("request builder returned no request for region " + region());
        }
        moveTo(TaskState.REQUEST_BUILT);

        if (context.isCancelled()) {
            throw new CallException("request to " + region() + " not sent, context was cancelled", context.cause());
        }
        P response = collaborators.remoteExecutor().execute(context, client, request);
        if (response == null) {
            throw new CallException("remote executor returned no response for region " + region());
        }
        moveTo(TaskState.CALL_EXECUTED);

        List<S> resultSets = collaborators.responseTranslator().parse(response, nativeQueries);
        if (resultSets == null) {
            throw new ParseException("response translator returned no result sets for region " + region());
        }
        moveTo(TaskState.RESPONSE_PARSED);

        Map<QueryId, DataResponse> shaped = collaborators.resultShaper().shape(resultSets, group, timeRange);
        if (shaped == null) {
            throw new ShapeException("result shaper returned no results for region " + region());
        }
        emitAll(shaped);
        moveTo(TaskState.RESULTS_EMITTED);
    }

    private void emitAll(Map<QueryId, DataResponse> shaped) throws ShapeException {
        Set<QueryId> owned = new HashSet<>(group.queryIds());
        for (QueryId queryId : shaped.keySet()) {
            if (!owned.contains(queryId)) {
                throw new ShapeException("result for query " + queryId.getValue() + " does not belong to region " + region());
            }
        }
        for (Map.Entry<QueryId, DataResponse> entry : shaped.entrySet()) {
            emit(TaggedResult.of(region(), entry.getKey(), entry.getValue()));
        }
        log.debug("Region task for {} emitted {} results", region(), shaped.size());
    }

    private void recover(Throwable fault) {
        if (!state.isTerminal()) {
            moveTo(TaskState.FAULTED);
        }
        if (fault instanceof Exception) {
            log.error("Region task for {} faulted, emitting fault result", region(), fault);
            emit(TaggedResult.fault(
                region(),
                new RecoveredFaultException("failed to execute region query for " + region(), fault)
            ));
        } else {
            log.error("Region task for {} faulted with a non-exception throwable, result dropped", region(), fault);
        }
    }

    private void emit(TaggedResult result) {
        collector.emit(result);
        hook.onResultEmitted(result);
    }

    private void moveTo(TaskState next) {
        TaskState previous = state;
        state = TaskStateTransition.transition(previous, next);
        hook.onTaskStateChanged(region(), previous, next);
    }

    Region region() {
        return group.region();
    }

    TaskState state() {
        return state;
    }
}
