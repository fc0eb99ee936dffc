package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.application.engine.QueryDataRequest;
import com.ryuqq.fanout.application.engine.QueryDataResponse;
import com.ryuqq.fanout.application.engine.TimeSeriesQueryEngine;
import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.error.CancelledException;
import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.error.RemoteServiceRequestException;
import com.ryuqq.fanout.core.hook.FanOutHook;
import com.ryuqq.fanout.core.hook.noop.NoOpFanOutHook;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.partition.RegionPartitioner;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.spi.Collaborators;
import com.ryuqq.fanout.core.spi.QueryPartitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 리전 팬아웃 시계열 쿼리 엔진 구현체.
 *
 * <p>배치를 리전별로 나누고, 리전마다 워커 태스크 하나를 동시에 실행한 뒤
 * 결과를 쿼리 식별자별 응답 맵으로 합칩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(request, context)
 *   ↓
 * partitioner.partition() → {region → RegionGroup}
 *   ↓
 * child context 생성, 리전마다 RegionTask 제출
 *   ↓
 * taskGroup.await() (전원 대기)
 *   ├─ 일반 오류 → (원격 서비스 오류면 요약 fault 발행) → 첫 오류 던짐
 *   └─ 성공 → collector 닫기 → drain → QueryId별 맵 조립
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>결과 수집기는 배치 최대 결과 수만큼 미리 잡혀 있어 태스크가 블로킹되지 않음</li>
 *   <li>첫 일반 오류가 공유 child 컨텍스트를 취소하여 형제 태스크의 원격 호출을 중단시킴</li>
 *   <li>응답 맵은 모든 태스크 종료 후 코디네이터 스레드에서만 조립</li>
 *   <li>대기 중 인터럽트되어도 그룹을 취소한 뒤 모든 태스크 종료를 확인하고 나서 반환</li>
 *   <li>동시 실행 수 제한은 주입한 ExecutorService로 결정</li>
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
public final class RegionFanOutRunner<C, Q, R, P, S> implements TimeSeriesQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(RegionFanOutRunner.class);

    private final Collaborators<C, Q, R, P, S> collaborators;
    private final FanOutConfig config;
    private final QueryPartitioner partitioner;
    private final ExecutorService workerExecutor;
    private final boolean ownsExecutor;
    private final FanOutHook hook;

    /**
     * 생성자 (기본 partitioner, 러너 소유 스레드 풀, NoOp 훅 사용).
     *
     * @param collaborators 파이프라인 협력자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegionFanOutRunner(Collaborators<C, Q, R, P, S> collaborators, FanOutConfig config) {
        this(collaborators, config, new NoOpFanOutHook());
    }

    /**
     * 생성자 (훅 주입, 러너 소유 스레드 풀 사용).
     *
     * @param collaborators 파이프라인 협력자
     * @param config 설정
     * @param hook 실행 관찰 훅
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegionFanOutRunner(Collaborators<C, Q, R, P, S> collaborators, FanOutConfig config, FanOutHook hook) {
        this(collaborators, config, partitionerFor(config), null, hook);
    }

    /**
     * 생성자 (전체 주입).
     *
     * <p>workerExecutor를 주입하면 러너는 그 풀을 종료하지 않습니다.
     * null이면 러너가 cached 스레드 풀을 만들고 shutdown() 시 종료합니다.</p>
     *
     * @param collaborators 파이프라인 협력자
     * @param config 설정
     * @param partitioner 배치 분할기
     * @param workerExecutor 태스크 실행 스레드 풀 (null이면 러너가 생성)
     * @param hook 실행 관찰 훅
     * @throws IllegalArgumentException collaborators, config, partitioner, hook이 null인 경우
     */
    public RegionFanOutRunner(
        Collaborators<C, Q, R, P, S> collaborators,
        FanOutConfig config,
        QueryPartitioner partitioner,
        ExecutorService workerExecutor,
        FanOutHook hook
    ) {
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (partitioner == null) {
            throw new IllegalArgumentException("partitioner cannot be null");
        }
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }

        this.collaborators = collaborators;
        this.config = config;
        this.partitioner = partitioner;
        this.hook = new SafeFanOutHook(hook);
        this.ownsExecutor = workerExecutor == null;
        this.workerExecutor = ownsExecutor
            ? Executors.newCachedThreadPool(new WorkerThreadFactory(config.threadNamePrefix()))
            : workerExecutor;
    }

    private static QueryPartitioner partitionerFor(FanOutConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config.defaultRegion() == null
            ? new RegionPartitioner()
            : new RegionPartitioner(config.defaultRegion());
    }

    @Override
    public QueryDataResponse execute(QueryDataRequest request, CancellationContext context)
            throws QueryExecutionException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        String batchId = UUID.randomUUID().toString();
        FanOutMdc.setBatch(batchId);
        try {
            log.debug("Executing time series query: {} queries", request.queries().size());
            return executeBatch(batchId, request, context);
        } catch (QueryExecutionException e) {
            hook.onBatchFailed(e);
            throw e;
        } finally {
            FanOutMdc.clear();
        }
    }

    private QueryDataResponse executeBatch(String batchId, QueryDataRequest request, CancellationContext context)
            throws QueryExecutionException {
        List<MetricQuery> queries = request.queries();
        Map<Region, RegionGroup> groups = partitioner.partition(queries, request.sharedTimeRange());
        if (groups.isEmpty()) {
            log.debug("No region groups produced, returning empty response");
            hook.onBatchCompleted(0, 0);
            return QueryDataResponse.empty();
        }
        context.throwIfCancelled();

        ResultCollector collector = new ResultCollector(queries.size() + groups.size() + 1);
        try (CancellationContext groupContext = context.child()) {
            TaskGroup<Region> taskGroup = new TaskGroup<>(workerExecutor, groupContext);
            submitAll(batchId, request, groups, groupContext, collector, taskGroup);
            log.debug("Dispatched {} region tasks", taskGroup.size());

            try {
                taskGroup.await();
            } catch (QueryExecutionException e) {
                emitRemoteFailureFault(taskGroup.firstFailure(), collector);
                log.warn("Time series query failed: {}", e.getMessage());
                throw e;
            } catch (InterruptedException e) {
                CancelledException cancelled = new CancelledException("interrupted while awaiting region tasks", e);
                groupContext.cancel(cancelled);
                taskGroup.awaitQuietly();
                Thread.currentThread().interrupt();
                throw cancelled;
            }
        }

        collector.close();
        return assemble(collector.drain());
    }

    private void submitAll(
        String batchId,
        QueryDataRequest request,
        Map<Region, RegionGroup> groups,
        CancellationContext groupContext,
        ResultCollector collector,
        TaskGroup<Region> taskGroup
    ) {
        try {
            for (RegionGroup group : groups.values()) {
                taskGroup.go(group.region(), new RegionTask<>(
                    batchId,
                    group,
                    request.sharedTimeRange(),
                    request.clientContext(),
                    collaborators,
                    groupContext,
                    collector,
                    hook
                ));
            }
        } catch (RejectedExecutionException e) {
            CancelledException rejected = new CancelledException("runner rejected region tasks", e);
            groupContext.cancel(rejected);
            taskGroup.awaitQuietly();
            hook.onBatchFailed(rejected);
            throw new IllegalStateException("RegionFanOutRunner cannot accept tasks (shut down?)", e);
        }
    }

    private void emitRemoteFailureFault(TaskGroup.Failure<Region> failure, ResultCollector collector) {
        if (!config.remoteFailureFaultEnabled() || failure == null) {
            return;
        }
        RemoteServiceRequestException remote = findRemoteFailure(failure.error());
        if (remote == null) {
            return;
        }
        TaggedResult fault = TaggedResult.fault(
            failure.key(),
            new CallException("metric request error: \"" + remote.getMessage() + "\"", remote)
        );
        collector.emit(fault);
        hook.onResultEmitted(fault);
        log.warn("Remote service request failed in region {} (status: {})", failure.key(), remote.getStatusCode());
    }

    private static RemoteServiceRequestException findRemoteFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RemoteServiceRequestException) {
                return (RemoteServiceRequestException) current;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    private QueryDataResponse assemble(List<TaggedResult> results) {
        Map<QueryId, DataResponse> responses = new HashMap<>();
        List<TaggedResult> faults = new ArrayList<>();
        for (TaggedResult result : results) {
            if (result.isFault()) {
                log.warn("Fault result from region {} is not keyed into the response", result.region());
                faults.add(result);
            } else {
                responses.put(result.queryId(), result.response());
            }
        }
        hook.onBatchCompleted(responses.size(), faults.size());
        log.debug("Time series query completed: {} responses, {} faults", responses.size(), faults.size());
        return new QueryDataResponse(responses, faults);
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>러너가 만든 스레드 풀만 graceful shutdown합니다. 주입된 풀은 호출자가 관리합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (!ownsExecutor) {
            return;
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
