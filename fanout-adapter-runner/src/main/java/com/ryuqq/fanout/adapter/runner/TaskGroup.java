package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 태스크 묶음 실행기 (전원 대기 + 첫 오류 기록 + 공유 컨텍스트 취소).
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>go(): 태스크를 ExecutorService에 제출</li>
 *   <li>어떤 태스크든 일반 오류로 끝나면 첫 오류만 기록하고 공유 컨텍스트를 취소</li>
 *   <li>await(): 제출된 모든 태스크가 끝날 때까지 대기 후 첫 오류가 있으면 던짐</li>
 * </ul>
 *
 * <p>이후의 오류는 버려집니다. 태스크 경계를 벗어난 unchecked 예외는
 * 로그만 남기고 대기를 계속합니다.</p>
 *
 * @param <K> 태스크 키 타입 (첫 오류의 출처 식별용)
 * @author Fanout Team
 * @since 1.0.0
 */
final class TaskGroup<K> {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private final ExecutorService executor;
    private final CancellationContext context;
    private final List<Future<?>> futures = new ArrayList<>();
    private final AtomicReference<Failure<K>> firstFailure = new AtomicReference<>();

    /**
     * 그룹 태스크 (일반 오류는 QueryExecutionException으로 보고).
     */
    @FunctionalInterface
    interface GroupTask {
        void run() throws QueryExecutionException;
    }

    /**
     * 첫 오류와 그 출처.
     *
     * @param key 실패한 태스크 키
     * @param error 오류
     * @param <K> 키 타입
     */
    record Failure<K>(K key, QueryExecutionException error) {
    }

    /**
     * 생성자.
     *
     * @param executor 태스크 실행 스레드 풀
     * @param context 첫 오류 시 취소할 공유 컨텍스트
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    TaskGroup(ExecutorService executor, CancellationContext context) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.executor = executor;
        this.context = context;
    }

    /**
     * 태스크 제출.
     *
     * @param key 태스크 키
     * @param task 실행할 태스크
     * @throws java.util.concurrent.RejectedExecutionException 실행기가 태스크를 거부한 경우
     */
    void go(K key, GroupTask task) {
        futures.add(executor.submit(() -> {
            try {
                task.run();
            } catch (QueryExecutionException e) {
                if (firstFailure.compareAndSet(null, new Failure<>(key, e))) {
                    context.cancel(e);
                } else {
                    log.debug("Discarding subsequent task error from {}: {}", key, e.getMessage());
                }
            }
        }));
    }

    /**
     * 모든 태스크 완료 대기.
     *
     * @throws QueryExecutionException 첫 번째로 기록된 일반 오류
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void await() throws QueryExecutionException, InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Task escaped its fault boundary", e.getCause());
            } catch (CancellationException e) {
                log.warn("Task future was cancelled before completion");
            }
        }
        Failure<K> failure = firstFailure.get();
        if (failure != null) {
            throw failure.error();
        }
    }

    /**
     * 오류를 던지지 않고 제출된 모든 태스크의 종료를 대기.
     *
     * <p>호출 전에 공유 컨텍스트를 취소해 두어야 합니다. 대기 중 인터럽트는 무시하고
     * 모든 태스크가 끝날 때까지 기다린 뒤, 호출 시점 또는 대기 중 인터럽트가 있었다면
     * 인터럽트 플래그를 복원합니다.</p>
     */
    void awaitQuietly() {
        boolean interrupted = Thread.interrupted();
        try {
            for (Future<?> future : futures) {
                while (true) {
                    try {
                        future.get();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    } catch (ExecutionException e) {
                        log.error("Task escaped its fault boundary", e.getCause());
                        break;
                    } catch (CancellationException e) {
                        log.warn("Task future was cancelled before completion");
                        break;
                    }
                }
            }
            Failure<K> failure = firstFailure.get();
            if (failure != null) {
                log.debug("Ignoring task error while draining group: {}", failure.error().getMessage());
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * 첫 오류 조회.
     *
     * @return 첫 오류, 없으면 null
     */
    Failure<K> firstFailure() {
        return firstFailure.get();
    }

    int size() {
        return futures.size();
    }
}
