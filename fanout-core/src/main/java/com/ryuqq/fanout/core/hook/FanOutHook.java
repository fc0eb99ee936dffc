package com.ryuqq.fanout.core.hook;

import com.ryuqq.fanout.core.error.QueryExecutionException;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.result.TaggedResult;
import com.ryuqq.fanout.core.statemachine.TaskState;

/**
 * 팬아웃 실행 관찰 훅 SPI.
 *
 * <p>코디네이터와 리전 태스크가 진행 상황을 알립니다. 여러 태스크 스레드에서 동시에
 * 호출되므로 구현체는 thread-safe해야 합니다. 훅에서 던진 예외는 로그만 남기고 무시되며
 * 실행 결과에 영향을 주지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FanOutHook hook = new FanOutHook() {
 *     public void onResultEmitted(TaggedResult result) {
 *         if (result.isFault()) {
 *             alerts.record(result.region(), result.response().error());
 *         }
 *     }
 *     // ...
 * };
 * }</pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface FanOutHook {

    /**
     * 태스크 상태 전이 알림.
     *
     * @param region 태스크 리전
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onTaskStateChanged(Region region, TaskState from, TaskState to);

    /**
     * 결과 수집기에 결과가 발행됨.
     *
     * <p>fault 결과(식별자 없음)도 포함됩니다. 배치가 결국 실패하더라도
     * 발행 시점에 호출됩니다.</p>
     *
     * @param result 발행된 결과
     */
    void onResultEmitted(TaggedResult result);

    /**
     * 배치 성공.
     *
     * @param responseCount 최종 응답 항목 수
     * @param faultCount 함께 수집된 fault 결과 수
     */
    void onBatchCompleted(int responseCount, int faultCount);

    /**
     * 배치 실패.
     *
     * @param error 배치 단위 오류
     */
    void onBatchFailed(QueryExecutionException error);
}
