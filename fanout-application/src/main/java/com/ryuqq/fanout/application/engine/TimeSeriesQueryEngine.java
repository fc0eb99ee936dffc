package com.ryuqq.fanout.application.engine;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.QueryExecutionException;

/**
 * 시계열 쿼리 팬아웃 엔진.
 *
 * <p>쿼리 배치를 리전별로 나누고, 리전마다 원격 호출 하나를 동시에 수행한 뒤
 * 결과를 쿼리 식별자 기준 단일 응답으로 병합합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueryDataRequest request = new QueryDataRequest(queries, ClientContext.of("cloudwatch-prod"));
 * try {
 *     QueryDataResponse response = engine.execute(request, CancellationContext.create());
 *     DataResponse a = response.get(QueryId.of("A"));
 * } catch (QueryExecutionException e) {
 *     // 배치 전체 실패: e.getStage(), e.getErrorCode()
 * }
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface TimeSeriesQueryEngine {

    /**
     * 배치 실행 (블로킹).
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>배치 검증 및 리전 파티셔닝</li>
     *   <li>그룹이 없으면 태스크 없이 빈 응답 반환</li>
     *   <li>리전마다 태스크 하나를 공유 취소 컨텍스트 아래에서 동시 실행</li>
     *   <li>모든 태스크 종료 대기</li>
     *   <li>최초 태스크 오류가 있으면 해당 오류를 던짐 (부분 응답 없음)</li>
     *   <li>없으면 수집된 결과로 최종 응답 조립</li>
     * </ol>
     *
     * @param request 실행 요청
     * @param context 호출자 취소 컨텍스트
     * @return 쿼리 식별자별 결과
     * @throws QueryExecutionException 검증 실패, 최초 태스크 오류, 또는 호출자 취소/인터럽트
     * @throws IllegalArgumentException request 또는 context가 null인 경우
     */
    QueryDataResponse execute(QueryDataRequest request, CancellationContext context) throws QueryExecutionException;
}
