package com.ryuqq.fanout.application.engine;

import com.ryuqq.fanout.core.model.ClientContext;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.TimeRange;

import java.util.List;

/**
 * 팬아웃 실행 요청.
 *
 * <p>배치의 모든 쿼리는 같은 조회 구간을 공유합니다. 공유 구간은 첫 쿼리의 구간이며,
 * 빈 배치 여부와 구간 유효성은 실행 시점에 검증됩니다.</p>
 *
 * @param queries 쿼리 배치 (불변 복사본, null이면 빈 배치)
 * @param clientContext 클라이언트 해석용 실행 컨텍스트 토큰
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record QueryDataRequest(
    List<MetricQuery> queries,
    ClientContext clientContext
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException clientContext가 null인 경우
     */
    public QueryDataRequest {
        if (clientContext == null) {
            throw new IllegalArgumentException("clientContext cannot be null");
        }
        queries = queries == null ? List.of() : List.copyOf(queries);
    }

    /**
     * 배치 공유 조회 구간.
     *
     * @return 첫 쿼리의 조회 구간, 빈 배치이면 null
     */
    public TimeRange sharedTimeRange() {
        return queries.isEmpty() ? null : queries.get(0).timeRange();
    }

    public boolean isEmpty() {
        return queries.isEmpty();
    }
}
