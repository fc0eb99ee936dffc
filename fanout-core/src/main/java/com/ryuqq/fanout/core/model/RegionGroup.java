package com.ryuqq.fanout.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 리전을 대상으로 하는 쿼리 묶음.
 *
 * <p>요청마다 한 번 만들어지며 실행 중에는 읽기 전용입니다.
 * 태스크 하나가 그룹 하나를 처리합니다.</p>
 *
 * @param region 대상 리전
 * @param queries 요청 순서를 유지한 쿼리 목록 (불변, 비어 있을 수 없음)
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record RegionGroup(
    Region region,
    List<MetricQuery> queries
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException region이 null이거나 queries가 비어 있거나
     *                                  다른 리전의 쿼리가 섞인 경우
     */
    public RegionGroup {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("queries cannot be null or empty for region " + region);
        }
        for (MetricQuery query : queries) {
            if (!region.equals(query.region())) {
                throw new IllegalArgumentException(
                    "query " + query.id().getValue() + " targets " + query.region() + ", not " + region);
            }
        }
        queries = List.copyOf(queries);
    }

    public int size() {
        return queries.size();
    }

    /**
     * 그룹에 속한 쿼리 식별자 목록.
     *
     * @return 요청 순서의 QueryId 목록
     */
    public List<QueryId> queryIds() {
        List<QueryId> ids = new ArrayList<>(queries.size());
        for (MetricQuery query : queries) {
            ids.add(query.id());
        }
        return ids;
    }
}
