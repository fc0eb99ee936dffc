package com.ryuqq.fanout.core.model;

import java.util.Map;

/**
 * 시계열 메트릭 쿼리.
 *
 * <p>제출 이후 불변입니다. {@code parameters}는 쿼리별 파라미터
 * (namespace, metricName, statistic, period, {@code dimension.<name>} 등)이며
 * 해석은 {@code QueryTranslator} 구현체가 담당합니다.</p>
 *
 * @param id 쿼리 식별자
 * @param region 대상 리전
 * @param timeRange 배치 공유 조회 구간
 * @param parameters 쿼리별 파라미터 (불변 복사본)
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record MetricQuery(
    QueryId id,
    Region region,
    TimeRange timeRange,
    Map<String, String> parameters
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id, region, timeRange가 null인 경우
     */
    public MetricQuery {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (timeRange == null) {
            throw new IllegalArgumentException("timeRange cannot be null");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * 파라미터 조회.
     *
     * @param name 파라미터 이름
     * @return 값 또는 null
     */
    public String parameter(String name) {
        return parameters.get(name);
    }

    /**
     * 리전만 바꾼 새 인스턴스 생성.
     *
     * @param region 새 리전
     * @return MetricQuery 인스턴스
     */
    public MetricQuery withRegion(Region region) {
        return new MetricQuery(id, region, timeRange, parameters);
    }
}
