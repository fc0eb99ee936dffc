package com.ryuqq.fanout.core.partition;

import com.ryuqq.fanout.core.error.ValidationException;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.spi.QueryPartitioner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 리전 기준 기본 파티셔너.
 *
 * <p>순수 함수이며 I/O가 없습니다. 그룹 순서는 리전이 배치에 처음 등장한 순서를 따릅니다.</p>
 *
 * <p><strong>검증 (파티셔닝 전 한 번):</strong></p>
 * <ol>
 *   <li>빈 배치 → ValidationException</li>
 *   <li>공유 조회 구간의 시작이 끝보다 앞서지 않음 → ValidationException</li>
 *   <li>공유 구간과 다른 구간을 가진 쿼리 → ValidationException</li>
 *   <li>중복 쿼리 식별자 → ValidationException</li>
 *   <li>{@code default} 리전인데 기본 리전 미설정 → ValidationException</li>
 * </ol>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class RegionPartitioner implements QueryPartitioner {

    private final Region defaultRegion;

    /**
     * 기본 리전 없이 생성. {@code default} 리전 쿼리는 검증 오류가 됩니다.
     */
    public RegionPartitioner() {
        this(null);
    }

    /**
     * 생성자.
     *
     * @param defaultRegion {@code default} 리전을 치환할 리전 (null 가능)
     * @throws IllegalArgumentException defaultRegion 자체가 {@code default}인 경우
     */
    public RegionPartitioner(Region defaultRegion) {
        if (defaultRegion != null && defaultRegion.isDefault()) {
            throw new IllegalArgumentException("defaultRegion must name a concrete region");
        }
        this.defaultRegion = defaultRegion;
    }

    @Override
    public Map<Region, RegionGroup> partition(List<MetricQuery> queries, TimeRange timeRange) throws ValidationException {
        if (queries == null || queries.isEmpty()) {
            throw new ValidationException("request contains no queries");
        }
        if (timeRange == null) {
            throw new IllegalArgumentException("timeRange cannot be null");
        }
        if (!timeRange.isValid()) {
            throw new ValidationException("invalid time range: start time must be before end time (from: "
                + timeRange.from() + ", to: " + timeRange.to() + ")");
        }

        Set<QueryId> seen = new HashSet<>();
        Map<Region, List<MetricQuery>> byRegion = new LinkedHashMap<>();
        for (MetricQuery query : queries) {
            if (query == null) {
                throw new ValidationException("request contains a null query");
            }
            if (!seen.add(query.id())) {
                throw new ValidationException("duplicate query id: " + query.id().getValue());
            }
            if (!timeRange.equals(query.timeRange())) {
                throw new ValidationException("query " + query.id().getValue()
                    + " does not share the batch time range");
            }
            MetricQuery resolved = resolveRegion(query);
            byRegion.computeIfAbsent(resolved.region(), r -> new ArrayList<>()).add(resolved);
        }

        Map<Region, RegionGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<Region, List<MetricQuery>> entry : byRegion.entrySet()) {
            groups.put(entry.getKey(), new RegionGroup(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableMap(groups);
    }

    private MetricQuery resolveRegion(MetricQuery query) throws ValidationException {
        if (!query.region().isDefault()) {
            return query;
        }
        if (defaultRegion == null) {
            throw new ValidationException("query " + query.id().getValue()
                + " uses the default region but none is configured");
        }
        return query.withRegion(defaultRegion);
    }
}
