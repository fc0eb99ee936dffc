package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.ValidationException;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.Region;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;

import java.util.List;
import java.util.Map;

/**
 * 쿼리 배치를 리전 그룹으로 나누는 SPI.
 *
 * <p>기본 구현은 {@link com.ryuqq.fanout.core.partition.RegionPartitioner}입니다.
 * 반환된 맵이 비어 있으면 엔진은 태스크 없이 빈 응답을 돌려줍니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface QueryPartitioner {

    /**
     * 배치 분할.
     *
     * @param queries 쿼리 배치
     * @param timeRange 배치 공유 조회 구간
     * @return 리전별 그룹 (부작용 없음)
     * @throws ValidationException 배치가 유효하지 않은 경우
     */
    Map<Region, RegionGroup> partition(List<MetricQuery> queries, TimeRange timeRange) throws ValidationException;
}
