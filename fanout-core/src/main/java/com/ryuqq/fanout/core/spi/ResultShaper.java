package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.ShapeException;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.result.DataResponse;

import java.util.List;
import java.util.Map;

/**
 * 쿼리별 결과 셋을 최종 응답 항목으로 변환하는 SPI.
 *
 * @param <S> 쿼리별 결과 셋 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface ResultShaper<S> {

    /**
     * 결과 변환.
     *
     * @param resultSets 쿼리별 결과 셋
     * @param group 태스크의 리전 그룹
     * @param timeRange 배치 공유 조회 구간
     * @return 쿼리 식별자별 최종 결과
     * @throws ShapeException 변환 실패 시
     */
    Map<QueryId, DataResponse> shape(List<S> resultSets, RegionGroup group, TimeRange timeRange) throws ShapeException;
}
