package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.BuildException;
import com.ryuqq.fanout.core.model.TimeRange;

import java.util.List;

/**
 * 원격 호출 페이로드 조립 SPI.
 *
 * @param <Q> 원격 API 고유 쿼리 타입
 * @param <R> 요청 페이로드 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface RequestBuilder<Q, R> {

    /**
     * 요청 페이로드 생성.
     *
     * @param timeRange 배치 공유 조회 구간
     * @param nativeQueries 변환된 쿼리 목록
     * @return 요청 페이로드
     * @throws BuildException 조립 실패 시
     */
    R build(TimeRange timeRange, List<Q> nativeQueries) throws BuildException;
}
