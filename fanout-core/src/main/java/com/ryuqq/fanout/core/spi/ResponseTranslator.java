package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.ParseException;

import java.util.List;

/**
 * 원격 응답을 쿼리별 결과 셋으로 해석하는 SPI.
 *
 * <p>쿼리 하나의 실패는 결과 셋 안에 오류로 내장하여 태스크 전체를 중단시키지 않을 수 있습니다.</p>
 *
 * @param <Q> 원격 API 고유 쿼리 타입
 * @param <P> 응답 페이로드 타입
 * @param <S> 쿼리별 결과 셋 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface ResponseTranslator<Q, P, S> {

    /**
     * 응답 해석.
     *
     * @param response 응답 페이로드
     * @param nativeQueries 요청에 사용한 고유 쿼리 목록
     * @return 쿼리별 결과 셋 (해석 순서가 태스크 내 발행 순서가 됨)
     * @throws ParseException 해석 실패 시
     */
    List<S> parse(P response, List<Q> nativeQueries) throws ParseException;
}
