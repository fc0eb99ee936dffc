package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.TranslationException;
import com.ryuqq.fanout.core.model.RegionGroup;

import java.util.List;

/**
 * 그룹 쿼리를 원격 API 고유 쿼리로 변환하는 SPI.
 *
 * @param <Q> 원격 API 고유 쿼리 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface QueryTranslator<Q> {

    /**
     * 리전 그룹 변환.
     *
     * @param group 리전 그룹
     * @return 고유 쿼리 목록
     * @throws TranslationException 변환 실패 시
     */
    List<Q> translate(RegionGroup group) throws TranslationException;
}
