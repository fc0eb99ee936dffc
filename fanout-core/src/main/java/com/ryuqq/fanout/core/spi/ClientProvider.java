package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.error.ClientResolutionException;
import com.ryuqq.fanout.core.model.ClientContext;
import com.ryuqq.fanout.core.model.Region;

/**
 * 리전 클라이언트 핸들 제공자 SPI.
 *
 * <p>리전과 실행 컨텍스트 토큰으로 인증된 원격 API 클라이언트를 돌려줍니다.
 * 구현체는 thread-safe해야 합니다 (리전 태스크들이 동시에 호출).</p>
 *
 * @param <C> 클라이언트 핸들 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface ClientProvider<C> {

    /**
     * 클라이언트 핸들 조회.
     *
     * @param region 대상 리전
     * @param clientContext 실행 컨텍스트 토큰
     * @return 클라이언트 핸들 (non-null)
     * @throws ClientResolutionException 핸들을 얻지 못한 경우 (해당 태스크 중단)
     */
    C resolve(Region region, ClientContext clientContext) throws ClientResolutionException;
}
