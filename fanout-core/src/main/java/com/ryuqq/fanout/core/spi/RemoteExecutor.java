package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.CallException;

/**
 * 원격 메트릭 API 호출 SPI.
 *
 * <p>구현체는 내부적으로 재시도/백오프를 수행할 수 있으며, 전달받은
 * {@link CancellationContext}를 관찰하여 취소 시 빠르게 실패해야 합니다.</p>
 *
 * @param <C> 클라이언트 핸들 타입
 * @param <R> 요청 페이로드 타입
 * @param <P> 응답 페이로드 타입
 * @author Fanout Team
 * @since 1.0.0
 */
public interface RemoteExecutor<C, R, P> {

    /**
     * 원격 호출 실행 (블로킹).
     *
     * @param context 배치 공유 취소 컨텍스트
     * @param client 클라이언트 핸들
     * @param request 요청 페이로드
     * @return 응답 페이로드
     * @throws CallException 호출 실패 시. 원격 서비스의 요청 실패는
     *         {@link com.ryuqq.fanout.core.error.RemoteServiceRequestException}으로 구분
     */
    P execute(CancellationContext context, C client, R request) throws CallException;
}
