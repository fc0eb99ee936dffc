package com.ryuqq.fanout.core.spi;

/**
 * 리전 태스크 파이프라인을 구성하는 외부 협력자 묶음.
 *
 * <p>태스크 하나는 다음 순서로 협력자를 호출합니다:</p>
 * <pre>
 * clientProvider → queryTranslator → requestBuilder
 *   → remoteExecutor → responseTranslator → resultShaper
 * </pre>
 *
 * @param clientProvider 클라이언트 핸들 제공자
 * @param queryTranslator 쿼리 변환기
 * @param requestBuilder 요청 조립기
 * @param remoteExecutor 원격 호출 실행기
 * @param responseTranslator 응답 해석기
 * @param resultShaper 결과 변환기
 * @param <C> 클라이언트 핸들 타입
 * @param <Q> 고유 쿼리 타입
 * @param <R> 요청 페이로드 타입
 * @param <P> 응답 페이로드 타입
 * @param <S> 쿼리별 결과 셋 타입
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record Collaborators<C, Q, R, P, S>(
    ClientProvider<C> clientProvider,
    QueryTranslator<Q> queryTranslator,
    RequestBuilder<Q, R> requestBuilder,
    RemoteExecutor<C, R, P> remoteExecutor,
    ResponseTranslator<Q, P, S> responseTranslator,
    ResultShaper<S> resultShaper
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 협력자 중 하나라도 null인 경우
     */
    public Collaborators {
        requireNonNull(clientProvider, "clientProvider");
        requireNonNull(queryTranslator, "queryTranslator");
        requireNonNull(requestBuilder, "requestBuilder");
        requireNonNull(remoteExecutor, "remoteExecutor");
        requireNonNull(responseTranslator, "responseTranslator");
        requireNonNull(resultShaper, "resultShaper");
    }

    private static void requireNonNull(Object collaborator, String name) {
        if (collaborator == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
