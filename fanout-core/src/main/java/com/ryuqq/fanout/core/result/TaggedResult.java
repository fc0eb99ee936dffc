package com.ryuqq.fanout.core.result;

import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.Region;

/**
 * 워커 태스크가 발행하는 (쿼리 식별자, 결과) 쌍.
 *
 * <p>{@code queryId}가 없는 결과는 fault 결과로, 특정 쿼리에 귀속되지 않는
 * 태스크 전체 실패를 나타냅니다. fault 결과는 최종 응답 맵에 키로 들어가지 않습니다.</p>
 *
 * @param region 결과를 만든 태스크의 리전
 * @param queryId 쿼리 식별자 (fault 결과는 null)
 * @param response 결과
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record TaggedResult(
    Region region,
    QueryId queryId,
    DataResponse response
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException region 또는 response가 null인 경우
     */
    public TaggedResult {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    /**
     * 쿼리에 귀속된 결과 생성.
     *
     * @param region 리전
     * @param queryId 쿼리 식별자
     * @param response 결과
     * @return TaggedResult 인스턴스
     * @throws IllegalArgumentException queryId가 null인 경우
     */
    public static TaggedResult of(Region region, QueryId queryId, DataResponse response) {
        if (queryId == null) {
            throw new IllegalArgumentException("queryId cannot be null for a tagged result");
        }
        return new TaggedResult(region, queryId, response);
    }

    /**
     * fault 결과 생성.
     *
     * @param region 리전
     * @param error 태스크 전체 실패 원인
     * @return 식별자 없는 TaggedResult
     */
    public static TaggedResult fault(Region region, Throwable error) {
        return new TaggedResult(region, null, DataResponse.error(error));
    }

    public boolean isFault() {
        return queryId == null;
    }
}
