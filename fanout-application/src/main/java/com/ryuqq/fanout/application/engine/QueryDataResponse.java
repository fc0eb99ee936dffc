package com.ryuqq.fanout.application.engine;

import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.TaggedResult;

import java.util.List;
import java.util.Map;

/**
 * 팬아웃 실행의 최종 응답.
 *
 * <p>모든 태스크가 끝난 뒤 코디네이터만이 생성합니다. 맵 순서에 의존하면 안 됩니다.</p>
 *
 * <p><strong>fault 결과:</strong> 식별자 없는 fault 결과는 키가 없으므로
 * {@code responses}에 들어가지 않고 {@code faults}에만 보관됩니다. 해당 리전의
 * 쿼리들은 응답 맵에 나타나지 않습니다.</p>
 *
 * @param responses 쿼리 식별자별 결과 (불변)
 * @param faults 함께 수집된 fault 결과 (불변)
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record QueryDataResponse(
    Map<QueryId, DataResponse> responses,
    List<TaggedResult> faults
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException faults에 식별자 있는 결과가 섞인 경우
     */
    public QueryDataResponse {
        responses = responses == null ? Map.of() : Map.copyOf(responses);
        faults = faults == null ? List.of() : List.copyOf(faults);
        for (TaggedResult fault : faults) {
            if (!fault.isFault()) {
                throw new IllegalArgumentException("faults can only hold fault results (queryId: " + fault.queryId() + ")");
            }
        }
    }

    /**
     * 빈 성공 응답.
     *
     * @return 항목 없는 응답
     */
    public static QueryDataResponse empty() {
        return new QueryDataResponse(Map.of(), List.of());
    }

    /**
     * 쿼리 결과 조회.
     *
     * @param queryId 쿼리 식별자
     * @return 결과, 없으면 null
     */
    public DataResponse get(QueryId queryId) {
        return responses.get(queryId);
    }

    public int size() {
        return responses.size();
    }

    public boolean hasFaults() {
        return !faults.isEmpty();
    }
}
