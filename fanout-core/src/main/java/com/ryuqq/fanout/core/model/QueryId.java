package com.ryuqq.fanout.core.model;

/**
 * 배치 내 쿼리의 고유 식별자.
 *
 * <p>요청 하나 안에서 유일하며, 쿼리 생명주기 동안 변하지 않습니다.
 * 최종 응답 맵의 키로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class QueryId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private QueryId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("QueryId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("QueryId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * QueryId 생성.
     *
     * @param value 식별자 값 (예: "A", "cpu_p99")
     * @return QueryId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static QueryId of(String value) {
        return new QueryId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryId queryId = (QueryId) o;
        return value.equals(queryId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "QueryId{" + value + '}';
    }
}
