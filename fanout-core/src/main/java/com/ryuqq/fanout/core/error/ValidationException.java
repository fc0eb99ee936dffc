package com.ryuqq.fanout.core.error;

/**
 * 배치 유효성 검증 실패.
 *
 * <p>빈 배치, 잘못된 공유 조회 구간, 중복 쿼리 식별자 등.
 * 태스크를 하나도 시작하기 전에 즉시 보고됩니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class ValidationException extends QueryExecutionException {

    public ValidationException(String message) {
        super(Stage.VALIDATION, message);
    }
}
