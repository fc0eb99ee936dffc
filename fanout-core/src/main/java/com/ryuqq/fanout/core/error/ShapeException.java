package com.ryuqq.fanout.core.error;

/**
 * 쿼리별 결과 셋을 최종 응답 항목으로 변환하지 못한 경우.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class ShapeException extends QueryExecutionException {

    public ShapeException(String message) {
        super(Stage.SHAPE, message);
    }

    public ShapeException(String message, Throwable cause) {
        super(Stage.SHAPE, message, cause);
    }
}
