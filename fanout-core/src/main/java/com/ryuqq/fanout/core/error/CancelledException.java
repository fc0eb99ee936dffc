package com.ryuqq.fanout.core.error;

/**
 * 호출자 컨텍스트가 취소되었거나 대기 중 인터럽트된 경우.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class CancelledException extends QueryExecutionException {

    public CancelledException(String message) {
        super(Stage.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(Stage.CANCELLED, message, cause);
    }
}
