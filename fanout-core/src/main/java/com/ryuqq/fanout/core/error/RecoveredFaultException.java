package com.ryuqq.fanout.core.error;

/**
 * 태스크 경계에서 회수한 런타임 장애.
 *
 * <p>던져지지 않고 fault 결과 안에 담겨서만 전달됩니다. 원래 예외는 cause로 보존됩니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class RecoveredFaultException extends QueryExecutionException {

    public RecoveredFaultException(String message, Throwable cause) {
        super(Stage.EXECUTION, message, cause);
    }
}
