package com.ryuqq.fanout.core.error;

/**
 * 팬아웃 쿼리 실행 오류의 최상위 타입.
 *
 * <p>일반 오류(ordinary error)는 모두 이 checked 예외의 하위 타입으로 표현됩니다.
 * unchecked 예외나 {@link Error}는 런타임 장애(fault)로 취급되어 태스크 경계에서
 * 격리됩니다.</p>
 *
 * <p><strong>메시지 형식:</strong> {@code "<stage label> failed: <detail>"}</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public abstract class QueryExecutionException extends Exception {

    private final Stage stage;

    protected QueryExecutionException(Stage stage, String message) {
        this(stage, message, null);
    }

    protected QueryExecutionException(Stage stage, String message, Throwable cause) {
        super(format(stage, message), cause);
        this.stage = stage;
    }

    private static String format(Stage stage, String message) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return stage.label() + " failed: " + message;
    }

    /**
     * 실패한 처리 단계.
     *
     * @return Stage
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * 오류 코드 (예: FANOUT-CALL).
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return stage.errorCode();
    }
}
