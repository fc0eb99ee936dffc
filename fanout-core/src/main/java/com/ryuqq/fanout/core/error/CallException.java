package com.ryuqq.fanout.core.error;

/**
 * 원격 호출 실패.
 *
 * <p>전송 계층 재시도는 {@code RemoteExecutor} 구현체 내부에서 끝난 뒤의 최종 실패입니다.
 * 공유 컨텍스트가 취소되어 호출을 시작하지 않은 경우에도 사용됩니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class CallException extends QueryExecutionException {

    public CallException(String message) {
        super(Stage.CALL, message);
    }

    public CallException(String message, Throwable cause) {
        super(Stage.CALL, message, cause);
    }
}
