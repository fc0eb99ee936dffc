package com.ryuqq.fanout.core.error;

/**
 * 리전 클라이언트 핸들을 얻지 못한 경우. 해당 태스크만 중단됩니다.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class ClientResolutionException extends QueryExecutionException {

    public ClientResolutionException(String message) {
        super(Stage.CLIENT_RESOLUTION, message);
    }

    public ClientResolutionException(String message, Throwable cause) {
        super(Stage.CLIENT_RESOLUTION, message, cause);
    }
}
