package com.ryuqq.fanout.core.error;

/**
 * 원격 요청 페이로드를 만들지 못한 경우.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class BuildException extends QueryExecutionException {

    public BuildException(String message) {
        super(Stage.BUILD, message);
    }

    public BuildException(String message, Throwable cause) {
        super(Stage.BUILD, message, cause);
    }
}
