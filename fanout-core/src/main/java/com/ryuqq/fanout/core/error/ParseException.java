package com.ryuqq.fanout.core.error;

/**
 * 원격 응답을 쿼리별 결과 셋으로 해석하지 못한 경우.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class ParseException extends QueryExecutionException {

    public ParseException(String message) {
        super(Stage.PARSE, message);
    }

    public ParseException(String message, Throwable cause) {
        super(Stage.PARSE, message, cause);
    }
}
