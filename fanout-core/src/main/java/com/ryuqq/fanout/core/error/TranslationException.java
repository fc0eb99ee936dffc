package com.ryuqq.fanout.core.error;

/**
 * 그룹 쿼리를 원격 API 고유 쿼리로 변환하지 못한 경우.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class TranslationException extends QueryExecutionException {

    public TranslationException(String message) {
        super(Stage.TRANSLATION, message);
    }

    public TranslationException(String message, Throwable cause) {
        super(Stage.TRANSLATION, message, cause);
    }
}
