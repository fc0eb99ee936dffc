package com.ryuqq.fanout.core.error;

/**
 * 오류가 발생한 처리 단계.
 *
 * <p>배치 단위 오류 메시지는 항상 실패한 단계를 포함합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public enum Stage {

    VALIDATION("FANOUT-VALIDATION", "validation"),
    CLIENT_RESOLUTION("FANOUT-CLIENT", "client resolution"),
    TRANSLATION("FANOUT-TRANSLATE", "query translation"),
    BUILD("FANOUT-BUILD", "request build"),
    CALL("FANOUT-CALL", "remote call"),
    PARSE("FANOUT-PARSE", "response parse"),
    SHAPE("FANOUT-SHAPE", "result shaping"),
    EXECUTION("FANOUT-FAULT", "task execution"),
    CANCELLED("FANOUT-CANCELLED", "cancellation");

    private final String errorCode;
    private final String label;

    Stage(String errorCode, String label) {
        this.errorCode = errorCode;
        this.label = label;
    }

    public String errorCode() {
        return errorCode;
    }

    public String label() {
        return label;
    }
}
