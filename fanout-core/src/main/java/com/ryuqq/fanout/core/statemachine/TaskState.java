package com.ryuqq.fanout.core.statemachine;

/**
 * 리전 태스크의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED → DISPATCHED → CLIENT_RESOLVED → TRANSLATED → REQUEST_BUILT
 *         → CALL_EXECUTED → RESPONSE_PARSED → RESULTS_EMITTED → COMPLETED
 *
 * 비종료 상태 어디서든:
 *   ─► FAULTED (런타임 장애)
 *   ─► ABORTED (일반 오류)
 * </pre>
 *
 * <p>종료 상태(COMPLETED, FAULTED, ABORTED)는 해당 태스크에만 적용되며
 * 공유 컨텍스트 취소를 통하지 않고는 형제 태스크를 막지 않습니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public enum TaskState {

    CREATED,
    DISPATCHED,
    CLIENT_RESOLVED,
    TRANSLATED,
    REQUEST_BUILT,
    CALL_EXECUTED,
    RESPONSE_PARSED,
    RESULTS_EMITTED,

    /**
     * 정상 완료.
     */
    COMPLETED,

    /**
     * 런타임 장애로 종료 (태스크 경계에서 회수됨).
     */
    FAULTED,

    /**
     * 일반 오류로 중단.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAULTED, ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAULTED || this == ABORTED;
    }

    /**
     * 정상 경로상의 다음 상태.
     *
     * @return 다음 상태, 종료 상태이면 null
     */
    public TaskState next() {
        switch (this) {
            case CREATED: return DISPATCHED;
            case DISPATCHED: return CLIENT_RESOLVED;
            case CLIENT_RESOLVED: return TRANSLATED;
            case TRANSLATED: return REQUEST_BUILT;
            case REQUEST_BUILT: return CALL_EXECUTED;
            case CALL_EXECUTED: return RESPONSE_PARSED;
            case RESPONSE_PARSED: return RESULTS_EMITTED;
            case RESULTS_EMITTED: return COMPLETED;
            default: return null;
        }
    }
}
