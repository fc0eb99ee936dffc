package com.ryuqq.fanout.core.error;

/**
 * 원격 서비스가 요청을 거부하거나 실패 응답을 돌려준 경우.
 *
 * <p>{@link CallException}의 구분된 하위 타입입니다. 배치가 이 오류로 실패하면
 * 코디네이터는 요약 fault 결과를 추가로 발행한 뒤 오류를 던집니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class RemoteServiceRequestException extends CallException {

    private final int statusCode;
    private final String requestId;

    /**
     * 생성자.
     *
     * @param message 원격 서비스 오류 메시지
     * @param statusCode HTTP 상태 코드
     * @param requestId 원격 요청 ID (선택, null 가능)
     */
    public RemoteServiceRequestException(String message, int statusCode, String requestId) {
        this(message, statusCode, requestId, null);
    }

    public RemoteServiceRequestException(String message, int statusCode, String requestId, Throwable cause) {
        super(message + " (status: " + statusCode + ", requestId: " + requestId + ")", cause);
        this.statusCode = statusCode;
        this.requestId = requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public String getErrorCode() {
        return "FANOUT-REMOTE";
    }
}
