package com.ryuqq.fanout.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 오류 분류 체계 테스트.
 *
 * <p>단계(Stage)별 메시지 접두어와 에러 코드를 검증합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class QueryExecutionExceptionTest {

    @Test
    void message_PrefixedWithStageLabel() {
        assertEquals("validation failed: empty", new ValidationException("empty").getMessage());
        assertEquals("client resolution failed: x", new ClientResolutionException("x").getMessage());
        assertEquals("query translation failed: x", new TranslationException("x").getMessage());
        assertEquals("request build failed: x", new BuildException("x").getMessage());
        assertEquals("remote call failed: x", new CallException("x").getMessage());
        assertEquals("response parse failed: x", new ParseException("x").getMessage());
        assertEquals("result shaping failed: x", new ShapeException("x").getMessage());
        assertEquals("cancellation failed: x", new CancelledException("x").getMessage());
    }

    @Test
    void errorCode_FollowsStage() {
        // Given
        QueryExecutionException exception = new TranslationException("bad period");

        // Then
        assertEquals(Stage.TRANSLATION, exception.getStage());
        assertEquals("FANOUT-TRANSLATE", exception.getErrorCode());
    }

    @Test
    void recoveredFault_KeepsCauseAndExecutionStage() {
        // Given
        NullPointerException fault = new NullPointerException("npe");

        // When
        RecoveredFaultException exception =
            new RecoveredFaultException("failed to execute region query for us-east-1", fault);

        // Then
        assertSame(fault, exception.getCause());
        assertEquals(Stage.EXECUTION, exception.getStage());
        assertEquals("FANOUT-FAULT", exception.getErrorCode());
    }

    // ========== RemoteServiceRequestException ==========

    @Test
    void remoteServiceRequest_MessageIncludesStatusAndRequestId() {
        // When
        RemoteServiceRequestException exception =
            new RemoteServiceRequestException("Throttling: Rate exceeded", 400, "req-1");

        // Then
        assertEquals("remote call failed: Throttling: Rate exceeded (status: 400, requestId: req-1)",
            exception.getMessage());
        assertEquals(400, exception.getStatusCode());
        assertEquals("req-1", exception.getRequestId());
        assertEquals("FANOUT-REMOTE", exception.getErrorCode());
        assertEquals(Stage.CALL, exception.getStage());
    }

    @Test
    void remoteServiceRequest_IsCallException() {
        QueryExecutionException exception = new RemoteServiceRequestException("denied", 403, "req-2");

        assertInstanceOf(CallException.class, exception);
    }
}
