package com.ryuqq.fanout.core.context;

import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.error.CancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationContext 테스트.
 *
 * <p>취소 1회성, 부모→자식 전파, 리스너 실행 규칙을 검증합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class CancellationContextTest {

    // ========== 기본 취소 테스트 ==========

    @Test
    void create_NewContext_IsNotCancelled() {
        // When
        CancellationContext context = CancellationContext.create();

        // Then
        assertFalse(context.isCancelled());
        assertNull(context.cause());
        assertDoesNotThrow(context::throwIfCancelled);
    }

    @Test
    void cancel_WithReason_KeepsFirstCauseOnly() {
        // Given
        CancellationContext context = CancellationContext.create();
        CallException first = new CallException("first");
        CallException second = new CallException("second");

        // When
        boolean firstResult = context.cancel(first);
        boolean secondResult = context.cancel(second);

        // Then
        assertTrue(firstResult);
        assertFalse(secondResult);
        assertTrue(context.isCancelled());
        assertSame(first, context.cause());
    }

    @Test
    void cancel_NullReason_UsesCancelledException() {
        // Given
        CancellationContext context = CancellationContext.create();

        // When
        context.cancel(null);

        // Then
        assertInstanceOf(CancelledException.class, context.cause());
    }

    @Test
    void throwIfCancelled_CancelledContext_ThrowsWithCause() {
        // Given
        CancellationContext context = CancellationContext.create();
        CallException reason = new CallException("boom");
        context.cancel(reason);

        // When & Then
        CancelledException exception = assertThrows(CancelledException.class, context::throwIfCancelled);
        assertSame(reason, exception.getCause());
        assertTrue(exception.getMessage().contains("remote call failed: boom"));
    }

    // ========== 전파 테스트 ==========

    @Test
    void child_ParentCancelled_ChildCancelledWithSameCause() {
        // Given
        CancellationContext parent = CancellationContext.create();
        CancellationContext child = parent.child();
        CallException reason = new CallException("parent failure");

        // When
        parent.cancel(reason);

        // Then
        assertTrue(child.isCancelled());
        assertSame(reason, child.cause());
    }

    @Test
    void child_CreatedFromCancelledParent_IsCancelledImmediately() {
        // Given
        CancellationContext parent = CancellationContext.create();
        parent.cancel(new CallException("already"));

        // When
        CancellationContext child = parent.child();

        // Then
        assertTrue(child.isCancelled());
        assertSame(parent.cause(), child.cause());
    }

    @Test
    void cancel_Child_DoesNotCancelParent() {
        // Given
        CancellationContext parent = CancellationContext.create();
        CancellationContext child = parent.child();

        // When
        child.cancel(new CallException("child only"));

        // Then
        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
    }

    @Test
    void close_Child_DetachesFromParent() {
        // Given
        CancellationContext parent = CancellationContext.create();
        CancellationContext child = parent.child();

        // When
        child.close();
        parent.cancel(new CallException("late"));

        // Then
        assertTrue(child.isCancelled());
        assertInstanceOf(CancelledException.class, child.cause());
        assertTrue(child.cause().getMessage().contains("context closed"));
    }

    // ========== 리스너 테스트 ==========

    @Test
    void onCancel_RegisteredBeforeCancel_RunsExactlyOnce() {
        // Given
        CancellationContext context = CancellationContext.create();
        AtomicInteger calls = new AtomicInteger();
        context.onCancel(calls::incrementAndGet);

        // When
        context.cancel(null);
        context.cancel(null);

        // Then
        assertEquals(1, calls.get());
    }

    @Test
    void onCancel_AlreadyCancelled_RunsImmediately() {
        // Given
        CancellationContext context = CancellationContext.create();
        context.cancel(null);
        AtomicInteger calls = new AtomicInteger();

        // When
        context.onCancel(calls::incrementAndGet);

        // Then
        assertEquals(1, calls.get());
    }

    @Test
    void onCancel_NullListener_ThrowsException() {
        CancellationContext context = CancellationContext.create();

        IllegalArgumentException exception =
            assertThrows(IllegalArgumentException.class, () -> context.onCancel(null));
        assertEquals("listener cannot be null", exception.getMessage());
    }

    @Test
    void removeListener_RemovedListener_IsNotRun() {
        // Given
        CancellationContext context = CancellationContext.create();
        AtomicInteger calls = new AtomicInteger();
        Runnable listener = calls::incrementAndGet;
        context.onCancel(listener);

        // When
        context.removeListener(listener);
        context.cancel(null);

        // Then
        assertEquals(0, calls.get());
    }

    // ========== 대기 테스트 ==========

    @Test
    void awaitCancellation_NotCancelled_TimesOut() throws InterruptedException {
        CancellationContext context = CancellationContext.create();

        assertFalse(context.awaitCancellation(20, TimeUnit.MILLISECONDS));
    }

    @Test
    void awaitCancellation_CancelledFromOtherThread_ReturnsTrue() throws InterruptedException {
        // Given
        CancellationContext context = CancellationContext.create();
        CountDownLatch started = new CountDownLatch(1);
        Thread canceller = new Thread(() -> {
            started.countDown();
            context.cancel(new CallException("from worker"));
        });

        // When
        canceller.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        boolean cancelled = context.awaitCancellation(5, TimeUnit.SECONDS);
        canceller.join();

        // Then
        assertTrue(cancelled);
        assertTrue(context.isCancelled());
    }
}
