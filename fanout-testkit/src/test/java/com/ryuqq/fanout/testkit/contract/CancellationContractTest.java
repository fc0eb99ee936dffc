package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.core.context.CancellationContext;
import com.ryuqq.fanout.core.error.CallException;
import com.ryuqq.fanout.core.error.CancelledException;
import com.ryuqq.fanout.core.error.QueryExecutionException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for cancellation propagation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>First ordinary error cancels the shared context; in-flight sibling calls observe it</li>
 *   <li>Caller cancelling its context fails in-flight calls and the batch</li>
 *   <li>Already-cancelled caller context: CancelledException, nothing dispatched</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class CancellationContractTest extends RunnerContractTestSupport {

    @Test
    void testCancellation_FirstErrorCancelsSiblings() {
        // Given
        scripted.script(US_EAST_1, RegionBehavior.BLOCK_UNTIL_CANCELLED);
        scripted.script(EU_WEST_1, RegionBehavior.FAIL_CALL);

        // When/Then: the batch fails with the eu-west-1 error, not the sibling's cancellation
        CallException exception = assertThrows(CallException.class,
            () -> execute(query("A", US_EAST_1), query("C", EU_WEST_1)));

        assertTrue(exception.getMessage().contains("eu-west-1"));
        assertTrue(scripted.observedCancellation(US_EAST_1));
    }

    @Test
    void testCancellation_CallerCancelFailsBatch() throws Exception {
        // Given
        scripted.script(US_EAST_1, RegionBehavior.BLOCK_UNTIL_CANCELLED);
        scripted.script(EU_WEST_1, RegionBehavior.BLOCK_UNTIL_CANCELLED);
        CancellationContext caller = CancellationContext.create();

        CompletableFuture<Void> batch = CompletableFuture.runAsync(() -> {
            try {
                engine.execute(request(query("A", US_EAST_1), query("C", EU_WEST_1)), caller);
            } catch (QueryExecutionException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(scripted.awaitCallsStarted(2, 5000), "both remote calls should start");

        // When
        caller.cancel(new CancelledException("dashboard closed"));

        // Then
        ExecutionException failure = assertThrows(ExecutionException.class, () -> batch.get(5, TimeUnit.SECONDS));
        Throwable batchError = failure.getCause().getCause();
        assertInstanceOf(CallException.class, batchError);
        assertTrue(scripted.observedCancellation(US_EAST_1));
        assertTrue(scripted.observedCancellation(EU_WEST_1));
    }

    @Test
    void testCancellation_AlreadyCancelledContext_NothingDispatched() {
        // Given
        CancellationContext caller = CancellationContext.create();
        caller.cancel(null);

        // When/Then
        assertThrows(CancelledException.class,
            () -> engine.execute(request(query("A", US_EAST_1)), caller));
        assertTrue(hook.dispatchedRegions().isEmpty());
    }
}
