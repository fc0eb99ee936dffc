package com.ryuqq.fanout.testkit.contract;

/**
 * Scripted behavior of one region in {@link ScriptedCollaborators}.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public enum RegionBehavior {

    /** Every stage succeeds; each query yields a one-frame response. */
    SUCCEED,

    /** Client resolution fails with {@code ClientResolutionException}. */
    FAIL_CLIENT,

    /** The remote call fails with a plain {@code CallException}. */
    FAIL_CALL,

    /** The remote call fails with {@code RemoteServiceRequestException} (status 400, "Throttling"). */
    FAIL_REMOTE,

    /** Response parsing throws {@code IllegalStateException}. */
    RUNTIME_FAULT,

    /** Result shaping throws {@code AssertionError}. */
    ERROR_FAULT,

    /**
     * The remote call blocks until the shared context is cancelled, then fails with
     * {@code CallException}. Succeeds if no cancellation arrives within five seconds.
     */
    BLOCK_UNTIL_CANCELLED
}
