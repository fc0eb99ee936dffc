/**
 * Observation hooks for fan-out execution.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.hook.FanOutHook} - Hook SPI</li>
 *   <li>{@link com.ryuqq.fanout.core.hook.noop.NoOpFanOutHook} - Default no-op implementation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.hook;
