/**
 * Per-query results emitted by region tasks.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.result.Frame} - One time series</li>
 *   <li>{@link com.ryuqq.fanout.core.result.DataResponse} - Payload or embedded per-query error</li>
 *   <li>{@link com.ryuqq.fanout.core.result.TaggedResult} - Result tagged with its query id; a missing id marks a fault result</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.result;
