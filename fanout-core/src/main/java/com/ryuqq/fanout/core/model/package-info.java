/**
 * Query batch value objects.
 *
 * <p>Immutable types describing one fan-out request:</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.model.QueryId} - Query identifier, unique per request</li>
 *   <li>{@link com.ryuqq.fanout.core.model.Region} - Remote metrics service region</li>
 *   <li>{@link com.ryuqq.fanout.core.model.TimeRange} - Time range shared by the whole batch</li>
 *   <li>{@link com.ryuqq.fanout.core.model.MetricQuery} - One time-series query</li>
 *   <li>{@link com.ryuqq.fanout.core.model.RegionGroup} - Queries targeting a single region</li>
 *   <li>{@link com.ryuqq.fanout.core.model.ClientContext} - Token used to resolve client handles</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.model;
