/**
 * In-memory metrics service used as the remote side of the reference pipeline.
 *
 * <p>{@link com.ryuqq.fanout.adapter.inmemory.api.InMemoryMetricsApi} stores series per region and can be told
 * to reject calls to a region or to embed errors for a metric.</p>
 */
package com.ryuqq.fanout.adapter.inmemory.api;
