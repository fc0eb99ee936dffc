/**
 * Collaborator SPIs consumed by the fan-out coordinator.
 *
 * <p>The engine never talks to a metrics API directly; each region task drives these
 * interfaces in order. Implementations must be thread-safe because region tasks call
 * them concurrently.</p>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link com.ryuqq.fanout.core.spi.ClientProvider} - resolve a client handle</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.QueryTranslator} - grouped queries to native queries</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.RequestBuilder} - native queries to a request payload</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.RemoteExecutor} - the network call</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.ResponseTranslator} - response to per-query result sets</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.ResultShaper} - result sets to final entries</li>
 * </ol>
 *
 * <p>{@link com.ryuqq.fanout.core.spi.QueryPartitioner} runs before the pipeline, once per batch.</p>
 *
 * <p><strong>Error contract:</strong> ordinary failures are reported by throwing the checked
 * exception declared on each method. Anything unchecked is treated as a runtime fault.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.spi;
