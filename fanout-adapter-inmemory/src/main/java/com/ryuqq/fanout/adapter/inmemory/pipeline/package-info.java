/**
 * Reference pipeline collaborators backed by the in-memory metrics service.
 *
 * <p>Resolve a region client, translate generic queries to metric data queries, build one request
 * per region, call the service, parse the per-query results and shape them into frames.</p>
 */
package com.ryuqq.fanout.adapter.inmemory.pipeline;
