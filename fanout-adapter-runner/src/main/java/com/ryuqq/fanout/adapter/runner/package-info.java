/**
 * Region fan-out runner.
 *
 * <p>{@link com.ryuqq.fanout.adapter.runner.RegionFanOutRunner} partitions a batch by region,
 * runs one {@code RegionTask} per region on a worker pool and merges the emitted results.
 * The first ordinary task error cancels the shared child context and fails the whole batch.</p>
 */
package com.ryuqq.fanout.adapter.runner;
