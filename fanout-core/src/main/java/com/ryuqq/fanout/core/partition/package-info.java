/**
 * 쿼리 배치 파티셔닝.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.partition.RegionPartitioner} - 리전 기준 기본 파티셔너</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.partition;
