package com.ryuqq.fanout.core.model;

import java.time.Instant;

/**
 * 배치 전체가 공유하는 조회 구간.
 *
 * <p>null 검증만 생성 시점에 수행합니다. {@code from < to} 불변식은 배치 단위로
 * 파티셔닝 전에 한 번 검증되며, 위반 시 {@code ValidationException}으로 보고됩니다.</p>
 *
 * @param from 구간 시작 (포함)
 * @param to 구간 끝
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record TimeRange(
    Instant from,
    Instant to
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public TimeRange {
        if (from == null || to == null) {
            throw new IllegalArgumentException("TimeRange bounds cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    public static TimeRange of(Instant from, Instant to) {
        return new TimeRange(from, to);
    }

    /**
     * 시작이 끝보다 엄격히 앞서는지 확인.
     *
     * @return from이 to보다 이전이면 true
     */
    public boolean isValid() {
        return from.isBefore(to);
    }

    /**
     * 주어진 시각이 구간 [from, to) 안에 있는지 확인.
     *
     * @param instant 확인할 시각
     * @return 구간 안이면 true
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
