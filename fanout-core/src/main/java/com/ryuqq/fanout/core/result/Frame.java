package com.ryuqq.fanout.core.result;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 단일 시계열 데이터 프레임.
 *
 * @param name 시리즈 이름 (예: CPUUtilization)
 * @param labels 시리즈 라벨 (디멘션 등, 불변 복사본)
 * @param timestamps 데이터포인트 시각 (values와 길이 동일)
 * @param values 데이터포인트 값
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record Frame(
    String name,
    Map<String, String> labels,
    List<Instant> timestamps,
    List<Double> values
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비었거나 timestamps와 values 길이가 다른 경우
     */
    public Frame {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        values = values == null ? List.of() : List.copyOf(values);
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException(
                "timestamps and values must have the same length (timestamps: "
                    + timestamps.size() + ", values: " + values.size() + ")");
        }
    }

    public int length() {
        return values.size();
    }
}
