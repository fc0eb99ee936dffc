package com.ryuqq.fanout.core.model;

/**
 * 원격 메트릭 서비스의 리전.
 *
 * <p>리전 하나당 원격 호출 하나가 수행됩니다. {@code default} 리전은
 * 파티셔닝 시점에 설정된 기본 리전으로 치환됩니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class Region {

    /**
     * 설정된 기본 리전을 가리키는 예약 이름.
     */
    public static final String DEFAULT_NAME = "default";

    private final String name;

    private Region(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Region name cannot be null or blank");
        }
        this.name = name.trim();
    }

    /**
     * Region 생성.
     *
     * @param name 리전 이름 (예: us-east-1)
     * @return Region 인스턴스
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public static Region of(String name) {
        return new Region(name);
    }

    public String getName() {
        return name;
    }

    /**
     * 기본 리전 placeholder 여부.
     *
     * @return 이름이 {@code default}이면 true
     */
    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Region region = (Region) o;
        return name.equals(region.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
