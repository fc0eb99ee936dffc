package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.model.Region;

/**
 * RegionFanOutRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultRegion: {@code default} 리전 쿼리를 치환할 리전 (기본 없음)</li>
 *   <li>threadNamePrefix: 러너 소유 워커 스레드 이름 접두사 (기본 "fanout-region-")</li>
 *   <li>remoteFailureFaultEnabled: 원격 서비스 요청 실패 시 요약 fault 결과 발행 여부 (기본 true)</li>
 *   <li>shutdownTimeoutMs: shutdown() 시 워커 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p>동시 실행 수는 러너가 제한하지 않습니다 (리전 수만큼 태스크 생성).
 * 제한이 필요하면 호출자가 고정 크기 {@code ExecutorService}를 주입합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 * @param defaultRegion 기본 리전 (null 가능)
 * @param threadNamePrefix 워커 스레드 이름 접두사 (비어 있을 수 없음)
 * @param remoteFailureFaultEnabled 요약 fault 결과 발행 여부
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record FanOutConfig(
    Region defaultRegion,
    String threadNamePrefix,
    boolean remoteFailureFaultEnabled,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultRegion=없음, threadNamePrefix="fanout-region-",
     * remoteFailureFaultEnabled=true, shutdownTimeoutMs=60000ms</p>
     */
    public FanOutConfig() {
        this(null, "fanout-region-", true, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FanOutConfig {
        if (defaultRegion != null && defaultRegion.isDefault()) {
            throw new IllegalArgumentException("defaultRegion must name a concrete region");
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * defaultRegion만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withDefaultRegion(Region defaultRegion) {
        return new FanOutConfig(defaultRegion, threadNamePrefix, remoteFailureFaultEnabled, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withThreadNamePrefix(String threadNamePrefix) {
        return new FanOutConfig(defaultRegion, threadNamePrefix, remoteFailureFaultEnabled, shutdownTimeoutMs);
    }

    /**
     * remoteFailureFaultEnabled만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withRemoteFailureFaultEnabled(boolean remoteFailureFaultEnabled) {
        return new FanOutConfig(defaultRegion, threadNamePrefix, remoteFailureFaultEnabled, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new FanOutConfig(defaultRegion, threadNamePrefix, remoteFailureFaultEnabled, shutdownTimeoutMs);
    }
}
