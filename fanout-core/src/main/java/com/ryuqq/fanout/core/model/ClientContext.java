package com.ryuqq.fanout.core.model;

import java.util.Map;

/**
 * 클라이언트 핸들 해석에 쓰이는 실행 컨텍스트 토큰.
 *
 * <p>엔진은 내용을 해석하지 않고 {@code ClientProvider}에 그대로 전달합니다.</p>
 *
 * @param datasourceId 데이터소스 식별자
 * @param profile 자격 증명 프로필 (선택, null 가능)
 * @param settings 추가 설정 (불변 복사본)
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record ClientContext(
    String datasourceId,
    String profile,
    Map<String, String> settings
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException datasourceId가 null이거나 빈 문자열인 경우
     */
    public ClientContext {
        if (datasourceId == null || datasourceId.isBlank()) {
            throw new IllegalArgumentException("datasourceId cannot be null or blank");
        }
        // profile은 null 허용
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static ClientContext of(String datasourceId) {
        return new ClientContext(datasourceId, null, Map.of());
    }
}
