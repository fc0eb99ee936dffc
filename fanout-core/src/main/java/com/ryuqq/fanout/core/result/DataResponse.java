package com.ryuqq.fanout.core.result;

import java.util.List;

/**
 * 쿼리 하나의 최종 결과.
 *
 * <p>프레임 목록(payload) 또는 쿼리 단위로 내장된 오류 중 하나를 담습니다.
 * 쿼리 단위 오류는 태스크를 중단시키지 않고 해당 항목에만 기록됩니다.</p>
 *
 * @param frames 결과 프레임 (오류 시 빈 목록)
 * @param error 내장 오류 (선택, null 가능)
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public record DataResponse(
    List<Frame> frames,
    Throwable error
) {

    /**
     * Compact Constructor.
     */
    public DataResponse {
        frames = frames == null ? List.of() : List.copyOf(frames);
        // error는 null 허용
    }

    /**
     * 성공 결과 생성.
     *
     * @param frames 결과 프레임
     * @return DataResponse 인스턴스
     */
    public static DataResponse of(List<Frame> frames) {
        return new DataResponse(frames, null);
    }

    /**
     * 오류 결과 생성.
     *
     * @param error 내장 오류
     * @return DataResponse 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static DataResponse error(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new DataResponse(List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
