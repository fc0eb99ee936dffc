/**
 * 취소 가능한 실행 컨텍스트.
 *
 * <p>{@link com.ryuqq.fanout.core.context.CancellationContext}는 호출자에서 태스크 그룹으로,
 * 태스크 그룹에서 원격 호출로 전달되며 최초 오류 발생 시 모든 형제 태스크에 취소를 알립니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.context;
