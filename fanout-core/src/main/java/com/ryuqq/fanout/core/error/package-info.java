/**
 * 팬아웃 실행 오류 분류.
 *
 * <h2>일반 오류 (checked)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.error.ValidationException} - 태스크 시작 전 배치 검증 실패</li>
 *   <li>{@link com.ryuqq.fanout.core.error.ClientResolutionException},
 *       {@link com.ryuqq.fanout.core.error.TranslationException},
 *       {@link com.ryuqq.fanout.core.error.BuildException},
 *       {@link com.ryuqq.fanout.core.error.CallException},
 *       {@link com.ryuqq.fanout.core.error.ParseException},
 *       {@link com.ryuqq.fanout.core.error.ShapeException} - 태스크 단위 오류, 최초 발생 오류가 배치 오류가 됨</li>
 *   <li>{@link com.ryuqq.fanout.core.error.RemoteServiceRequestException} - 원격 서비스 요청 실패</li>
 * </ul>
 *
 * <h2>런타임 장애</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.error.RecoveredFaultException} - 태스크 경계에서 회수된 장애</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.error;
