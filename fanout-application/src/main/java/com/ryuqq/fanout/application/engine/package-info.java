/**
 * Fanout Application Layer - 팬아웃 엔진 포트.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.application.engine.TimeSeriesQueryEngine} - 팬아웃 엔진</li>
 *   <li>{@link com.ryuqq.fanout.application.engine.QueryDataRequest} - 실행 요청</li>
 *   <li>{@link com.ryuqq.fanout.application.engine.QueryDataResponse} - 최종 응답</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.engine;
