/**
 * 연결성 테스트 결과 모델.
 *
 * <p>모든 결과 타입은 불변이며, 반환된 후에는 호출자가 소유합니다 (값 의미론).</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.watchdog.core.model.ProbeResult} - 프로브 시도 1건</li>
 *   <li>{@link com.ryuqq.watchdog.core.model.LightweightSuiteResult} - TCP handshake tier, 50% 규칙</li>
 *   <li>{@link com.ryuqq.watchdog.core.model.ComprehensiveSuiteResult} - DNS + HTTP tier, 60% 규칙</li>
 *   <li>{@link com.ryuqq.watchdog.core.model.TieredResult} - 에스컬레이션 판정</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.core.model;
