/**
 * Lightweight / Comprehensive 테스트 suite.
 *
 * <p>두 suite 모두 호출자 토큰의 자식으로 suite 데드라인 토큰을 만들고,
 * 프로브를 병렬로 실행한 뒤 join barrier에서 모두 기다립니다.</p>
 *
 * <ul>
 *   <li>프로브 실패: 결과 값 (예외 아님)</li>
 *   <li>suite 데드라인 초과: 미완료 프로브를 error_type=timeout 실패로 기록</li>
 *   <li>호출자 토큰 취소: {@link com.ryuqq.watchdog.core.context.ProbeCancelledException} 전파</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.application.suite;
