/**
 * 단일 프로브 실행 (Circuit Breaker + Retry + 네트워크 포트).
 *
 * <p>{@link com.ryuqq.watchdog.application.probe.ProbeRunner}가 만드는 detail 키
 * ({@code server}, {@code timeout_ms}, {@code error}, {@code status_code}, {@code error_type})는
 * 진단/장애 기록 협력자가 파싱하는 준안정 계약입니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.application.probe;
