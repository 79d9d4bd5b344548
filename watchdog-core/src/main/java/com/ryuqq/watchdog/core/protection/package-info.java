/**
 * Circuit Breaker 패키지.
 *
 * <p>연결성 프로브를 대상 클래스별로 보호하는 Circuit Breaker SPI와 기본 구현을 제공합니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 즉시 실패 (작업 미실행)
 * 2. RetryExecutor   → 지수 backoff 재시도 (최대 maxAttempts)
 * 3. ProbeAction     → 실제 네트워크 시도 (TCP connect, DNS 조회, HTTP HEAD)
 * </pre>
 *
 * <p>Circuit Breaker가 재시도 전체를 감싸므로, 재시도를 모두 소진한 프로브 한 건이
 * 실패 한 번으로 기록됩니다.</p>
 *
 * <h2>인스턴스 구성</h2>
 * <ul>
 *   <li>TCP handshake + DNS resolution: 하나의 breaker 공유</li>
 *   <li>HTTP reachability: 별도 breaker (한 클래스의 실패가 다른 클래스를 차단하지 않음)</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 * @see com.ryuqq.watchdog.core.protection.CircuitBreaker
 * @see com.ryuqq.watchdog.core.protection.ConsecutiveFailureCircuitBreaker
 */
package com.ryuqq.watchdog.core.protection;
