package com.ryuqq.watchdog.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 전이에 필요한 연속 실패 수 (1 이상)
 * @param resetTimeout 마지막 실패 후 시험 호출을 허용하기까지의 대기 시간 (양수)
 * @author Watchdog Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, Duration resetTimeout) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=3, resetTimeout=30s</p>
     */
    public CircuitBreakerConfig() {
        this(3, Duration.ofSeconds(30));
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException failureThreshold가 1 미만이거나 resetTimeout이 양수가 아닌 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (resetTimeout == null || resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException(
                "resetTimeout must be positive (current: " + resetTimeout + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeout);
    }

    /**
     * resetTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withResetTimeout(Duration resetTimeout) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeout);
    }
}
