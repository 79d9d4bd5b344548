package com.ryuqq.watchdog.core.retry;

import java.time.Duration;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>baseDelay: 첫 재시도 전 대기 시간 (기본 100ms)</li>
 *   <li>maxDelay: 대기 시간 상한 (기본 2s)</li>
 *   <li>multiplier: 재시도마다 곱해지는 배수 (기본 2.0)</li>
 *   <li>jitterFactor: 대기 시간에 더해지는 무작위 비율 (기본 0.0, 0.0 ~ 1.0)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param baseDelay 기본 대기 시간 (양수여야 함)
 * @param maxDelay 최대 대기 시간 (baseDelay 이상이어야 함)
 * @param multiplier backoff 배수 (1.0 이상이어야 함)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 * @author Watchdog Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double multiplier,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=100ms, maxDelay=2s, multiplier=2.0, jitterFactor=0.0</p>
     */
    public RetryPolicy() {
        this(3, Duration.ofMillis(100), Duration.ofSeconds(2), 2.0, 0.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 이 정책의 backoff 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseDelay.toMillis(), maxDelay.toMillis(), multiplier, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * multiplier만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitterFactor);
    }
}
