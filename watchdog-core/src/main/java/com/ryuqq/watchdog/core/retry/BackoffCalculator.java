package com.ryuqq.watchdog.core.retry;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 배수만큼 증가시키고 상한으로 제한합니다.
 * jitterFactor가 0보다 크면 무작위 지연을 더해 동시 재시도를 분산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * multiplier^(retryNumber-1), maxDelay)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, multiplier=2.0, maxDelay=2000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>retryNumber=1: 100ms</li>
 *   <li>retryNumber=2: 200ms</li>
 *   <li>retryNumber=3: 400ms</li>
 *   <li>retryNumber=6: 3200ms → 2000ms (maxDelay)</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=100ms, maxDelay=2000ms, multiplier=2.0, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(100, 2000, 2.0, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param multiplier 배수 (1.0 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double multiplier, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 전 지연 시간 계산.
     *
     * @param retryNumber 재시도 순번 (첫 재시도가 1)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }

        // double 연산으로 overflow 없이 상한 적용
        double raw = baseDelayMs * Math.pow(multiplier, retryNumber - 1);
        long exponential = raw >= maxDelayMs ? maxDelayMs : (long) raw;

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간 (밀리초)
     */
    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (밀리초)
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * 배수 조회.
     *
     * @return 배수
     */
    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Jitter 비율 조회.
     *
     * @return Jitter 비율 (0.0 ~ 1.0)
     */
    public double getJitterFactor() {
        return jitterFactor;
    }
}
