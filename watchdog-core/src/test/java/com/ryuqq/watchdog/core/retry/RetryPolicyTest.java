package com.ryuqq.watchdog.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy 테스트.
 */
class RetryPolicyTest {

    @Test
    void 기본_정책() {
        // Given
        RetryPolicy policy = new RetryPolicy();

        // Then
        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofMillis(100), policy.baseDelay());
        assertEquals(Duration.ofSeconds(2), policy.maxDelay());
        assertEquals(2.0, policy.multiplier());
        assertEquals(0.0, policy.jitterFactor());
    }

    @Test
    void backoffCalculator는_정책_값을_반영() {
        // Given
        RetryPolicy policy = new RetryPolicy().withBaseDelay(Duration.ofMillis(50)).withMultiplier(3.0);

        // When
        BackoffCalculator calculator = policy.backoffCalculator();

        // Then
        assertEquals(50, calculator.calculate(1));
        assertEquals(150, calculator.calculate(2));
    }

    @Test
    void 잘못된_값은_거부() {
        RetryPolicy policy = new RetryPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.withMaxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> policy.withBaseDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> policy.withMaxDelay(Duration.ofMillis(10)));
        assertThrows(IllegalArgumentException.class, () -> policy.withMultiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> policy.withJitterFactor(1.5));
    }
}
