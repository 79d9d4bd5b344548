package com.ryuqq.watchdog.core.retry;

import com.ryuqq.watchdog.core.context.ProbeCancelledException;

/**
 * 재시도 실행 결과.
 *
 * @param attemptsUsed 실제로 실행한 시도 횟수 (취소가 첫 시도 전에 관찰되면 0)
 * @param failure 마지막으로 관찰한 오류 (성공이면 null)
 * @author Watchdog Team
 * @since 1.0.0
 */
public record RetryOutcome(int attemptsUsed, Exception failure) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException attemptsUsed가 음수이거나, 성공인데 시도 횟수가 0인 경우
     */
    public RetryOutcome {
        if (attemptsUsed < 0) {
            throw new IllegalArgumentException("attemptsUsed cannot be negative (current: " + attemptsUsed + ")");
        }
        if (failure == null && attemptsUsed == 0) {
            throw new IllegalArgumentException("successful outcome requires at least one attempt");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param attemptsUsed 성공까지의 시도 횟수
     * @return RetryOutcome
     */
    public static RetryOutcome succeeded(int attemptsUsed) {
        return new RetryOutcome(attemptsUsed, null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param attemptsUsed 시도 횟수
     * @param failure 마지막 오류
     * @return RetryOutcome
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public static RetryOutcome failed(int attemptsUsed, Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new RetryOutcome(attemptsUsed, failure);
    }

    /**
     * 성공 여부.
     *
     * @return 성공이면 true
     */
    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * 취소로 중단되었는지 여부.
     *
     * @return 마지막 오류가 {@link ProbeCancelledException}이면 true
     */
    public boolean isCancelled() {
        return failure instanceof ProbeCancelledException;
    }

    /**
     * 재시도 횟수 (첫 시도 제외).
     *
     * @return max(0, attemptsUsed - 1)
     */
    public int retryCount() {
        return Math.max(0, attemptsUsed - 1);
    }

    /**
     * 실패 결과이면 마지막 오류를 다시 던짐.
     *
     * <p>Circuit Breaker가 재시도 전체를 한 번의 실패로 기록할 수 있도록 사용합니다.</p>
     *
     * @throws Exception 실패 결과인 경우 마지막 오류
     */
    public void rethrowIfFailed() throws Exception {
        if (failure != null) {
            throw failure;
        }
    }
}
