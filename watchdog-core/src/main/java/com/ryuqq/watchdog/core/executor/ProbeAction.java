package com.ryuqq.watchdog.core.executor;

/**
 * 보호 대상 작업 (한 번의 네트워크 시도).
 *
 * <p>{@link com.ryuqq.watchdog.core.protection.CircuitBreaker}와
 * {@link com.ryuqq.watchdog.core.retry.RetryExecutor}가 감싸는 단위입니다.
 * 정상 반환은 성공, 예외는 실패를 의미합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProbeAction {

    /**
     * 작업 실행.
     *
     * @throws Exception 작업 실패 시 (네트워크 오류는 보통 {@link java.io.IOException})
     */
    void run() throws Exception;
}
