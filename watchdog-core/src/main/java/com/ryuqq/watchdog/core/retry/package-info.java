/**
 * 재시도 패키지.
 *
 * <p>{@link com.ryuqq.watchdog.core.retry.RetryExecutor}는 작업을 제한된 횟수만큼
 * 지수 backoff로 재시도하며, 대기 중에도 취소를 관찰합니다.</p>
 *
 * <p>프로브 기본값: maxAttempts=3, baseDelay=100ms, maxDelay=2s, multiplier=2.0</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.core.retry;
