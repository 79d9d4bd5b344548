/**
 * 취소 전파 패키지.
 *
 * <p>{@link com.ryuqq.watchdog.core.context.CancellationToken}은 최상위 호출에서
 * suite, probe, 재시도 대기까지 하나의 트리로 전달됩니다. 모든 중단 지점은
 * 토큰을 관찰하고 취소 시 {@link com.ryuqq.watchdog.core.context.ProbeCancelledException}으로
 * 즉시 빠져나옵니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.core.context;
