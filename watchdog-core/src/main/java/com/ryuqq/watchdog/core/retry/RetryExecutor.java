package com.ryuqq.watchdog.core.retry;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.executor.ProbeAction;
import com.ryuqq.watchdog.core.protection.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 지수 backoff 재시도 실행기.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>첫 시도는 즉시 실행</li>
 *   <li>실패 시 {@link BackoffCalculator}가 계산한 시간만큼 대기 후 재시도</li>
 *   <li>첫 성공 시 즉시 반환</li>
 *   <li>maxAttempts 소진 시 마지막 오류 반환</li>
 * </ol>
 *
 * <p><strong>재시도하지 않는 오류:</strong></p>
 * <ul>
 *   <li>{@link ProbeCancelledException}: 취소는 즉시 상위로 반환</li>
 *   <li>{@link CircuitOpenException}: 의도적인 fast-fail</li>
 *   <li>{@link InterruptedException}: 인터럽트 플래그 복원 후 취소로 반환</li>
 * </ul>
 *
 * <p>backoff 대기는 {@link CancellationToken#sleep(Duration)}을 사용하므로
 * 취소 신호가 오면 남은 대기 시간과 관계없이 즉시 깨어납니다.</p>
 *
 * <p>Stateless 설계로 여러 프로브 스레드가 하나의 인스턴스를 공유할 수 있습니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /**
     * 재시도 실행.
     *
     * @param token 취소 토큰
     * @param action 재시도 대상 작업
     * @param policy 재시도 정책
     * @return 시도 횟수와 마지막 오류
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetryOutcome execute(CancellationToken token, ProbeAction action, RetryPolicy policy) {
        return execute(token, action, policy, "operation");
    }

    /**
     * 재시도 실행 (로깅용 라벨 지정).
     *
     * @param token 취소 토큰
     * @param action 재시도 대상 작업
     * @param policy 재시도 정책
     * @param label 로그에 남길 작업 이름 (예: "tcp_handshake")
     * @return 시도 횟수와 마지막 오류
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetryOutcome execute(CancellationToken token, ProbeAction action, RetryPolicy policy, String label) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        BackoffCalculator backoff = policy.backoffCalculator();
        Exception lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (token.isCancelled()) {
                return RetryOutcome.failed(attempt - 1, token.cancellationError());
            }

            if (attempt > 1) {
                long delayMs = backoff.calculate(attempt - 1);
                try {
                    token.sleep(Duration.ofMillis(delayMs));
                } catch (ProbeCancelledException e) {
                    return RetryOutcome.failed(attempt - 1, e);
                }
            }

            try {
                action.run();
                return RetryOutcome.succeeded(attempt);
            } catch (ProbeCancelledException | CircuitOpenException e) {
                return RetryOutcome.failed(attempt, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.failed(attempt,
                    new ProbeCancelledException(ProbeCancelledException.Reason.CANCELLED, "attempt interrupted"));
            } catch (Exception e) {
                // 취소 리스너가 소켓을 닫아 발생한 I/O 오류는 취소로 취급
                if (token.isCancelled()) {
                    return RetryOutcome.failed(attempt, token.cancellationError());
                }
                lastError = e;
                log.debug("{} failed (attempt {}/{}): {}", label, attempt, policy.maxAttempts(), e.getMessage());
            }
        }

        return RetryOutcome.failed(policy.maxAttempts(), lastError);
    }
}
