package com.ryuqq.watchdog.application.tiered;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.TieredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 모니터링 사이클 드라이버.
 *
 * <p>직전 결과와 연속 실패 수를 보관하고 매 tick마다 {@link TestScheduler}에 전달합니다.
 * 성공하면 연속 실패 수를 0으로, 실패하면 1 증가시킵니다.
 * 재부팅 판단이나 장애 기록은 이 결과를 소비하는 쪽의 책임입니다.</p>
 *
 * <p>tick은 직렬화됩니다 (한 번에 한 사이클).</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ConnectivityMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    private final TestScheduler scheduler;

    private volatile TieredResult lastResult;
    private volatile int consecutiveFailures;

    public ConnectivityMonitor(TestScheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 한 사이클 실행.
     *
     * <p>테스트 호출 자체가 실패하면(구조적 오류, 취소) 카운터와 직전 결과를 바꾸지 않고 예외를 전파합니다.</p>
     *
     * @param token 취소 토큰
     * @return 이번 사이클 결과
     */
    public synchronized TieredResult tick(CancellationToken token) {
        TieredResult result;
        try {
            result = scheduler.scheduleTests(token, lastResult, consecutiveFailures);
        } catch (ProbeCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to perform connectivity tests: {}", e.getMessage());
            throw e;
        }

        if (result.overallSuccess()) {
            if (consecutiveFailures > 0) {
                log.info("Connectivity restored, resetting failure counter (previousFailures={})",
                    consecutiveFailures);
            }
            consecutiveFailures = 0;
        } else {
            consecutiveFailures++;
            log.warn("Connectivity test failed (failureCount={}, strategy={})",
                consecutiveFailures, result.strategy().code());
        }
        lastResult = result;

        log.info("Connectivity cycle completed: strategy={}, success={}, shortCircuited={}, duration={}ms",
            result.strategy().code(), result.overallSuccess(), result.shortCircuited(),
            result.totalDuration().toMillis());
        return result;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Optional<TieredResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }
}
