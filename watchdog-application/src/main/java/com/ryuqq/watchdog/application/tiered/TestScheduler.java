package com.ryuqq.watchdog.application.tiered;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.TestStrategy;
import com.ryuqq.watchdog.core.model.TieredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실패 이력 기반 테스트 스케줄러.
 *
 * <p><strong>comprehensive 강제 조건:</strong></p>
 * <ol>
 *   <li>연속 실패 ≥ 3: 현재 lightweight가 우연히 통과해도 깊은 진단 수행</li>
 *   <li>직전 결과가 ESCALATED_TO_COMPREHENSIVE이고 실패: 알려진 장애 상태가 short-circuit으로 빠져나가지 않도록</li>
 *   <li>주기 감사: 직전 결과가 있고 연속 실패 수가 auditInterval(기본 10)의 배수일 때</li>
 * </ol>
 *
 * <p>판단은 호출자가 넘긴 이력에만 의존합니다. 스케줄러 자체는 상태를 갖지 않습니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class TestScheduler {

    private static final Logger log = LoggerFactory.getLogger(TestScheduler.class);

    public static final int FORCE_AFTER_CONSECUTIVE_FAILURES = 3;
    public static final int DEFAULT_AUDIT_INTERVAL = 10;

    private final TieredTester tester;
    private final int auditInterval;

    public TestScheduler(TieredTester tester) {
        this(tester, DEFAULT_AUDIT_INTERVAL);
    }

    /**
     * 생성자.
     *
     * @param tester 계층형 테스터
     * @param auditInterval 주기 감사 간격 (연속 실패 수의 제수)
     * @throws IllegalArgumentException tester가 null이거나 auditInterval이 양수가 아닌 경우
     */
    public TestScheduler(TieredTester tester, int auditInterval) {
        if (tester == null) {
            throw new IllegalArgumentException("tester cannot be null");
        }
        if (auditInterval < 1) {
            throw new IllegalArgumentException("auditInterval must be positive (current: " + auditInterval + ")");
        }
        this.tester = tester;
        this.auditInterval = auditInterval;
    }

    /**
     * 이력을 반영하여 계층형 테스트 실행.
     *
     * @param token 호출자 취소 토큰
     * @param lastResult 직전 사이클 결과 (없으면 null)
     * @param consecutiveFailures 호출자가 관리하는 연속 실패 수
     * @return 계층형 결과
     * @throws IllegalArgumentException consecutiveFailures가 음수인 경우
     */
    public TieredResult scheduleTests(CancellationToken token, TieredResult lastResult, int consecutiveFailures) {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException(
                "consecutiveFailures cannot be negative (current: " + consecutiveFailures + ")");
        }
        boolean force = shouldForceComprehensive(lastResult, consecutiveFailures);
        return tester.runTiered(token, force);
    }

    /**
     * comprehensive 강제 여부 판단.
     */
    boolean shouldForceComprehensive(TieredResult lastResult, int consecutiveFailures) {
        if (consecutiveFailures >= FORCE_AFTER_CONSECUTIVE_FAILURES) {
            log.debug("Forcing comprehensive tests: {} consecutive failures", consecutiveFailures);
            return true;
        }
        if (lastResult != null
            && lastResult.strategy() == TestStrategy.ESCALATED_TO_COMPREHENSIVE
            && !lastResult.overallSuccess()) {
            log.debug("Forcing comprehensive tests: previous escalated run failed");
            return true;
        }
        if (lastResult != null && consecutiveFailures % auditInterval == 0) {
            log.debug("Forcing comprehensive tests: periodic audit (consecutiveFailures={})", consecutiveFailures);
            return true;
        }
        return false;
    }
}
