package com.ryuqq.watchdog.testkit.contract;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.tiered.ConnectivityMonitor;
import com.ryuqq.watchdog.application.tiered.TestScheduler;
import com.ryuqq.watchdog.application.tiered.TieredTester;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.TestStrategy;
import com.ryuqq.watchdog.core.model.TieredResult;
import com.ryuqq.watchdog.core.protection.CircuitBreakerConfig;
import com.ryuqq.watchdog.testkit.ScriptedDnsResolver;
import com.ryuqq.watchdog.testkit.ScriptedHttpProber;
import com.ryuqq.watchdog.testkit.ScriptedTcpConnector.Outcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: scheduler forcing and the monitor failure counter.
 *
 * <ul>
 *   <li>Three consecutive failures force the comprehensive tier even when the lightweight tier passes</li>
 *   <li>A failed escalation forces the next cycle to escalate as well</li>
 *   <li>With a previous result, a failure count that is a multiple of 10 forces a periodic audit</li>
 *   <li>The monitor counter grows on failure and resets on success</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
class SchedulerContractTest extends AbstractContractTest {

    @Test
    void testSchedule_ThreeConsecutiveFailures_NeverShortCircuits() {
        // Given
        tcp.otherwise(Outcome.ACCEPT);
        TestScheduler scheduler = new TestScheduler(newTester(config(4)));

        // When
        TieredResult result = scheduler.scheduleTests(CancellationToken.create(), null, 3);

        // Then
        assertTrue(result.lightweight().overallSuccess());
        assertFalse(result.shortCircuited());
        assertEquals(TestStrategy.ESCALATED_TO_COMPREHENSIVE, result.strategy());
    }

    @Test
    void testSchedule_FirstCycle_ShortCircuits() {
        // Given
        tcp.otherwise(Outcome.ACCEPT);
        TestScheduler scheduler = new TestScheduler(newTester(config(4)));

        // When
        TieredResult result = scheduler.scheduleTests(CancellationToken.create(), null, 0);

        // Then
        assertShortCircuited(result);
    }

    @Test
    void testSchedule_HealthyHistoryWithZeroFailures_RunsPeriodicAudit() {
        // Given
        tcp.otherwise(Outcome.ACCEPT);
        TestScheduler scheduler = new TestScheduler(newTester(config(4)));
        TieredResult previous = scheduler.scheduleTests(CancellationToken.create(), null, 0);
        assertShortCircuited(previous);

        // When
        TieredResult audited = scheduler.scheduleTests(CancellationToken.create(), previous, 0);

        // Then
        assertFalse(audited.shortCircuited());
        assertEquals(TestStrategy.ESCALATED_TO_COMPREHENSIVE, audited.strategy());
        assertTrue(audited.overallSuccess());
    }

    @Test
    void testSchedule_SameHistory_SameDecisionAcrossSchedulers() {
        // Given
        tcp.otherwise(Outcome.ACCEPT);
        TieredTester tester = newTester(config(4));
        TieredResult previous = new TestScheduler(tester).scheduleTests(CancellationToken.create(), null, 0);

        // When
        TieredResult first = new TestScheduler(tester).scheduleTests(CancellationToken.create(), previous, 10);
        TieredResult second = new TestScheduler(tester).scheduleTests(CancellationToken.create(), previous, 1);

        // Then
        assertFalse(first.shortCircuited());
        assertShortCircuited(second);
    }

    @Test
    void testMonitor_CountsFailuresAndResetsAfterForcedRecovery() {
        // Given: the whole network is down
        ConnectivityConfig config = config(2).withCircuitBreakerConfig(new CircuitBreakerConfig(100, RESET_TIMEOUT));
        dns.otherwise(ScriptedDnsResolver.Outcome.UNREACHABLE);
        http.otherwise(ScriptedHttpProber.REFUSED);
        TieredTester tester = newTester(config);
        ConnectivityMonitor monitor = new ConnectivityMonitor(new TestScheduler(tester));

        // When & Then: two failed cycles
        assertFalse(monitor.tick(CancellationToken.create()).overallSuccess());
        assertEquals(1, monitor.getConsecutiveFailures());
        assertFalse(monitor.tick(CancellationToken.create()).overallSuccess());
        assertEquals(2, monitor.getConsecutiveFailures());

        // When: the network recovers; the previous escalation failed so this cycle is forced
        tcp.otherwise(Outcome.ACCEPT);
        dns.otherwise(ScriptedDnsResolver.Outcome.RESOLVE);
        http.otherwise(200);
        TieredResult recovered = monitor.tick(CancellationToken.create());

        // Then
        assertTrue(recovered.lightweight().overallSuccess());
        assertEquals(TestStrategy.ESCALATED_TO_COMPREHENSIVE, recovered.strategy());
        assertTrue(recovered.overallSuccess());
        assertEquals(0, monitor.getConsecutiveFailures());
        assertTrue(monitor.getLastResult().isPresent());
    }
}
