package com.ryuqq.watchdog.testkit.contract;

import com.ryuqq.watchdog.application.tiered.TieredTester;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.TestStrategy;
import com.ryuqq.watchdog.core.model.TieredResult;
import com.ryuqq.watchdog.testkit.ScriptedTcpConnector.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: tiered escalation.
 *
 * <ul>
 *   <li>Short-circuit: a passing lightweight tier without forcing yields lightweight_only</li>
 *   <li>Escalation: a failing lightweight tier is never short-circuited</li>
 *   <li>Forcing runs the comprehensive tier regardless of the lightweight outcome</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
class EscalationContractTest extends AbstractContractTest {

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4})
    void testTiered_LightweightPasses_ShortCircuits(int reachable) {
        // Given
        for (int i = 1; i <= reachable; i++) {
            tcp.script(target(i), Outcome.ACCEPT);
        }
        TieredTester tester = newTester(config(4));

        // When
        TieredResult result = tester.runTiered(CancellationToken.create());

        // Then
        assertShortCircuited(result);
        assertTrue(result.overallSuccess());
        assertEquals(0, dns.queries(target(1)), "comprehensive tier should not run");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1})
    void testTiered_LightweightFails_Escalates(int reachable) {
        // Given
        for (int i = 1; i <= reachable; i++) {
            tcp.script(target(i), Outcome.ACCEPT);
        }
        TieredTester tester = newTester(config(4));

        // When
        TieredResult result = tester.runTiered(CancellationToken.create());

        // Then
        assertFalse(result.lightweight().overallSuccess());
        assertEscalated(result);
    }

    @Test
    void testTiered_Forced_RunsComprehensiveEvenWhenLightweightPasses() {
        // Given
        tcp.otherwise(Outcome.ACCEPT);
        TieredTester tester = newTester(config(2));

        // When
        TieredResult result = tester.runTiered(CancellationToken.create(), true);

        // Then
        assertTrue(result.lightweight().overallSuccess());
        assertEquals(TestStrategy.ESCALATED_TO_COMPREHENSIVE, result.strategy());
        assertEscalated(result);
        assertTrue(result.overallSuccess());
    }

    @Test
    void testTiered_OverallSuccessFollowsComprehensiveAfterEscalation() {
        // Given: lightweight fails, every DNS server and URL is healthy
        TieredTester tester = newTester(config(2));

        // When
        TieredResult result = tester.runTiered(CancellationToken.create());

        // Then
        assertEquals(TestStrategy.ESCALATED_TO_COMPREHENSIVE, result.strategy());
        assertFalse(result.lightweight().overallSuccess());
        assertTrue(result.overallSuccess());
    }

    @Test
    void testSummary_EscalatedResult_ExposesBothTiers() {
        // Given
        TieredTester tester = newTester(config(2));
        TieredResult result = tester.runTiered(CancellationToken.create());

        // When
        Map<String, Object> summary = result.summary();

        // Then
        assertEquals("escalated_to_comprehensive", summary.get("strategy"));
        assertEquals(false, summary.get("short_circuited"));
        assertTrue(summary.get("lightweight") instanceof Map);
        assertTrue(summary.get("comprehensive") instanceof Map);
        Map<?, ?> comprehensive = (Map<?, ?>) summary.get("comprehensive");
        assertEquals(2, comprehensive.get("dns_tests"));
        assertEquals(2, comprehensive.get("http_tests"));
        assertEquals("lightweight", comprehensive.get("escalated_from"));
    }
}
