package com.ryuqq.watchdog.application.tiered;

import com.ryuqq.watchdog.application.suite.ComprehensiveTestSuite;
import com.ryuqq.watchdog.application.suite.LightweightTestSuite;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.ComprehensiveSuiteResult;
import com.ryuqq.watchdog.core.model.LightweightSuiteResult;
import com.ryuqq.watchdog.core.model.TestStrategy;
import com.ryuqq.watchdog.core.model.TieredResult;
import com.ryuqq.watchdog.core.protection.CircuitBreakerConfig;
import com.ryuqq.watchdog.core.protection.ConsecutiveFailureCircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.ryuqq.watchdog.application.tiered.TieredFixtures.NOW;
import static com.ryuqq.watchdog.application.tiered.TieredFixtures.comprehensive;
import static com.ryuqq.watchdog.application.tiered.TieredFixtures.lightweight;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * TieredTester 에스컬레이션 테스트.
 *
 * <ul>
 *   <li>lightweight 성공 시 short-circuit</li>
 *   <li>lightweight 실패 또는 강제 시 comprehensive 에스컬레이션</li>
 *   <li>comprehensive 오류 시 lightweight fallback</li>
 *   <li>취소와 구조적 오류 전파</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class TieredTesterTest {

    @Mock
    private LightweightTestSuite lightweightSuite;

    @Mock
    private ComprehensiveTestSuite comprehensiveSuite;

    private TieredTester tester;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        tester = new TieredTester(lightweightSuite, comprehensiveSuite,
            new ConsecutiveFailureCircuitBreaker("network", new CircuitBreakerConfig()),
            new ConsecutiveFailureCircuitBreaker("http", new CircuitBreakerConfig()),
            Clock.fixed(NOW, ZoneOffset.UTC));
        token = CancellationToken.create();
    }

    @Test
    void lightweight_성공이면_comprehensive_없이_종료() {
        // given
        LightweightSuiteResult light = lightweight(3, 1);
        when(lightweightSuite.run(token)).thenReturn(light);

        // when
        TieredResult result = tester.runTiered(token);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.LIGHTWEIGHT_ONLY);
        assertThat(result.shortCircuited()).isTrue();
        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.lightweight()).isSameAs(light);
        assertThat(result.comprehensiveResult()).isEmpty();
        assertThat(result.timestamp()).isEqualTo(NOW);
        verifyNoInteractions(comprehensiveSuite);
    }

    @Test
    void lightweight_실패면_comprehensive로_에스컬레이션() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(1, 3));
        ComprehensiveSuiteResult full = comprehensive(4, 1);
        when(comprehensiveSuite.runEscalated(token, "lightweight")).thenReturn(full);

        // when
        TieredResult result = tester.runTiered(token);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.ESCALATED_TO_COMPREHENSIVE);
        assertThat(result.shortCircuited()).isFalse();
        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.comprehensiveResult()).containsSame(full);
    }

    @Test
    void 에스컬레이션_결과가_실패면_전체_실패() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(0, 4));
        when(comprehensiveSuite.runEscalated(token, "lightweight")).thenReturn(comprehensive(1, 4));

        // when
        TieredResult result = tester.runTiered(token);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.ESCALATED_TO_COMPREHENSIVE);
        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void 강제_실행이면_lightweight_성공이어도_에스컬레이션() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(4, 0));
        when(comprehensiveSuite.runEscalated(token, "lightweight")).thenReturn(comprehensive(2, 3));

        // when
        TieredResult result = tester.runTiered(token, true);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.ESCALATED_TO_COMPREHENSIVE);
        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.lightweight().overallSuccess()).isTrue();
    }

    @Test
    void comprehensive_오류면_lightweight_결과로_fallback() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(1, 3));
        when(comprehensiveSuite.runEscalated(token, "lightweight"))
            .thenThrow(new IllegalStateException("probe executor is shut down"));

        // when
        TieredResult result = tester.runTiered(token);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.LIGHTWEIGHT_FALLBACK);
        assertThat(result.shortCircuited()).isFalse();
        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.comprehensiveResult()).isEmpty();
    }

    @Test
    void 강제_실행_중_comprehensive_오류면_lightweight_판정을_따름() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(4, 0));
        when(comprehensiveSuite.runEscalated(token, "lightweight"))
            .thenThrow(new IllegalStateException("no DNS servers or HTTP hosts configured for testing"));

        // when
        TieredResult result = tester.runTiered(token, true);

        // then
        assertThat(result.strategy()).isEqualTo(TestStrategy.LIGHTWEIGHT_FALLBACK);
        assertThat(result.overallSuccess()).isTrue();
    }

    @Test
    void comprehensive_중_취소되면_취소_예외_전파() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(0, 4));
        when(comprehensiveSuite.runEscalated(token, "lightweight"))
            .thenThrow(ProbeCancelledException.deadlineExceeded());

        // when & then
        assertThatThrownBy(() -> tester.runTiered(token))
            .isInstanceOfSatisfying(ProbeCancelledException.class, e -> assertThat(e.isDeadlineExceeded()).isTrue());
    }

    @Test
    void 토큰이_취소된_뒤의_comprehensive_오류는_fallback이_아닌_취소로_전파() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(0, 4));
        when(comprehensiveSuite.runEscalated(token, "lightweight")).thenAnswer(invocation -> {
            token.cancel();
            throw new IllegalStateException("probe executor is shut down");
        });

        // when & then
        assertThatThrownBy(() -> tester.runTiered(token)).isInstanceOf(ProbeCancelledException.class);
    }

    @Test
    void lightweight_구조적_오류는_그대로_전파() {
        // given
        when(lightweightSuite.run(token)).thenThrow(new IllegalStateException("no DNS servers configured for testing"));

        // when & then
        assertThatThrownBy(() -> tester.runTiered(token))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("no DNS servers configured for testing");
        verifyNoInteractions(comprehensiveSuite);
    }

    @Test
    void null_토큰은_거부() {
        assertThatThrownBy(() -> tester.runTiered(null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(lightweightSuite, comprehensiveSuite);
    }

    @Test
    void 단일_tier_실행은_각_suite에_위임() {
        // given
        when(lightweightSuite.run(token)).thenReturn(lightweight(2, 2));
        ComprehensiveSuiteResult full = comprehensive(3, 0);
        when(comprehensiveSuite.run(token)).thenReturn(full);

        // when
        LightweightSuiteResult light = tester.runLightweight(token);
        ComprehensiveSuiteResult comp = tester.runComprehensive(token);

        // then
        assertThat(light.successCount()).isEqualTo(2);
        assertThat(comp).isSameAs(full);
        verify(comprehensiveSuite).run(token);
    }
}
