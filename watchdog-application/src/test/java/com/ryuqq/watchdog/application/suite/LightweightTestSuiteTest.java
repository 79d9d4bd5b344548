package com.ryuqq.watchdog.application.suite;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.probe.ProbeRunner;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.DetailKeys;
import com.ryuqq.watchdog.core.model.LightweightSuiteResult;
import com.ryuqq.watchdog.core.model.ProbeKind;
import com.ryuqq.watchdog.core.model.ProbeResult;
import com.ryuqq.watchdog.core.protection.CircuitBreakerConfig;
import com.ryuqq.watchdog.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.watchdog.core.retry.RetryExecutor;
import com.ryuqq.watchdog.core.retry.RetryPolicy;
import com.ryuqq.watchdog.core.spi.DnsResolver;
import com.ryuqq.watchdog.core.spi.HttpProber;
import com.ryuqq.watchdog.core.spi.TcpConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * LightweightTestSuite 테스트.
 *
 * <ul>
 *   <li>50% 규칙 집계</li>
 *   <li>입력 순서 유지</li>
 *   <li>구조적 오류와 취소 전파</li>
 *   <li>suite 데드라인 초과 시 timeout 실패 기록</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class LightweightTestSuiteTest {

    @Mock
    private TcpConnector tcpConnector;

    @Mock
    private DnsResolver dnsResolver;

    @Mock
    private HttpProber httpProber;

    private ExecutorService executor;
    private ConnectivityConfig baseConfig;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        baseConfig = new ConnectivityConfig()
            .withConnectionTimeout(Duration.ofMillis(100))
            .withRetryPolicy(new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2), 2.0, 0.0))
            .withCircuitBreakerConfig(new CircuitBreakerConfig(10, Duration.ofMinutes(1)));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void 네_개_중_두_개_성공이면_전체_성공이고_순서_유지() throws Exception {
        // given
        List<String> servers = List.of("10.0.0.1:53", "10.0.0.2:53", "10.0.0.3:53", "10.0.0.4:53");
        refuse(Set.of("10.0.0.3", "10.0.0.4"));
        LightweightTestSuite suite = suite(baseConfig.withDnsServers(servers));

        // when
        LightweightSuiteResult result = suite.run(CancellationToken.create());

        // then
        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isEqualTo(2);
        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.results()).extracting(ProbeResult::target).containsExactlyElementsOf(servers);
        assertThat(result.results()).extracting(ProbeResult::success).containsExactly(true, true, false, false);
        assertThat(result.results()).allMatch(r -> r.kind() == ProbeKind.TCP_HANDSHAKE);
    }

    @Test
    void 네_개_중_한_개_성공이면_전체_실패() throws Exception {
        // given
        refuse(Set.of("10.0.0.2", "10.0.0.3", "10.0.0.4"));
        LightweightTestSuite suite = suite(baseConfig.withDnsServers(
            List.of("10.0.0.1", "10.0.0.2", "10.0.0.3", "10.0.0.4")));

        // when
        LightweightSuiteResult result = suite.run(CancellationToken.create());

        // then
        assertThat(result.successCount()).isEqualTo(1);
        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void 빈_서버_항목은_인덱스가_담긴_실패로_기록() {
        // given
        LightweightTestSuite suite = suite(baseConfig.withDnsServers(List.of("10.0.0.1", "", "10.0.0.2", "10.0.0.5")));

        // when
        LightweightSuiteResult result = suite.run(CancellationToken.create());

        // then
        ProbeResult empty = result.results().get(1);
        assertThat(empty.success()).isFalse();
        assertThat(empty.error()).isEqualTo("empty DNS server at index 1");
        assertThat(empty.details().getString(DetailKeys.SERVER)).contains("");
        assertThat(result.successCount()).isEqualTo(3);
        assertThat(result.overallSuccess()).isTrue();
    }

    @Test
    void DNS_서버가_없으면_구조적_오류() {
        LightweightTestSuite suite = suite(baseConfig.withDnsServers(List.of()));

        assertThatThrownBy(() -> suite.run(CancellationToken.create()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("no DNS servers configured for testing");
        verifyNoInteractions(tcpConnector);
    }

    @Test
    void null_토큰은_거부() {
        LightweightTestSuite suite = suite(baseConfig);

        assertThatThrownBy(() -> suite.run(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 호출자_토큰이_취소되면_취소_예외_전파() {
        // given
        LightweightTestSuite suite = suite(baseConfig);
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // when & then
        assertThatThrownBy(() -> suite.run(token)).isInstanceOf(ProbeCancelledException.class);
        verifyNoInteractions(tcpConnector);
    }

    @Test
    void suite_데드라인을_넘긴_프로브는_timeout_실패로_기록() throws Exception {
        // given
        ConnectivityConfig config = baseConfig
            .withConnectionTimeout(Duration.ofMillis(50))
            .withDnsServers(List.of("10.0.0.1", "10.0.0.2"));
        doAnswer(invocation -> {
            CancellationToken probeToken = invocation.getArgument(3);
            probeToken.sleep(Duration.ofSeconds(10));
            return null;
        }).when(tcpConnector).connect(anyString(), anyInt(), any(Duration.class), any(CancellationToken.class));
        LightweightTestSuite suite = suite(config);
        long start = System.nanoTime();

        // when
        LightweightSuiteResult result = suite.run(CancellationToken.create());

        // then
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5000);
        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.results()).hasSize(2).allSatisfy(probe -> {
            assertThat(probe.success()).isFalse();
            assertThat(probe.details().getString(DetailKeys.ERROR_TYPE)).contains("timeout");
        });
    }

    // ============================================================
    // Helper Methods
    // ============================================================

    private LightweightTestSuite suite(ConnectivityConfig config) {
        ProbeRunner runner = new ProbeRunner(config, tcpConnector, dnsResolver, httpProber,
            new ConsecutiveFailureCircuitBreaker("network", config.circuitBreakerConfig()),
            new ConsecutiveFailureCircuitBreaker("http", config.circuitBreakerConfig()),
            new RetryExecutor(), Clock.systemUTC());
        return new LightweightTestSuite(config, runner, executor, Clock.systemUTC());
    }

    private void refuse(Set<String> hosts) throws Exception {
        doAnswer(invocation -> {
            String host = invocation.getArgument(0);
            if (hosts.contains(host)) {
                throw new ConnectException("Connection refused: " + host);
            }
            return null;
        }).when(tcpConnector).connect(anyString(), anyInt(), any(Duration.class), any(CancellationToken.class));
    }
}
