package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.tiered.TieredTester;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.ComprehensiveSuiteResult;
import com.ryuqq.watchdog.core.model.LightweightSuiteResult;
import com.ryuqq.watchdog.core.model.ProbeResult;
import com.ryuqq.watchdog.core.model.TestStrategy;
import com.ryuqq.watchdog.core.model.TieredResult;
import com.ryuqq.watchdog.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 소켓을 사용하는 계층형 테스트 시나리오.
 *
 * <p>"도달 가능"은 루프백 리스닝 소켓, "도달 불가"는 닫힌 루프백 포트입니다.</p>
 */
class EndToEndTieredTest {

    private static final ConnectivityConfig BASE = new ConnectivityConfig()
        .withConnectionTimeout(Duration.ofMillis(500))
        .withHttpTimeout(Duration.ofMillis(500))
        .withResolutionDomains(List.of("probe.test"))
        .withRetryPolicy(new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(20), 2.0, 0.0));

    @Test
    void 네_개_중_두_개_도달_가능하면_lightweight에서_종료() throws IOException {
        try (ServerSocket first = LoopbackPorts.listening();
             ServerSocket second = LoopbackPorts.listening()) {
            // given
            ConnectivityConfig config = BASE.withDnsServers(List.of(
                LoopbackPorts.address(first.getLocalPort()),
                LoopbackPorts.address(LoopbackPorts.closed()),
                LoopbackPorts.address(second.getLocalPort()),
                LoopbackPorts.address(LoopbackPorts.closed())));

            try (TieredTester tester = ConnectivityTesters.create(config)) {
                // when
                TieredResult result = tester.runTiered(CancellationToken.create());

                // then
                LightweightSuiteResult lightweight = result.lightweight();
                assertThat(lightweight.successCount()).isEqualTo(2);
                assertThat(lightweight.failureCount()).isEqualTo(2);
                assertThat(lightweight.overallSuccess()).isTrue();
                assertThat(lightweight.results()).extracting(ProbeResult::success)
                    .containsExactly(true, false, true, false);
                assertThat(result.strategy()).isEqualTo(TestStrategy.LIGHTWEIGHT_ONLY);
                assertThat(result.shortCircuited()).isTrue();
                assertThat(result.comprehensiveResult()).isEmpty();
            }
        }
    }

    @Test
    void 모두_도달_불가면_comprehensive로_에스컬레이션() throws IOException {
        // given
        ConnectivityConfig config = BASE
            .withDnsServers(List.of(
                LoopbackPorts.address(LoopbackPorts.closed()),
                LoopbackPorts.address(LoopbackPorts.closed()),
                LoopbackPorts.address(LoopbackPorts.closed())))
            .withHttpUrls(List.of("http://127.0.0.1:" + LoopbackPorts.closed() + "/"));

        try (TieredTester tester = ConnectivityTesters.create(config)) {
            // when
            TieredResult result = tester.runTiered(CancellationToken.create());

            // then
            assertThat(result.lightweight().overallSuccess()).isFalse();
            assertThat(result.strategy()).isEqualTo(TestStrategy.ESCALATED_TO_COMPREHENSIVE);
            assertThat(result.shortCircuited()).isFalse();
            assertThat(result.overallSuccess()).isFalse();

            ComprehensiveSuiteResult comprehensive = result.comprehensiveResult().orElseThrow();
            assertThat(comprehensive.escalatedFrom()).isEqualTo("lightweight");
            // TCP 실패 3회로 network breaker가 열려 DNS 프로브는 즉시 거부됨
            assertThat(tester.getNetworkBreaker().isOpen()).isTrue();
            assertThat(comprehensive.dnsResults()).allMatch(ProbeResult::circuitOpen);
            assertThat(comprehensive.httpResults()).noneMatch(ProbeResult::success);
        }
    }

    @Test
    void 에스컬레이션된_comprehensive는_DNS와_HTTP를_모두_검사() throws IOException {
        try (FakeDnsServer dns = new FakeDnsServer(Map.of("probe.test", "192.0.2.10"))) {
            // given: lightweight 대상은 UDP 응답기 주소라 TCP handshake는 거부되지만 DNS 질의는 성공
            ConnectivityConfig config = BASE
                .withDnsServers(List.of(dns.address()))
                .withHttpUrls(List.of())
                .withCircuitBreakerConfig(BASE.circuitBreakerConfig().withFailureThreshold(5));

            try (TieredTester tester = ConnectivityTesters.create(config)) {
                // when
                TieredResult result = tester.runTiered(CancellationToken.create(), true);

                // then
                ComprehensiveSuiteResult comprehensive = result.comprehensiveResult().orElseThrow();
                assertThat(comprehensive.dnsResults()).singleElement()
                    .satisfies(probe -> assertThat(probe.success()).isTrue());
                assertThat(result.strategy()).isEqualTo(TestStrategy.ESCALATED_TO_COMPREHENSIVE);
                assertThat(result.overallSuccess()).isTrue();
            }
        }
    }
}
