package com.ryuqq.watchdog.application.suite;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.probe.ProbeRunner;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.ComprehensiveSuiteResult;
import com.ryuqq.watchdog.core.model.ProbeKind;
import com.ryuqq.watchdog.core.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Comprehensive tier: DNS resolution + HTTP reachability.
 *
 * <p>DNS 프로브(서버당 1개)와 HTTP 프로브(URL당 1개)를 한 번에 제출하여 두 그룹이 서로 병렬로 실행되고,
 * 하나의 join barrier에서 함께 기다립니다.</p>
 *
 * <p><strong>판정:</strong> 전체 테스트 중 성공 비율 ≥ 60% (테스트가 하나 이상 필요).</p>
 *
 * <p><strong>데드라인:</strong> 2 × (connectionTimeout + httpTimeout).</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ComprehensiveTestSuite {

    private static final Logger log = LoggerFactory.getLogger(ComprehensiveTestSuite.class);

    private final ConnectivityConfig config;
    private final ProbeRunner probeRunner;
    private final ProbeFanOut fanOut;
    private final Clock clock;

    public ComprehensiveTestSuite(ConnectivityConfig config, ProbeRunner probeRunner, ExecutorService executor, Clock clock) {
        if (config == null || probeRunner == null) {
            throw new IllegalArgumentException("config and probeRunner cannot be null");
        }
        this.config = config;
        this.probeRunner = probeRunner;
        this.fanOut = new ProbeFanOut(executor, clock);
        this.clock = clock;
    }

    /**
     * 단독 실행 (escalatedFrom 없음).
     *
     * @param token 호출자 취소 토큰
     * @return suite 결과
     */
    public ComprehensiveSuiteResult run(CancellationToken token) {
        return runEscalated(token, null);
    }

    /**
     * 에스컬레이션 실행.
     *
     * @param token 호출자 취소 토큰
     * @param escalatedFrom 에스컬레이션을 일으킨 tier (단독 실행이면 null)
     * @return suite 결과 (프로브 실패는 결과 값으로 표현)
     * @throws IllegalArgumentException token이 null인 경우
     * @throws IllegalStateException DNS 서버와 HTTP URL이 모두 비어 있는 경우
     * @throws com.ryuqq.watchdog.core.context.ProbeCancelledException 호출자 토큰이 취소된 경우
     */
    public ComprehensiveSuiteResult runEscalated(CancellationToken token, String escalatedFrom) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        List<String> dnsServers = config.dnsServers();
        List<String> httpUrls = config.httpUrls();
        if (dnsServers.isEmpty() && httpUrls.isEmpty()) {
            throw new IllegalStateException("no DNS servers or HTTP hosts configured for testing");
        }
        token.throwIfCancelled();

        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        log.debug("Running comprehensive connectivity tests (dnsServers={}, httpHosts={}, escalatedFrom={})",
            dnsServers.size(), httpUrls.size(), escalatedFrom);

        List<ProbeTask> tasks = new ArrayList<>(dnsServers.size() + httpUrls.size());
        for (String server : dnsServers) {
            tasks.add(new ProbeTask(ProbeKind.DNS_RESOLUTION, server,
                suiteToken -> probeRunner.dnsResolution(suiteToken, server)));
        }
        for (String url : httpUrls) {
            tasks.add(new ProbeTask(ProbeKind.HTTP_CONNECTIVITY, url,
                suiteToken -> probeRunner.httpReachability(suiteToken, url)));
        }

        List<ProbeResult> results;
        try (CancellationToken suiteToken = token.childWithTimeout(config.comprehensiveDeadline())) {
            results = fanOut.run(token, suiteToken, tasks);
        }

        List<ProbeResult> dnsResults = results.subList(0, dnsServers.size());
        List<ProbeResult> httpResults = results.subList(dnsServers.size(), results.size());

        ComprehensiveSuiteResult result = ComprehensiveSuiteResult.aggregate(
            dnsResults, httpResults, escalatedFrom, Duration.ofNanos(System.nanoTime() - start), timestamp);

        log.debug("Comprehensive tests completed: success={}, successCount={}, failureCount={}, duration={}ms",
            result.overallSuccess(), result.successCount(), result.failureCount(), result.duration().toMillis());
        return result;
    }
}
