package com.ryuqq.watchdog.application.suite;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.probe.ProbeRunner;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.DetailKeys;
import com.ryuqq.watchdog.core.model.Details;
import com.ryuqq.watchdog.core.model.ErrorType;
import com.ryuqq.watchdog.core.model.LightweightSuiteResult;
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
 * Lightweight tier: DNS 서버마다 TCP handshake 한 번.
 *
 * <p><strong>판정:</strong> 성공 수 &gt; 0 이고 성공 비율 ≥ 50%.</p>
 *
 * <p><strong>데드라인:</strong> connectionTimeout × 4 (재시도 여유 포함).</p>
 *
 * <p>빈 서버 항목은 "empty DNS server at index N" 오류를 가진 실패 프로브로 기록됩니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class LightweightTestSuite {

    private static final Logger log = LoggerFactory.getLogger(LightweightTestSuite.class);

    private final ConnectivityConfig config;
    private final ProbeRunner probeRunner;
    private final ProbeFanOut fanOut;
    private final Clock clock;

    public LightweightTestSuite(ConnectivityConfig config, ProbeRunner probeRunner, ExecutorService executor, Clock clock) {
        if (config == null || probeRunner == null) {
            throw new IllegalArgumentException("config and probeRunner cannot be null");
        }
        this.config = config;
        this.probeRunner = probeRunner;
        this.fanOut = new ProbeFanOut(executor, clock);
        this.clock = clock;
    }

    /**
     * lightweight 테스트 실행.
     *
     * @param token 호출자 취소 토큰
     * @return suite 결과 (프로브 실패는 결과 값으로 표현)
     * @throws IllegalArgumentException token이 null인 경우
     * @throws IllegalStateException DNS 서버가 하나도 설정되지 않은 경우
     * @throws com.ryuqq.watchdog.core.context.ProbeCancelledException 호출자 토큰이 취소된 경우
     */
    public LightweightSuiteResult run(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        List<String> servers = config.dnsServers();
        if (servers.isEmpty()) {
            throw new IllegalStateException("no DNS servers configured for testing");
        }
        token.throwIfCancelled();

        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        log.debug("Running lightweight connectivity tests against {} servers", servers.size());

        List<ProbeTask> tasks = new ArrayList<>(servers.size());
        for (int i = 0; i < servers.size(); i++) {
            String server = servers.get(i);
            if (server.isBlank()) {
                String error = "empty DNS server at index " + i;
                ProbeResult empty = ProbeResult.notExecuted(ProbeKind.TCP_HANDSHAKE, "", timestamp, error,
                    Details.builder()
                        .put(DetailKeys.SERVER, "")
                        .put(DetailKeys.ERROR, error)
                        .put(DetailKeys.ERROR_TYPE, ErrorType.OTHER.code())
                        .build());
                tasks.add(new ProbeTask(ProbeKind.TCP_HANDSHAKE, "", suiteToken -> empty));
            } else {
                tasks.add(new ProbeTask(ProbeKind.TCP_HANDSHAKE, server,
                    suiteToken -> probeRunner.tcpHandshake(suiteToken, server)));
            }
        }

        List<ProbeResult> results;
        try (CancellationToken suiteToken = token.childWithTimeout(config.lightweightDeadline())) {
            results = fanOut.run(token, suiteToken, tasks);
        }

        LightweightSuiteResult result = LightweightSuiteResult.aggregate(
            results, Duration.ofNanos(System.nanoTime() - start), timestamp);

        log.debug("Lightweight tests completed: success={}, successCount={}, failureCount={}, duration={}ms",
            result.overallSuccess(), result.successCount(), result.failureCount(), result.duration().toMillis());
        return result;
    }
}
