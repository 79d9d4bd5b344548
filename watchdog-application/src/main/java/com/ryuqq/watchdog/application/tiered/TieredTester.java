package com.ryuqq.watchdog.application.tiered;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.probe.ProbeRunner;
import com.ryuqq.watchdog.application.suite.ComprehensiveTestSuite;
import com.ryuqq.watchdog.application.suite.LightweightTestSuite;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.ComprehensiveSuiteResult;
import com.ryuqq.watchdog.core.model.LightweightSuiteResult;
import com.ryuqq.watchdog.core.model.TieredResult;
import com.ryuqq.watchdog.core.protection.CircuitBreaker;
import com.ryuqq.watchdog.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.watchdog.core.retry.RetryExecutor;
import com.ryuqq.watchdog.core.spi.DnsResolver;
import com.ryuqq.watchdog.core.spi.HttpProber;
import com.ryuqq.watchdog.core.spi.TcpConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 계층형 연결성 테스터.
 *
 * <p><strong>에스컬레이션 상태 머신:</strong></p>
 * <pre>
 * NotStarted → LightweightRan
 *                 ├─ lightweight 성공 &amp;&amp; !force ─► LIGHTWEIGHT_ONLY (short-circuit)
 *                 └─ 그 외 ─► Escalating
 *                               ├─ comprehensive 완료 ─► ESCALATED_TO_COMPREHENSIVE
 *                               └─ comprehensive 실행 오류 ─► LIGHTWEIGHT_FALLBACK
 * </pre>
 *
 * <ul>
 *   <li>lightweight 실행 오류(구조적 오류, 취소)는 호출 전체를 중단시킵니다.</li>
 *   <li>comprehensive 실행 오류는 lightweight 결과로 fallback 합니다. 단, 호출자 토큰 취소는 전파합니다.</li>
 *   <li>totalDuration은 경로와 관계없이 호출 진입부터 반환까지의 시간입니다.</li>
 * </ul>
 *
 * <p>테스터는 Circuit Breaker 두 개(network, http)와 프로브 executor를 소유합니다.
 * 사용이 끝나면 {@link #close()}로 executor를 종료해야 합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class TieredTester implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredTester.class);

    public static final String NETWORK_BREAKER = "network";
    public static final String HTTP_BREAKER = "http";

    private final LightweightTestSuite lightweightSuite;
    private final ComprehensiveTestSuite comprehensiveSuite;
    private final CircuitBreaker networkBreaker;
    private final CircuitBreaker httpBreaker;
    private final ExecutorService ownedExecutor;
    private final Clock clock;

    /**
     * 시스템 시계를 사용하는 테스터 생성.
     */
    public TieredTester(ConnectivityConfig config, TcpConnector tcpConnector, DnsResolver dnsResolver, HttpProber httpProber) {
        this(config, tcpConnector, dnsResolver, httpProber, Clock.systemUTC());
    }

    /**
     * 테스터 생성.
     *
     * @param config 연결성 설정
     * @param tcpConnector TCP 포트
     * @param dnsResolver DNS 포트
     * @param httpProber HTTP 포트
     * @param clock Circuit Breaker 및 결과 timestamp용 시계
     */
    public TieredTester(
        ConnectivityConfig config,
        TcpConnector tcpConnector,
        DnsResolver dnsResolver,
        HttpProber httpProber,
        Clock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.networkBreaker = new ConsecutiveFailureCircuitBreaker(NETWORK_BREAKER, config.circuitBreakerConfig(), clock);
        this.httpBreaker = new ConsecutiveFailureCircuitBreaker(HTTP_BREAKER, config.circuitBreakerConfig(), clock);
        this.ownedExecutor = Executors.newCachedThreadPool(new ProbeThreadFactory());

        ProbeRunner probeRunner = new ProbeRunner(config, tcpConnector, dnsResolver, httpProber,
            networkBreaker, httpBreaker, new RetryExecutor(), clock);
        this.lightweightSuite = new LightweightTestSuite(config, probeRunner, ownedExecutor, clock);
        this.comprehensiveSuite = new ComprehensiveTestSuite(config, probeRunner, ownedExecutor, clock);
    }

    /**
     * 미리 구성된 suite로 테스터 생성 (executor는 호출자 소유).
     */
    TieredTester(
        LightweightTestSuite lightweightSuite,
        ComprehensiveTestSuite comprehensiveSuite,
        CircuitBreaker networkBreaker,
        CircuitBreaker httpBreaker,
        Clock clock
    ) {
        this.lightweightSuite = lightweightSuite;
        this.comprehensiveSuite = comprehensiveSuite;
        this.networkBreaker = networkBreaker;
        this.httpBreaker = httpBreaker;
        this.ownedExecutor = null;
        this.clock = clock;
    }

    /**
     * 기본 진입점 ({@code runTiered(token, false)}).
     */
    public TieredResult runTiered(CancellationToken token) {
        return runTiered(token, false);
    }

    /**
     * 계층형 테스트 실행.
     *
     * @param token 호출자 취소 토큰
     * @param forceComprehensive true면 lightweight 결과와 관계없이 comprehensive 실행
     * @return 계층형 결과
     * @throws IllegalArgumentException token이 null인 경우
     * @throws IllegalStateException lightweight 대상이 설정되지 않은 경우
     * @throws ProbeCancelledException 호출자 토큰이 취소된 경우
     */
    public TieredResult runTiered(CancellationToken token, boolean forceComprehensive) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        Instant timestamp = clock.instant();
        long start = System.nanoTime();

        LightweightSuiteResult lightweight = lightweightSuite.run(token);

        boolean needComprehensive = forceComprehensive || !lightweight.overallSuccess();
        if (!needComprehensive) {
            log.debug("Lightweight tests passed, skipping comprehensive tests (successCount={}/{})",
                lightweight.successCount(), lightweight.results().size());
            return TieredResult.lightweightOnly(lightweight, elapsedSince(start), timestamp);
        }

        log.debug("Escalating to comprehensive tests (lightweightSuccess={}, forced={})",
            lightweight.overallSuccess(), forceComprehensive);

        ComprehensiveSuiteResult comprehensive;
        try {
            comprehensive = comprehensiveSuite.runEscalated(token, ComprehensiveSuiteResult.ESCALATED_FROM_LIGHTWEIGHT);
        } catch (ProbeCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                throw token.cancellationError();
            }
            log.warn("Comprehensive tests failed during escalation, falling back to lightweight result: {}",
                e.getMessage(), e);
            return TieredResult.fallback(lightweight, elapsedSince(start), timestamp);
        }

        TieredResult result = TieredResult.escalated(lightweight, comprehensive, elapsedSince(start), timestamp);
        log.debug("Tiered tests completed: strategy={}, success={}, duration={}ms",
            result.strategy().code(), result.overallSuccess(), result.totalDuration().toMillis());
        return result;
    }

    /**
     * lightweight tier만 실행.
     */
    public LightweightSuiteResult runLightweight(CancellationToken token) {
        return lightweightSuite.run(token);
    }

    /**
     * comprehensive tier만 실행 (escalatedFrom 없음).
     */
    public ComprehensiveSuiteResult runComprehensive(CancellationToken token) {
        return comprehensiveSuite.run(token);
    }

    /**
     * TCP/DNS 공유 Circuit Breaker.
     */
    public CircuitBreaker getNetworkBreaker() {
        return networkBreaker;
    }

    /**
     * HTTP Circuit Breaker.
     */
    public CircuitBreaker getHttpBreaker() {
        return httpBreaker;
    }

    /**
     * 소유한 프로브 executor 종료.
     *
     * <p>실행 중인 프로브는 인터럽트됩니다. 종료 후 호출하면 suite가 {@link IllegalStateException}을 던집니다.</p>
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class ProbeThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "connectivity-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
