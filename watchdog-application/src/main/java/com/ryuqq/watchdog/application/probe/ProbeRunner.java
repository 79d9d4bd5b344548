package com.ryuqq.watchdog.application.probe;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.executor.ProbeAction;
import com.ryuqq.watchdog.core.model.DetailKeys;
import com.ryuqq.watchdog.core.model.Details;
import com.ryuqq.watchdog.core.model.ErrorType;
import com.ryuqq.watchdog.core.model.ProbeKind;
import com.ryuqq.watchdog.core.model.ProbeResult;
import com.ryuqq.watchdog.core.model.TargetAddress;
import com.ryuqq.watchdog.core.protection.CircuitBreaker;
import com.ryuqq.watchdog.core.protection.CircuitOpenException;
import com.ryuqq.watchdog.core.retry.RetryExecutor;
import com.ryuqq.watchdog.core.retry.RetryOutcome;
import com.ryuqq.watchdog.core.spi.DnsResolver;
import com.ryuqq.watchdog.core.spi.HttpProber;
import com.ryuqq.watchdog.core.spi.TcpConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 네트워크 프로브 실행기.
 *
 * <p><strong>실행 체인:</strong></p>
 * <pre>
 * CircuitBreaker.execute(
 *     RetryExecutor.execute(
 *         TcpConnector / DnsResolver / HttpProber
 *     )
 * )
 * </pre>
 *
 * <ul>
 *   <li>TCP handshake, DNS resolution: network breaker 공유</li>
 *   <li>HTTP reachability: http breaker 단독 사용 (한 쪽 실패가 다른 쪽을 열지 않음)</li>
 *   <li>재시도 전체가 Circuit Breaker에는 한 번의 성공/실패로 기록됨</li>
 * </ul>
 *
 * <p>네트워크 오류, Circuit Open, 취소 모두 실패한 {@link ProbeResult}로 기록되며 예외로 전파되지 않습니다.
 * 취소를 호출 수준 오류로 바꾸는 것은 suite의 책임입니다.</p>
 *
 * <p>여러 프로브 스레드가 하나의 인스턴스를 공유합니다 (Thread-safe).</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ProbeRunner {

    private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

    private final ConnectivityConfig config;
    private final TcpConnector tcpConnector;
    private final DnsResolver dnsResolver;
    private final HttpProber httpProber;
    private final CircuitBreaker networkBreaker;
    private final CircuitBreaker httpBreaker;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param config 연결성 설정
     * @param tcpConnector TCP 포트
     * @param dnsResolver DNS 포트
     * @param httpProber HTTP 포트
     * @param networkBreaker TCP/DNS 공유 Circuit Breaker
     * @param httpBreaker HTTP 전용 Circuit Breaker
     * @param retryExecutor 재시도 실행기
     * @param clock 결과 timestamp용 시계
     * @throws IllegalArgumentException 인자가 null이거나 두 breaker가 같은 인스턴스인 경우
     */
    public ProbeRunner(
        ConnectivityConfig config,
        TcpConnector tcpConnector,
        DnsResolver dnsResolver,
        HttpProber httpProber,
        CircuitBreaker networkBreaker,
        CircuitBreaker httpBreaker,
        RetryExecutor retryExecutor,
        Clock clock
    ) {
        if (config == null || tcpConnector == null || dnsResolver == null || httpProber == null) {
            throw new IllegalArgumentException("config and network ports cannot be null");
        }
        if (networkBreaker == null || httpBreaker == null) {
            throw new IllegalArgumentException("circuit breakers cannot be null");
        }
        if (networkBreaker == httpBreaker) {
            throw new IllegalArgumentException("network and http probes must not share a circuit breaker");
        }
        if (retryExecutor == null || clock == null) {
            throw new IllegalArgumentException("retryExecutor and clock cannot be null");
        }
        this.config = config;
        this.tcpConnector = tcpConnector;
        this.dnsResolver = dnsResolver;
        this.httpProber = httpProber;
        this.networkBreaker = networkBreaker;
        this.httpBreaker = httpBreaker;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * TCP handshake 프로브.
     *
     * <p>연결이 맺어지면 즉시 닫고 성공으로 기록합니다.</p>
     *
     * @param token 취소 토큰 (suite 토큰)
     * @param server 대상 {@code host:port} (포트 생략 시 53)
     * @return 프로브 결과
     */
    public ProbeResult tcpHandshake(CancellationToken token, String server) {
        requireToken(token);
        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        Duration timeout = config.connectionTimeout();

        Details.Builder details = Details.builder()
            .put(DetailKeys.SERVER, server)
            .put(DetailKeys.TIMEOUT_MS, timeout.toMillis());

        if (server == null || server.isBlank()) {
            return rejected(ProbeKind.TCP_HANDSHAKE, "", timestamp, details, "TCP handshake target server is empty");
        }
        TargetAddress address;
        try {
            address = TargetAddress.parse(server, TargetAddress.DNS_PORT);
        } catch (IllegalArgumentException e) {
            return rejected(ProbeKind.TCP_HANDSHAKE, server, timestamp, details,
                "invalid TCP handshake target: " + e.getMessage());
        }

        Attempt attempt = guarded(token, networkBreaker, ProbeKind.TCP_HANDSHAKE, () -> {
            token.throwIfCancelled();
            tcpConnector.connect(address.host(), address.port(), token.boundedTimeout(timeout), token);
        });

        return complete(ProbeKind.TCP_HANDSHAKE, server, start, timestamp, attempt, networkBreaker, details);
    }

    /**
     * DNS resolution 프로브.
     *
     * <p>설정된 도메인을 지정된 DNS 서버로 조회하고, 절반 이상이 1개 이상의 주소를 반환하면 성공입니다.
     * 도메인별 결과는 {@code resolution.<domain>} 키로 기록됩니다 (마지막 시도 기준).</p>
     *
     * @param token 취소 토큰 (suite 토큰)
     * @param dnsServer DNS 서버 {@code host:port}
     * @return 프로브 결과
     */
    public ProbeResult dnsResolution(CancellationToken token, String dnsServer) {
        requireToken(token);
        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        Duration timeout = config.connectionTimeout();
        List<String> domains = config.resolutionDomains();

        Details.Builder details = Details.builder()
            .put(DetailKeys.DNS_SERVER, dnsServer)
            .put(DetailKeys.DOMAINS, String.join(",", domains))
            .put(DetailKeys.TIMEOUT_MS, timeout.toMillis());

        if (dnsServer == null || dnsServer.isBlank()) {
            return rejected(ProbeKind.DNS_RESOLUTION, "", timestamp, details, "DNS server address is empty");
        }
        String resolverAddress;
        try {
            resolverAddress = TargetAddress.parse(dnsServer, TargetAddress.DNS_PORT).toString();
        } catch (IllegalArgumentException e) {
            return rejected(ProbeKind.DNS_RESOLUTION, dnsServer, timestamp, details,
                "invalid DNS server address: " + e.getMessage());
        }

        Map<String, String> resolutions = new LinkedHashMap<>();
        AtomicInteger successful = new AtomicInteger();

        Attempt attempt = guarded(token, networkBreaker, ProbeKind.DNS_RESOLUTION, () -> {
            resolutions.clear();
            successful.set(0);
            IOException lastError = null;
            for (String domain : domains) {
                token.throwIfCancelled();
                try {
                    List<String> addresses = dnsResolver.resolve(resolverAddress, domain, token.boundedTimeout(timeout));
                    if (addresses != null && !addresses.isEmpty()) {
                        successful.incrementAndGet();
                        resolutions.put(domain, "resolved to " + addresses.size() + " IPs");
                    } else {
                        resolutions.put(domain, "no IPs returned");
                    }
                } catch (IOException e) {
                    lastError = e;
                    resolutions.put(domain, "failed: " + describe(e));
                }
            }
            if ((double) successful.get() / domains.size() < 0.5) {
                throw new InsufficientResolutionException(successful.get(), domains.size(), lastError);
            }
        });

        details.put(DetailKeys.SUCCESSFUL_RESOLUTIONS, successful.get());
        resolutions.forEach((domain, outcome) -> details.put(DetailKeys.RESOLUTION_PREFIX + domain, outcome));

        return complete(ProbeKind.DNS_RESOLUTION, dnsServer, start, timestamp, attempt, networkBreaker, details);
    }

    /**
     * HTTP reachability 프로브.
     *
     * <p>HEAD 요청의 상태 코드가 400 미만이면 성공입니다.</p>
     *
     * @param token 취소 토큰 (suite 토큰)
     * @param url 대상 URL (http/https)
     * @return 프로브 결과
     */
    public ProbeResult httpReachability(CancellationToken token, String url) {
        requireToken(token);
        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        Duration timeout = config.httpTimeout();

        Details.Builder details = Details.builder()
            .put(DetailKeys.HTTP_HOST, url)
            .put(DetailKeys.TIMEOUT_MS, timeout.toMillis());

        URI uri;
        try {
            uri = parseHttpUri(url);
        } catch (IllegalArgumentException e) {
            return rejected(ProbeKind.HTTP_CONNECTIVITY, url == null ? "" : url, timestamp, details,
                "invalid URL format: " + e.getMessage());
        }

        AtomicInteger lastStatus = new AtomicInteger(-1);
        Attempt attempt = guarded(token, httpBreaker, ProbeKind.HTTP_CONNECTIVITY, () -> {
            token.throwIfCancelled();
            int status = httpProber.head(uri, config.userAgent(), token.boundedTimeout(timeout), token);
            lastStatus.set(status);
            if (status >= 400) {
                throw new UnexpectedStatusException(status);
            }
        });

        if (lastStatus.get() >= 0) {
            details.put(DetailKeys.STATUS_CODE, lastStatus.get());
            details.put(DetailKeys.HOST, uri.getAuthority());
        }

        return complete(ProbeKind.HTTP_CONNECTIVITY, url, start, timestamp, attempt, httpBreaker, details);
    }

    public CircuitBreaker getNetworkBreaker() {
        return networkBreaker;
    }

    public CircuitBreaker getHttpBreaker() {
        return httpBreaker;
    }

    public ConnectivityConfig getConfig() {
        return config;
    }

    // ============================================================
    // Private Methods
    // ============================================================

    private Attempt guarded(CancellationToken token, CircuitBreaker breaker, ProbeKind kind, ProbeAction action) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            breaker.execute(() -> {
                RetryOutcome outcome = retryExecutor.execute(token, action, config.retryPolicy(), kind.code());
                attempts.set(outcome.attemptsUsed());
                outcome.rethrowIfFailed();
            });
            return new Attempt(attempts.get(), null, false);
        } catch (CircuitOpenException e) {
            return new Attempt(0, e, true);
        } catch (Exception e) {
            return new Attempt(attempts.get(), e, false);
        }
    }

    private ProbeResult complete(
        ProbeKind kind,
        String target,
        long startNanos,
        Instant timestamp,
        Attempt attempt,
        CircuitBreaker breaker,
        Details.Builder details
    ) {
        details.put(DetailKeys.CIRCUIT_OPEN, attempt.circuitOpen())
            .put(DetailKeys.RETRY_COUNT, attempt.retryCount())
            .put(DetailKeys.CIRCUIT_STATE, breaker.getState().label());

        String error = null;
        if (attempt.failure() != null) {
            error = describe(attempt.failure());
            details.put(DetailKeys.ERROR, error)
                .put(DetailKeys.ERROR_TYPE, ErrorClassifier.classify(attempt.failure()).code());
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        ProbeResult result = new ProbeResult(kind, target, attempt.failure() == null, duration, timestamp,
            attempt.retryCount(), attempt.circuitOpen(), error, details.build());

        if (result.success()) {
            log.debug("{} probe to {} succeeded (duration={}ms, retries={}, circuitState={})",
                kind.code(), target, duration.toMillis(), result.retryCount(), breaker.getState().label());
        } else {
            log.debug("{} probe to {} failed (duration={}ms, retries={}, circuitOpen={}, error={})",
                kind.code(), target, duration.toMillis(), result.retryCount(), result.circuitOpen(), error);
        }
        return result;
    }

    private static ProbeResult rejected(
        ProbeKind kind,
        String target,
        Instant timestamp,
        Details.Builder details,
        String error
    ) {
        details.put(DetailKeys.ERROR, error).put(DetailKeys.ERROR_TYPE, ErrorType.OTHER.code());
        log.debug("{} probe skipped: {}", kind.code(), error);
        return ProbeResult.notExecuted(kind, target, timestamp, error, details.build());
    }

    private static URI parseHttpUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("HTTP target is empty");
        }
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("unsupported scheme in " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host in " + url);
        }
        return uri;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void requireToken(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
    }

    private record Attempt(int attemptsUsed, Exception failure, boolean circuitOpen) {

        int retryCount() {
            return Math.max(0, attemptsUsed - 1);
        }
    }
}
