package com.ryuqq.watchdog.application.config;

import com.ryuqq.watchdog.core.model.TargetAddress;
import com.ryuqq.watchdog.core.protection.CircuitBreakerConfig;
import com.ryuqq.watchdog.core.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 연결성 테스트 설정 (불변).
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>connectionTimeout: 5초 (TCP handshake, DNS 질의)</li>
 *   <li>httpTimeout: 10초 (HTTP HEAD)</li>
 *   <li>dnsServers: 1.1.1.1, 8.8.8.8, 9.9.9.9, 208.67.222.222 (포트 53)</li>
 *   <li>httpUrls: https://google.com, https://cloudflare.com, https://amazon.com</li>
 *   <li>resolutionDomains: google.com, cloudflare.com, amazon.com</li>
 * </ul>
 *
 * <p>DNS 서버 주소는 {@code host:port} 형태로 정규화됩니다. 빈 항목은 그대로 유지되어
 * lightweight suite에서 실패한 프로브로 기록됩니다.</p>
 *
 * @param connectionTimeout TCP/DNS 프로브 제한 시간
 * @param httpTimeout HTTP 프로브 제한 시간
 * @param dnsServers DNS 서버 주소 목록 (lightweight 대상이자 comprehensive DNS 대상)
 * @param httpUrls HTTP 도달성 확인 대상 URL 목록
 * @param resolutionDomains DNS 프로브가 조회할 도메인 목록
 * @param userAgent HTTP 요청 User-Agent
 * @param retryPolicy 프로브 재시도 정책
 * @param circuitBreakerConfig 프로브 종류별 Circuit Breaker 설정
 * @author Watchdog Team
 * @since 1.0.0
 */
public record ConnectivityConfig(
    Duration connectionTimeout,
    Duration httpTimeout,
    List<String> dnsServers,
    List<String> httpUrls,
    List<String> resolutionDomains,
    String userAgent,
    RetryPolicy retryPolicy,
    CircuitBreakerConfig circuitBreakerConfig
) {

    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);
    public static final List<String> DEFAULT_DNS_SERVERS = List.of("1.1.1.1", "8.8.8.8", "9.9.9.9", "208.67.222.222");
    public static final List<String> DEFAULT_HTTP_URLS =
        List.of("https://google.com", "https://cloudflare.com", "https://amazon.com");
    public static final List<String> DEFAULT_RESOLUTION_DOMAINS = List.of("google.com", "cloudflare.com", "amazon.com");
    public static final String DEFAULT_USER_AGENT = "Watchdog-ConnectivityTester/1.0";

    /**
     * 기본 설정.
     */
    public ConnectivityConfig() {
        this(DEFAULT_CONNECTION_TIMEOUT, DEFAULT_HTTP_TIMEOUT, DEFAULT_DNS_SERVERS, DEFAULT_HTTP_URLS,
            DEFAULT_RESOLUTION_DOMAINS, DEFAULT_USER_AGENT, new RetryPolicy(), new CircuitBreakerConfig());
    }

    /**
     * Compact Constructor (검증 및 정규화).
     *
     * @throws IllegalArgumentException 필수 값이 없거나, 타임아웃이 양수가 아니거나, 빈 도메인이 있는 경우
     */
    public ConnectivityConfig {
        requirePositive("connectionTimeout", connectionTimeout);
        requirePositive("httpTimeout", httpTimeout);
        if (dnsServers == null || httpUrls == null || resolutionDomains == null) {
            throw new IllegalArgumentException("target lists cannot be null");
        }
        if (resolutionDomains.isEmpty()) {
            throw new IllegalArgumentException("resolutionDomains cannot be empty");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (circuitBreakerConfig == null) {
            throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
        }

        dnsServers = normalizeDnsServers(dnsServers);
        httpUrls = trimAll(httpUrls);
        resolutionDomains = trimAll(resolutionDomains);
        if (resolutionDomains.contains("")) {
            throw new IllegalArgumentException("resolutionDomains cannot contain blank entries");
        }
    }

    /**
     * lightweight suite 데드라인 (connectionTimeout × 4).
     *
     * @return suite 제한 시간
     */
    public Duration lightweightDeadline() {
        return connectionTimeout.multipliedBy(4);
    }

    /**
     * comprehensive suite 데드라인 (2 × (connectionTimeout + httpTimeout)).
     *
     * @return suite 제한 시간
     */
    public Duration comprehensiveDeadline() {
        return connectionTimeout.plus(httpTimeout).multipliedBy(2);
    }

    public ConnectivityConfig withConnectionTimeout(Duration connectionTimeout) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withHttpTimeout(Duration httpTimeout) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withDnsServers(List<String> dnsServers) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withHttpUrls(List<String> httpUrls) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withResolutionDomains(List<String> resolutionDomains) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withUserAgent(String userAgent) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    public ConnectivityConfig withCircuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
        return new ConnectivityConfig(connectionTimeout, httpTimeout, dnsServers, httpUrls, resolutionDomains,
            userAgent, retryPolicy, circuitBreakerConfig);
    }

    /**
     * DNS 서버 주소 정규화.
     *
     * <p>포트가 없으면 53을 붙이고, 빈 항목은 빈 문자열로 유지합니다.
     * 파싱할 수 없는 항목은 원문(trim)을 유지하여 프로브 단계에서 실패로 기록되게 합니다.</p>
     *
     * @param servers 원본 주소 목록
     * @return 정규화된 불변 목록
     */
    static List<String> normalizeDnsServers(List<String> servers) {
        List<String> normalized = new ArrayList<>(servers.size());
        for (String server : servers) {
            if (server == null || server.isBlank()) {
                normalized.add("");
                continue;
            }
            try {
                normalized.add(TargetAddress.parse(server, TargetAddress.DNS_PORT).toString());
            } catch (IllegalArgumentException e) {
                normalized.add(server.trim());
            }
        }
        return List.copyOf(normalized);
    }

    private static List<String> trimAll(List<String> values) {
        List<String> trimmed = new ArrayList<>(values.size());
        for (String value : values) {
            trimmed.add(value == null ? "" : value.trim());
        }
        return List.copyOf(trimmed);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
