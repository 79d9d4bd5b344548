package com.ryuqq.watchdog.application.config;

import com.ryuqq.watchdog.core.protection.CircuitBreakerConfig;
import com.ryuqq.watchdog.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 환경 변수 기반 {@link ConnectivityConfig} 로더.
 *
 * <p><strong>지원 키:</strong></p>
 * <pre>
 * CONNECTION_TIMEOUT            5s
 * HTTP_TIMEOUT                  10s
 * PING_HOSTS                    1.1.1.1,8.8.8.8   (DNS 서버 = lightweight 대상)
 * HTTP_HOSTS                    https://google.com,https://cloudflare.com
 * RESOLUTION_DOMAINS            google.com,cloudflare.com
 * RETRY_ATTEMPTS                3
 * RETRY_BACKOFF_FACTOR          2.0
 * RETRY_BASE_DELAY              100ms
 * RETRY_MAX_DELAY               2s
 * CIRCUIT_BREAKER_THRESHOLD     3
 * CIRCUIT_BREAKER_RESET_TIMEOUT 30s
 * </pre>
 *
 * <p>Duration은 {@code 500ms}, {@code 10s}, {@code 2m}, {@code 1h} 또는 ISO-8601({@code PT10S}) 형식을 받습니다.
 * 잘못된 값은 WARN 로그를 남기고 기본값을 유지합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class EnvironmentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    public static final String CONNECTION_TIMEOUT = "CONNECTION_TIMEOUT";
    public static final String HTTP_TIMEOUT = "HTTP_TIMEOUT";
    public static final String PING_HOSTS = "PING_HOSTS";
    public static final String HTTP_HOSTS = "HTTP_HOSTS";
    public static final String RESOLUTION_DOMAINS = "RESOLUTION_DOMAINS";
    public static final String RETRY_ATTEMPTS = "RETRY_ATTEMPTS";
    public static final String RETRY_BACKOFF_FACTOR = "RETRY_BACKOFF_FACTOR";
    public static final String RETRY_BASE_DELAY = "RETRY_BASE_DELAY";
    public static final String RETRY_MAX_DELAY = "RETRY_MAX_DELAY";
    public static final String CIRCUIT_BREAKER_THRESHOLD = "CIRCUIT_BREAKER_THRESHOLD";
    public static final String CIRCUIT_BREAKER_RESET_TIMEOUT = "CIRCUIT_BREAKER_RESET_TIMEOUT";

    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)(ms|s|m|h)");

    private final Map<String, String> environment;

    /**
     * 프로세스 환경 변수 기반 로더.
     */
    public EnvironmentConfigLoader() {
        this(System.getenv());
    }

    /**
     * 주어진 맵 기반 로더 (테스트용).
     *
     * @param environment 키-값 맵
     */
    public EnvironmentConfigLoader(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = Map.copyOf(environment);
    }

    /**
     * 설정 로드.
     *
     * <p>개별 값이 잘못되었거나, 값은 올바르지만 조합이 잘못된 경우(예: maxDelay &lt; baseDelay)
     * 해당 설정 그룹은 기본값으로 남습니다.</p>
     *
     * @return 설정
     */
    public ConnectivityConfig load() {
        ConnectivityConfig config = new ConnectivityConfig();

        config = apply(config, CONNECTION_TIMEOUT, EnvironmentConfigLoader::parseDuration,
            ConnectivityConfig::withConnectionTimeout);
        config = apply(config, HTTP_TIMEOUT, EnvironmentConfigLoader::parseDuration,
            ConnectivityConfig::withHttpTimeout);
        config = apply(config, PING_HOSTS, EnvironmentConfigLoader::parseList, ConnectivityConfig::withDnsServers);
        config = apply(config, HTTP_HOSTS, EnvironmentConfigLoader::parseList, ConnectivityConfig::withHttpUrls);
        config = apply(config, RESOLUTION_DOMAINS, EnvironmentConfigLoader::parseList,
            ConnectivityConfig::withResolutionDomains);

        RetryPolicy retry = config.retryPolicy();
        retry = apply(retry, RETRY_ATTEMPTS, EnvironmentConfigLoader::parseInteger,
            (policy, attempts) -> policy.withMaxAttempts(attempts));
        retry = apply(retry, RETRY_BACKOFF_FACTOR, EnvironmentConfigLoader::parseDecimal,
            (policy, factor) -> policy.withMultiplier(factor));
        retry = apply(retry, RETRY_MAX_DELAY, EnvironmentConfigLoader::parseDuration, RetryPolicy::withMaxDelay);
        retry = apply(retry, RETRY_BASE_DELAY, EnvironmentConfigLoader::parseDuration, RetryPolicy::withBaseDelay);
        config = config.withRetryPolicy(retry);

        CircuitBreakerConfig breaker = config.circuitBreakerConfig();
        breaker = apply(breaker, CIRCUIT_BREAKER_THRESHOLD, EnvironmentConfigLoader::parseInteger,
            (cb, threshold) -> cb.withFailureThreshold(threshold));
        breaker = apply(breaker, CIRCUIT_BREAKER_RESET_TIMEOUT, EnvironmentConfigLoader::parseDuration,
            CircuitBreakerConfig::withResetTimeout);
        config = config.withCircuitBreakerConfig(breaker);

        log.debug("Loaded connectivity config: connectionTimeout={}, httpTimeout={}, dnsServers={}, httpUrls={}",
            config.connectionTimeout(), config.httpTimeout(), config.dnsServers(), config.httpUrls());
        return config;
    }

    /**
     * Duration 파싱 ({@code 500ms}, {@code 10s}, {@code 2m}, {@code 1h}, ISO-8601).
     *
     * @param value 문자열
     * @return Duration
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static Duration parseDuration(String value) {
        String trimmed = value.trim();
        Matcher matcher = SIMPLE_DURATION.matcher(trimmed);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            String unit = matcher.group(2);
            if ("ms".equals(unit)) {
                return Duration.ofMillis(amount);
            } else if ("s".equals(unit)) {
                return Duration.ofSeconds(amount);
            } else if ("m".equals(unit)) {
                return Duration.ofMinutes(amount);
            }
            return Duration.ofHours(amount);
        }
        try {
            return Duration.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration: " + value, e);
        }
    }

    private static Integer parseInteger(String value) {
        return Integer.valueOf(value.trim());
    }

    private static Double parseDecimal(String value) {
        return Double.valueOf(value.trim());
    }

    private static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            items.add(item.trim());
        }
        return items;
    }

    private <C, V> C apply(C current, String key, Function<String, V> parser, BiFunction<C, V, C> setter) {
        String raw = environment.get(key);
        if (raw == null || raw.isBlank()) {
            return current;
        }
        try {
            return setter.apply(current, parser.apply(raw));
        } catch (RuntimeException e) {
            log.warn("Ignoring invalid value for {}: '{}' ({})", key, raw, e.getMessage());
            return current;
        }
    }
}
