package com.ryuqq.watchdog.core.model;

/**
 * 프로브 details 키.
 *
 * <p>진단/장애 기록 협력자가 파싱하는 준안정(semi-stable) 계약입니다.
 * 키 이름을 바꾸면 외부 컴포넌트가 깨집니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class DetailKeys {

    public static final String SERVER = "server";
    public static final String DNS_SERVER = "dns_server";
    public static final String HTTP_HOST = "http_host";
    public static final String HOST = "host";
    public static final String TIMEOUT_MS = "timeout_ms";
    public static final String STATUS_CODE = "status_code";
    public static final String ERROR = "error";
    public static final String ERROR_TYPE = "error_type";
    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String CIRCUIT_STATE = "circuit_state";
    public static final String RETRY_COUNT = "retry_count";
    public static final String DOMAINS = "domains";
    public static final String SUCCESSFUL_RESOLUTIONS = "successful_resolutions";

    /** 도메인별 조회 결과 키 접두사 (예: {@code resolution.google.com}). */
    public static final String RESOLUTION_PREFIX = "resolution.";

    private DetailKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
