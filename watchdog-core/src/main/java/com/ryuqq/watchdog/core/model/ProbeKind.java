package com.ryuqq.watchdog.core.model;

/**
 * 프로브 종류.
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public enum ProbeKind {

    /**
     * TCP 연결을 열고 즉시 닫음 (lightweight tier).
     */
    TCP_HANDSHAKE("tcp_handshake"),

    /**
     * 특정 resolver로 잘 알려진 도메인들을 조회 (comprehensive tier).
     */
    DNS_RESOLUTION("dns_resolution"),

    /**
     * 대상 URL에 HEAD 요청 (comprehensive tier).
     */
    HTTP_CONNECTIVITY("http_connectivity");

    private final String code;

    ProbeKind(String code) {
        this.code = code;
    }

    /**
     * 외부 협력자(로그, 진단)가 사용하는 코드.
     *
     * @return 코드 (예: tcp_handshake)
     */
    public String code() {
        return code;
    }
}
