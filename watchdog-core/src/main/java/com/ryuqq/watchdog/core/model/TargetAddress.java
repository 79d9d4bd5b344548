package com.ryuqq.watchdog.core.model;

/**
 * 프로브 대상 주소 (host + port).
 *
 * <p>문자열 표현은 {@code host:port}이며, IPv6 리터럴은 대괄호로 감쌉니다
 * (예: {@code [2606:4700:4700::1111]:53}).</p>
 *
 * @param host 호스트 (IPv6는 대괄호 없이 저장)
 * @param port 포트 (1 ~ 65535)
 * @author Watchdog Team
 * @since 1.0.0
 */
public record TargetAddress(String host, int port) {

    /** DNS 기본 포트. */
    public static final int DNS_PORT = 53;

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException host가 비어 있거나 port가 범위를 벗어난 경우
     */
    public TargetAddress {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 (current: " + port + ")");
        }
    }

    /**
     * 주소 문자열 파싱.
     *
     * <p>포트가 없으면 defaultPort를 사용합니다.</p>
     * <ul>
     *   <li>{@code 1.1.1.1} → 1.1.1.1:defaultPort</li>
     *   <li>{@code 1.1.1.1:5353} → 1.1.1.1:5353</li>
     *   <li>{@code [::1]:53}, {@code ::1} → ::1</li>
     * </ul>
     *
     * @param value 주소 문자열
     * @param defaultPort 포트가 없을 때 사용할 포트
     * @return TargetAddress
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static TargetAddress parse(String value, int defaultPort) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("address cannot be null or blank");
        }
        String trimmed = value.trim();

        if (trimmed.startsWith("[")) {
            int close = trimmed.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("missing ']' in address: " + value);
            }
            String host = trimmed.substring(1, close);
            String rest = trimmed.substring(close + 1);
            if (rest.isEmpty()) {
                return new TargetAddress(host, defaultPort);
            }
            if (!rest.startsWith(":")) {
                throw new IllegalArgumentException("unexpected characters after ']' in address: " + value);
            }
            return new TargetAddress(host, parsePort(rest.substring(1), value));
        }

        int firstColon = trimmed.indexOf(':');
        if (firstColon < 0) {
            return new TargetAddress(trimmed, defaultPort);
        }
        if (firstColon != trimmed.lastIndexOf(':')) {
            // 대괄호 없는 IPv6 리터럴: 포트 없음
            return new TargetAddress(trimmed, defaultPort);
        }
        return new TargetAddress(trimmed.substring(0, firstColon), parsePort(trimmed.substring(firstColon + 1), value));
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }

    private static int parsePort(String port, String original) {
        try {
            return Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address: " + original, e);
        }
    }
}
