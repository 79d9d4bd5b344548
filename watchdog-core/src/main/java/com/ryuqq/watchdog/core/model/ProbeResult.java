package com.ryuqq.watchdog.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 단일 프로브 시도 결과 (불변).
 *
 * @param kind 프로브 종류
 * @param target 대상 (host:port 또는 URL)
 * @param success 성공 여부
 * @param duration 시작부터 완료까지 걸린 시간
 * @param timestamp 시작 시각
 * @param retryCount 첫 시도 이후 재시도 횟수
 * @param circuitOpen Circuit Breaker가 (네트워크 호출이 아니라) 요청을 거부했으면 true
 * @param error 오류 메시지 (성공이면 null)
 * @param details 진단 정보
 * @author Watchdog Team
 * @since 1.0.0
 */
public record ProbeResult(
    ProbeKind kind,
    String target,
    boolean success,
    Duration duration,
    Instant timestamp,
    int retryCount,
    boolean circuitOpen,
    String error,
    Details details
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 성공/오류 조합이 모순되는 경우
     */
    public ProbeResult {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative (current: " + retryCount + ")");
        }
        if (success && (error != null || circuitOpen)) {
            throw new IllegalArgumentException("successful result cannot carry an error or an open circuit");
        }
        if (details == null) {
            details = Details.empty();
        }
    }

    /**
     * 프로브를 실행하지 못한 실패 결과 생성 (빈 대상, suite 데드라인 초과 등).
     *
     * @param kind 프로브 종류
     * @param target 대상
     * @param timestamp 기록 시각
     * @param error 오류 메시지
     * @param details 진단 정보
     * @return 실패 결과
     */
    public static ProbeResult notExecuted(ProbeKind kind, String target, Instant timestamp, String error, Details details) {
        return new ProbeResult(kind, target, false, Duration.ZERO, timestamp, 0, false, error, details);
    }

    /**
     * 오류 존재 여부.
     *
     * @return 오류 메시지가 있으면 true
     */
    public boolean hasError() {
        return error != null;
    }
}
