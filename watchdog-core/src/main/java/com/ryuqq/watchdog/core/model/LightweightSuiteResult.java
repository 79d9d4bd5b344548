package com.ryuqq.watchdog.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Lightweight tier (TCP handshake) 결과.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>successCount + failureCount == results.size()</li>
 *   <li>overallSuccess ⇔ successCount &gt; 0 AND successCount / results.size() ≥ 0.5</li>
 *   <li>results 순서는 설정된 대상 순서와 1:1 대응</li>
 * </ul>
 *
 * @param results 대상별 프로브 결과 (설정 순서 유지)
 * @param successCount 성공 수
 * @param failureCount 실패 수
 * @param overallSuccess 50% 규칙 충족 여부
 * @param duration suite 실행 시간
 * @param timestamp suite 시작 시각
 * @author Watchdog Team
 * @since 1.0.0
 */
public record LightweightSuiteResult(
    List<ProbeResult> results,
    int successCount,
    int failureCount,
    boolean overallSuccess,
    Duration duration,
    Instant timestamp
) {

    /** overallSuccess에 필요한 최소 성공 비율. */
    public static final double SUCCESS_RATIO = 0.5;

    /**
     * Compact Constructor (불변식 검증).
     *
     * @throws IllegalArgumentException 불변식이 깨진 경우
     */
    public LightweightSuiteResult {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        results = List.copyOf(results);
        if (successCount < 0 || failureCount < 0 || successCount + failureCount != results.size()) {
            throw new IllegalArgumentException(String.format(
                "successCount + failureCount must equal results size (success: %d, failure: %d, size: %d)",
                successCount, failureCount, results.size()));
        }
        if (overallSuccess != meetsThreshold(successCount, results.size())) {
            throw new IllegalArgumentException("overallSuccess does not match the 50% rule");
        }
        if (duration == null || timestamp == null) {
            throw new IllegalArgumentException("duration and timestamp cannot be null");
        }
    }

    /**
     * 프로브 결과를 집계하여 생성.
     *
     * @param results 대상별 결과 (설정 순서)
     * @param duration suite 실행 시간
     * @param timestamp suite 시작 시각
     * @return 집계 결과
     */
    public static LightweightSuiteResult aggregate(List<ProbeResult> results, Duration duration, Instant timestamp) {
        int success = (int) results.stream().filter(ProbeResult::success).count();
        int failure = results.size() - success;
        return new LightweightSuiteResult(results, success, failure,
            meetsThreshold(success, results.size()), duration, timestamp);
    }

    /**
     * 50% 규칙.
     *
     * @param successCount 성공 수
     * @param total 전체 수
     * @return successCount &gt; 0 이고 비율이 0.5 이상이면 true
     */
    public static boolean meetsThreshold(int successCount, int total) {
        return successCount > 0 && total > 0 && (double) successCount / total >= SUCCESS_RATIO;
    }
}
