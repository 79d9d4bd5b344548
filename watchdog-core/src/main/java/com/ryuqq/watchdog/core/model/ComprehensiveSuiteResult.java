package com.ryuqq.watchdog.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Comprehensive tier (DNS resolution + HTTP reachability) 결과.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>successCount + failureCount == dnsResults.size() + httpResults.size()</li>
 *   <li>overallSuccess ⇔ 테스트가 1건 이상 AND successCount / 전체 ≥ 0.6</li>
 * </ul>
 *
 * @param dnsResults resolver별 DNS 결과 (설정 순서 유지)
 * @param httpResults URL별 HTTP 결과 (설정 순서 유지)
 * @param successCount 성공 수
 * @param failureCount 실패 수
 * @param overallSuccess 60% 규칙 충족 여부
 * @param escalatedFrom 에스컬레이션 출처 (예: "lightweight"), 단독 실행이면 null
 * @param duration suite 실행 시간
 * @param timestamp suite 시작 시각
 * @author Watchdog Team
 * @since 1.0.0
 */
public record ComprehensiveSuiteResult(
    List<ProbeResult> dnsResults,
    List<ProbeResult> httpResults,
    int successCount,
    int failureCount,
    boolean overallSuccess,
    String escalatedFrom,
    Duration duration,
    Instant timestamp
) {

    /** overallSuccess에 필요한 최소 성공 비율. */
    public static final double SUCCESS_RATIO = 0.6;

    /** lightweight tier 실패로 에스컬레이션된 경우의 태그. */
    public static final String ESCALATED_FROM_LIGHTWEIGHT = "lightweight";

    /**
     * Compact Constructor (불변식 검증).
     *
     * @throws IllegalArgumentException 불변식이 깨진 경우
     */
    public ComprehensiveSuiteResult {
        if (dnsResults == null || httpResults == null) {
            throw new IllegalArgumentException("dnsResults and httpResults cannot be null");
        }
        dnsResults = List.copyOf(dnsResults);
        httpResults = List.copyOf(httpResults);
        int total = dnsResults.size() + httpResults.size();
        if (successCount < 0 || failureCount < 0 || successCount + failureCount != total) {
            throw new IllegalArgumentException(String.format(
                "successCount + failureCount must equal total tests (success: %d, failure: %d, total: %d)",
                successCount, failureCount, total));
        }
        if (overallSuccess != meetsThreshold(successCount, total)) {
            throw new IllegalArgumentException("overallSuccess does not match the 60% rule");
        }
        if (escalatedFrom != null && escalatedFrom.isBlank()) {
            escalatedFrom = null;
        }
        if (duration == null || timestamp == null) {
            throw new IllegalArgumentException("duration and timestamp cannot be null");
        }
    }

    /**
     * 프로브 결과를 집계하여 생성.
     *
     * @param dnsResults DNS 결과
     * @param httpResults HTTP 결과
     * @param escalatedFrom 에스컬레이션 출처 (nullable)
     * @param duration suite 실행 시간
     * @param timestamp suite 시작 시각
     * @return 집계 결과
     */
    public static ComprehensiveSuiteResult aggregate(
        List<ProbeResult> dnsResults,
        List<ProbeResult> httpResults,
        String escalatedFrom,
        Duration duration,
        Instant timestamp
    ) {
        int success = (int) (dnsResults.stream().filter(ProbeResult::success).count()
            + httpResults.stream().filter(ProbeResult::success).count());
        int total = dnsResults.size() + httpResults.size();
        return new ComprehensiveSuiteResult(dnsResults, httpResults, success, total - success,
            meetsThreshold(success, total), escalatedFrom, duration, timestamp);
    }

    /**
     * 60% 규칙.
     *
     * @param successCount 성공 수
     * @param total 전체 수
     * @return 전체가 1 이상이고 비율이 0.6 이상이면 true
     */
    public static boolean meetsThreshold(int successCount, int total) {
        return total > 0 && (double) successCount / total >= SUCCESS_RATIO;
    }

    /**
     * 전체 테스트 수.
     *
     * @return DNS + HTTP 결과 수
     */
    public int totalTests() {
        return dnsResults.size() + httpResults.size();
    }

    /**
     * 에스컬레이션 실행 여부.
     *
     * @return escalatedFrom이 있으면 true
     */
    public boolean isEscalated() {
        return escalatedFrom != null;
    }
}
