package com.ryuqq.watchdog.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 계층형 연결성 테스트 결과 (불변).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>shortCircuited ⇔ strategy == LIGHTWEIGHT_ONLY</li>
 *   <li>comprehensive != null ⇔ strategy == ESCALATED_TO_COMPREHENSIVE</li>
 *   <li>overallSuccess는 결과를 결정한 tier의 성공 여부와 같음</li>
 * </ul>
 *
 * @param strategy 판정 방식
 * @param lightweight lightweight 결과 (항상 존재)
 * @param comprehensive comprehensive 결과 (에스컬레이션 성공 시에만 존재, 그 외 null)
 * @param overallSuccess 최종 성공 여부
 * @param shortCircuited comprehensive를 생략했으면 true
 * @param totalDuration 호출 진입부터 반환까지의 시간
 * @param timestamp 호출 시작 시각
 * @author Watchdog Team
 * @since 1.0.0
 */
public record TieredResult(
    TestStrategy strategy,
    LightweightSuiteResult lightweight,
    ComprehensiveSuiteResult comprehensive,
    boolean overallSuccess,
    boolean shortCircuited,
    Duration totalDuration,
    Instant timestamp
) {

    /**
     * Compact Constructor (불변식 검증).
     *
     * @throws IllegalArgumentException 불변식이 깨진 경우
     */
    public TieredResult {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (lightweight == null) {
            throw new IllegalArgumentException("lightweight result cannot be null");
        }
        if (shortCircuited != (strategy == TestStrategy.LIGHTWEIGHT_ONLY)) {
            throw new IllegalArgumentException("shortCircuited must be true iff strategy is lightweight_only");
        }
        if ((comprehensive != null) != (strategy == TestStrategy.ESCALATED_TO_COMPREHENSIVE)) {
            throw new IllegalArgumentException(
                "comprehensive result must be present iff strategy is escalated_to_comprehensive (strategy: "
                    + strategy.code() + ")");
        }
        boolean decidingSuccess = comprehensive != null ? comprehensive.overallSuccess() : lightweight.overallSuccess();
        if (overallSuccess != decidingSuccess) {
            throw new IllegalArgumentException("overallSuccess must mirror the deciding tier");
        }
        if (totalDuration == null || timestamp == null) {
            throw new IllegalArgumentException("totalDuration and timestamp cannot be null");
        }
    }

    /**
     * short-circuit 결과 생성.
     */
    public static TieredResult lightweightOnly(LightweightSuiteResult lightweight, Duration totalDuration, Instant timestamp) {
        return new TieredResult(TestStrategy.LIGHTWEIGHT_ONLY, lightweight, null,
            lightweight.overallSuccess(), true, totalDuration, timestamp);
    }

    /**
     * comprehensive 판정 결과 생성.
     */
    public static TieredResult escalated(
        LightweightSuiteResult lightweight,
        ComprehensiveSuiteResult comprehensive,
        Duration totalDuration,
        Instant timestamp
    ) {
        return new TieredResult(TestStrategy.ESCALATED_TO_COMPREHENSIVE, lightweight, comprehensive,
            comprehensive.overallSuccess(), false, totalDuration, timestamp);
    }

    /**
     * comprehensive 실행 오류 후 fallback 결과 생성.
     */
    public static TieredResult fallback(LightweightSuiteResult lightweight, Duration totalDuration, Instant timestamp) {
        return new TieredResult(TestStrategy.LIGHTWEIGHT_FALLBACK, lightweight, null,
            lightweight.overallSuccess(), false, totalDuration, timestamp);
    }

    /**
     * comprehensive 결과 조회.
     *
     * @return comprehensive 결과 (없으면 empty)
     */
    public Optional<ComprehensiveSuiteResult> comprehensiveResult() {
        return Optional.ofNullable(comprehensive);
    }

    /**
     * 로깅/텔레메트리 협력자를 위한 요약.
     *
     * <pre>
     * strategy, overall_success, short_circuited, total_duration_ms, timestamp,
     * lightweight {success, success_count, failure_count, duration_ms},
     * comprehensive? {success, success_count, failure_count, dns_tests, http_tests, duration_ms, escalated_from}
     * </pre>
     *
     * @return 삽입 순서를 유지하는 요약 맵
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("strategy", strategy.code());
        summary.put("overall_success", overallSuccess);
        summary.put("short_circuited", shortCircuited);
        summary.put("total_duration_ms", totalDuration.toMillis());
        summary.put("timestamp", timestamp.toString());

        Map<String, Object> light = new LinkedHashMap<>();
        light.put("success", lightweight.overallSuccess());
        light.put("success_count", lightweight.successCount());
        light.put("failure_count", lightweight.failureCount());
        light.put("duration_ms", lightweight.duration().toMillis());
        summary.put("lightweight", light);

        if (comprehensive != null) {
            Map<String, Object> comp = new LinkedHashMap<>();
            comp.put("success", comprehensive.overallSuccess());
            comp.put("success_count", comprehensive.successCount());
            comp.put("failure_count", comprehensive.failureCount());
            comp.put("dns_tests", comprehensive.dnsResults().size());
            comp.put("http_tests", comprehensive.httpResults().size());
            comp.put("duration_ms", comprehensive.duration().toMillis());
            comp.put("escalated_from", comprehensive.escalatedFrom() == null ? "" : comprehensive.escalatedFrom());
            summary.put("comprehensive", comp);
        }
        return summary;
    }
}
