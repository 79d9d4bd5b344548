package com.ryuqq.watchdog.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lightweight / Comprehensive suite 판정 규칙 테스트.
 */
class SuiteResultTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    // ============================================================
    // 1. Lightweight 50% 규칙
    // ============================================================

    @Test
    void lightweight_4개_중_2개_성공이면_성공() {
        LightweightSuiteResult result = LightweightSuiteResult.aggregate(tcp(2, 2), Duration.ofMillis(10), NOW);

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isEqualTo(2);
        assertThat(result.overallSuccess()).isTrue();
    }

    @Test
    void lightweight_4개_중_1개_성공이면_실패() {
        LightweightSuiteResult result = LightweightSuiteResult.aggregate(tcp(1, 3), Duration.ofMillis(10), NOW);

        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void lightweight_결과가_없으면_실패() {
        LightweightSuiteResult result = LightweightSuiteResult.aggregate(List.of(), Duration.ZERO, NOW);

        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void lightweight_카운트가_맞지_않으면_거부() {
        assertThatThrownBy(() -> new LightweightSuiteResult(tcp(1, 1), 2, 1, true, Duration.ZERO, NOW))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lightweight_판정이_규칙과_다르면_거부() {
        assertThatThrownBy(() -> new LightweightSuiteResult(tcp(1, 3), 1, 3, true, Duration.ZERO, NOW))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lightweight_결과_목록은_불변() {
        List<ProbeResult> source = new ArrayList<>(tcp(1, 1));
        LightweightSuiteResult result = LightweightSuiteResult.aggregate(source, Duration.ZERO, NOW);

        source.clear();

        assertThat(result.results()).hasSize(2);
        assertThatThrownBy(() -> result.results().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    // ============================================================
    // 2. Comprehensive 60% 규칙
    // ============================================================

    @Test
    void comprehensive_5개_중_3개_성공이면_성공() {
        ComprehensiveSuiteResult result = ComprehensiveSuiteResult.aggregate(
            dns(2, 1), http(1, 1), null, Duration.ofMillis(10), NOW);

        assertThat(result.successCount()).isEqualTo(3);
        assertThat(result.totalTests()).isEqualTo(5);
        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.isEscalated()).isFalse();
    }

    @Test
    void comprehensive_5개_중_2개_성공이면_실패() {
        ComprehensiveSuiteResult result = ComprehensiveSuiteResult.aggregate(
            dns(1, 2), http(1, 1), ComprehensiveSuiteResult.ESCALATED_FROM_LIGHTWEIGHT, Duration.ofMillis(10), NOW);

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.escalatedFrom()).isEqualTo("lightweight");
    }

    @Test
    void comprehensive_빈_escalatedFrom은_null로_정규화() {
        ComprehensiveSuiteResult result = ComprehensiveSuiteResult.aggregate(
            dns(1, 0), List.of(), "  ", Duration.ZERO, NOW);

        assertThat(result.escalatedFrom()).isNull();
    }

    @Test
    void comprehensive_테스트가_없으면_실패() {
        ComprehensiveSuiteResult result = ComprehensiveSuiteResult.aggregate(
            List.of(), List.of(), null, Duration.ZERO, NOW);

        assertThat(result.overallSuccess()).isFalse();
    }

    // ============================================================
    // Helper Methods
    // ============================================================

    static List<ProbeResult> tcp(int success, int failure) {
        return results(ProbeKind.TCP_HANDSHAKE, success, failure);
    }

    static List<ProbeResult> dns(int success, int failure) {
        return results(ProbeKind.DNS_RESOLUTION, success, failure);
    }

    static List<ProbeResult> http(int success, int failure) {
        return results(ProbeKind.HTTP_CONNECTIVITY, success, failure);
    }

    private static List<ProbeResult> results(ProbeKind kind, int success, int failure) {
        List<ProbeResult> results = new ArrayList<>();
        for (int i = 0; i < success; i++) {
            results.add(new ProbeResult(kind, "ok-" + i, true, Duration.ofMillis(1), NOW, 0, false, null,
                Details.empty()));
        }
        for (int i = 0; i < failure; i++) {
            results.add(new ProbeResult(kind, "fail-" + i, false, Duration.ofMillis(1), NOW, 2, false,
                "connection refused", Details.empty()));
        }
        Collections.shuffle(results);
        return results;
    }
}
