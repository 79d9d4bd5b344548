package com.ryuqq.watchdog.core.model;

/**
 * 계층형 테스트가 결과를 결정한 방식.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * NotStarted → LightweightRan
 *                 ├─► LIGHTWEIGHT_ONLY (short-circuit)
 *                 └─► Escalating
 *                        ├─► ESCALATED_TO_COMPREHENSIVE
 *                        └─► LIGHTWEIGHT_FALLBACK (comprehensive 실행 오류)
 * </pre>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public enum TestStrategy {

    /**
     * lightweight 성공, comprehensive 생략.
     */
    LIGHTWEIGHT_ONLY("lightweight_only"),

    /**
     * comprehensive 결과로 판정.
     */
    ESCALATED_TO_COMPREHENSIVE("escalated_to_comprehensive"),

    /**
     * comprehensive 실행 자체가 오류로 끝나 lightweight 결과로 판정.
     */
    LIGHTWEIGHT_FALLBACK("lightweight_fallback");

    private final String code;

    TestStrategy(String code) {
        this.code = code;
    }

    /**
     * 요약/로그에 기록되는 코드.
     *
     * @return 코드 (예: lightweight_only)
     */
    public String code() {
        return code;
    }
}
