package com.ryuqq.watchdog.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 프로브 클래스(TCP/DNS, HTTP)별 연속 실패 수를 추적하고,
 * 임계값 도달 시 요청을 차단하여 복구 중인 대상을 반복 호출하지 않도록 합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (resetTimeout 경과, 단 하나의 시험 호출만 통과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 성공 → CLOSED (실패 카운터 0)
 *   └─► 실패 → OPEN (타이머 재시작)
 * </pre>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 연속 실패 추적).
     */
    CLOSED("closed"),

    /**
     * 차단 상태 (resetTimeout 경과 전까지 즉시 거부).
     */
    OPEN("open"),

    /**
     * 반개방 상태 (resetTimeout이 지나 시험 호출 한 건을 허용).
     */
    HALF_OPEN("half-open");

    private final String label;

    CircuitBreakerState(String label) {
        this.label = label;
    }

    /**
     * 진단 정보(details의 {@code circuit_state})에 기록되는 표기.
     *
     * @return 소문자 표기 (closed, open, half-open)
     */
    public String label() {
        return label;
    }
}
