package com.ryuqq.watchdog.core.protection;

/**
 * Circuit Breaker가 OPEN 상태여서 작업을 실행하지 않고 거부했음을 나타내는 예외.
 *
 * <p>네트워크 오류와 구분되는 의도적인 fast-fail이며, 같은 호출 안에서 재시도하지 않습니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName 거부한 Circuit Breaker 이름
     */
    public CircuitOpenException(String breakerName) {
        super("circuit breaker is open (" + breakerName + ")");
        this.breakerName = breakerName;
    }

    /**
     * 거부한 Circuit Breaker 이름 조회.
     *
     * @return breaker 이름
     */
    public String getBreakerName() {
        return breakerName;
    }
}
