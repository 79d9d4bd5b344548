package com.ryuqq.watchdog.core.model;

/**
 * 프로브 실패 분류 ({@code details.error_type}).
 *
 * <p>진단/장애 기록 협력자는 원본 예외 대신 이 분류를 읽습니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public enum ErrorType {

    /** 연결/응답 시간 초과 또는 suite 데드라인 초과. */
    TIMEOUT("timeout"),

    /** 연결 거부, 경로 없음, 리셋 등. */
    CONNECTION("connection"),

    /** Circuit Breaker가 요청을 차단함 (네트워크 호출 없음). */
    CIRCUIT_OPEN("circuit_open"),

    /** 호출자가 취소함. */
    CANCELLED("cancelled"),

    /** 그 밖의 오류 (잘못된 URL, HTTP 4xx/5xx, 조회 결과 부족 등). */
    OTHER("other");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    /**
     * details에 기록되는 코드.
     *
     * @return 코드
     */
    public String code() {
        return code;
    }
}
