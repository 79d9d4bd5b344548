package com.ryuqq.watchdog.application.probe;

import java.io.IOException;

/**
 * DNS 프로브에서 성공한 조회가 절반 미만인 경우.
 *
 * <p>마지막 도메인 조회 오류를 cause로 보관하여 타임아웃/연결 오류 분류에 사용합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public class InsufficientResolutionException extends IOException {

    private final int successful;
    private final int total;

    public InsufficientResolutionException(int successful, int total, Throwable lastError) {
        super("insufficient successful resolutions: " + successful + "/" + total, lastError);
        this.successful = successful;
        this.total = total;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getTotal() {
        return total;
    }
}
