package com.ryuqq.watchdog.application.probe;

import java.io.IOException;

/**
 * HTTP 응답 상태 코드가 400 이상인 경우.
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public class UnexpectedStatusException extends IOException {

    private final int statusCode;

    public UnexpectedStatusException(int statusCode) {
        super("HTTP request returned status " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
