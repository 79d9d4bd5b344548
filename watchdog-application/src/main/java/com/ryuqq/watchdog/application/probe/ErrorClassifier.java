package com.ryuqq.watchdog.application.probe;

import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.ErrorType;
import com.ryuqq.watchdog.core.protection.CircuitOpenException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 프로브 실패 원인을 {@link ErrorType}으로 분류.
 *
 * <p>예외 타입을 먼저 보고, 판단할 수 없으면 메시지에 "timeout"/"timed out" 또는
 * "connection"이 포함되어 있는지로 분류합니다. 원인 체인도 함께 확인합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 5;

    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 분류.
     *
     * @param error 프로브 실패 예외
     * @return 분류 결과 (null이면 OTHER)
     */
    public static ErrorType classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            ErrorType byType = classifyByType(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }
        return classifyByMessage(error);
    }

    private static ErrorType classifyByType(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return ErrorType.CIRCUIT_OPEN;
        }
        if (error instanceof ProbeCancelledException) {
            return ((ProbeCancelledException) error).isDeadlineExceeded() ? ErrorType.TIMEOUT : ErrorType.CANCELLED;
        }
        // InterruptedIOException: SocketTimeoutException 포함
        if (error instanceof InterruptedIOException
            || error instanceof HttpTimeoutException
            || error instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (error instanceof ConnectException
            || error instanceof NoRouteToHostException
            || error instanceof PortUnreachableException
            || error instanceof UnknownHostException
            || error instanceof SocketException) {
            return ErrorType.CONNECTION;
        }
        return null;
    }

    private static ErrorType classifyByMessage(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return ErrorType.OTHER;
        }
        String message = error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timeout") || message.contains("timed out")) {
            return ErrorType.TIMEOUT;
        }
        if (message.contains("connection")) {
            return ErrorType.CONNECTION;
        }
        return ErrorType.OTHER;
    }
}
