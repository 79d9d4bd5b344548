package com.ryuqq.watchdog.application.probe;

import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.model.ErrorType;
import com.ryuqq.watchdog.core.protection.CircuitOpenException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * ErrorClassifier 테스트.
 */
class ErrorClassifierTest {

    @Test
    void 타입으로_분류() {
        assertEquals(ErrorType.TIMEOUT, ErrorClassifier.classify(new SocketTimeoutException("x")));
        assertEquals(ErrorType.TIMEOUT, ErrorClassifier.classify(new HttpTimeoutException("x")));
        assertEquals(ErrorType.CONNECTION, ErrorClassifier.classify(new ConnectException("x")));
        assertEquals(ErrorType.CONNECTION, ErrorClassifier.classify(new UnknownHostException("x")));
        assertEquals(ErrorType.CIRCUIT_OPEN, ErrorClassifier.classify(new CircuitOpenException("network")));
        assertEquals(ErrorType.CANCELLED, ErrorClassifier.classify(ProbeCancelledException.cancelled()));
        assertEquals(ErrorType.TIMEOUT, ErrorClassifier.classify(ProbeCancelledException.deadlineExceeded()));
    }

    @Test
    void 원인_체인을_따라_분류() {
        IOException wrapped = new IOException("lookup failed", new SocketTimeoutException("timed out"));

        assertEquals(ErrorType.TIMEOUT, ErrorClassifier.classify(wrapped));
    }

    @Test
    void 타입으로_알_수_없으면_메시지로_분류() {
        assertEquals(ErrorType.TIMEOUT, ErrorClassifier.classify(new IOException("i/o timeout")));
        assertEquals(ErrorType.CONNECTION, ErrorClassifier.classify(new IOException("connection reset by peer")));
        assertEquals(ErrorType.OTHER, ErrorClassifier.classify(new IOException("HTTP request returned status 500")));
        assertEquals(ErrorType.OTHER, ErrorClassifier.classify(null));
    }
}
