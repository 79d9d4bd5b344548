package com.ryuqq.watchdog.testkit;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.spi.TcpConnector;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * 대상별 시나리오를 따르는 in-memory TCP 포트.
 *
 * <p>대상 키는 {@code host:port} 입니다. 시나리오가 없는 대상은 기본 동작을 따릅니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ScriptedTcpConnector implements TcpConnector {

    /**
     * 연결 시도 결과.
     */
    public enum Outcome {
        /** handshake 성공. */
        ACCEPT,
        /** 즉시 거부 ({@link ConnectException}). */
        REFUSE,
        /** 타임아웃만큼 대기 후 {@link SocketTimeoutException}. */
        TIMEOUT,
        /** 토큰이 취소될 때까지 대기. */
        HANG
    }

    private final Scripts<Outcome> scripts = new Scripts<>(Outcome.REFUSE);

    /**
     * 대상의 시도별 결과 지정 (마지막 결과는 이후 시도에 반복 적용).
     *
     * @return this
     */
    public ScriptedTcpConnector script(String target, Outcome... outcomes) {
        scripts.script(target, outcomes);
        return this;
    }

    /**
     * 시나리오가 없는 대상의 결과 지정 (기본값 REFUSE).
     *
     * @return this
     */
    public ScriptedTcpConnector otherwise(Outcome outcome) {
        scripts.otherwise(outcome);
        return this;
    }

    public int attempts(String target) {
        return scripts.attempts(target);
    }

    public int totalAttempts() {
        return scripts.totalAttempts();
    }

    @Override
    public void connect(String host, int port, Duration timeout, CancellationToken token) throws IOException {
        String target = host + ":" + port;
        switch (scripts.next(target)) {
            case ACCEPT:
                return;
            case REFUSE:
                throw new ConnectException("Connection refused: " + target);
            case TIMEOUT:
                token.sleep(timeout);
                throw new SocketTimeoutException("connect timed out: " + target);
            case HANG:
                token.sleep(Duration.ofDays(1));
                throw new SocketTimeoutException("connect timed out: " + target);
            default:
                throw new IllegalStateException("unknown outcome");
        }
    }
}
