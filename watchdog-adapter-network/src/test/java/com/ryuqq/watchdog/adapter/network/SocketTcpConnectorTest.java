package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SocketTcpConnector 루프백 테스트.
 */
class SocketTcpConnectorTest {

    private final SocketTcpConnector connector = new SocketTcpConnector();

    @Test
    void 열린_포트에_연결_성공() throws IOException {
        try (ServerSocket server = LoopbackPorts.listening()) {
            assertThatCode(() -> connector.connect("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2),
                CancellationToken.create())).doesNotThrowAnyException();
        }
    }

    @Test
    void 닫힌_포트는_연결_거부() throws IOException {
        int port = LoopbackPorts.closed();

        assertThatThrownBy(() -> connector.connect("127.0.0.1", port, Duration.ofSeconds(2), CancellationToken.create()))
            .isInstanceOf(ConnectException.class);
    }

    @Test
    void 남은_시간이_없으면_즉시_타임아웃() throws IOException {
        try (ServerSocket server = LoopbackPorts.listening()) {
            assertThatThrownBy(() -> connector.connect("127.0.0.1", server.getLocalPort(), Duration.ZERO,
                CancellationToken.create()))
                .isInstanceOf(SocketTimeoutException.class);
        }
    }

    @Test
    void 취소된_토큰이면_연결하지_않고_취소_예외() throws IOException {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        try (ServerSocket server = LoopbackPorts.listening()) {
            assertThatThrownBy(() -> connector.connect("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2), token))
                .isInstanceOf(ProbeCancelledException.class);
        }
    }
}
