package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.spi.TcpConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * {@link Socket} 기반 TCP handshake.
 *
 * <p>연결이 수립되면 바로 닫습니다. 토큰이 취소되면 리스너가 소켓을 닫아 블로킹 connect를 깨웁니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class SocketTcpConnector implements TcpConnector {

    private static final Logger log = LoggerFactory.getLogger(SocketTcpConnector.class);

    @Override
    public void connect(String host, int port, Duration timeout, CancellationToken token) throws IOException {
        // Socket.connect(..., 0)은 무한 대기
        int timeoutMillis = TimeoutMillis.of(timeout);
        if (timeoutMillis == 0) {
            throw new SocketTimeoutException("connect timed out: no time remaining for " + host + ":" + port);
        }

        Socket socket = new Socket();
        try (CancellationToken.Registration ignored = token.onCancel(() -> closeQuietly(socket))) {
            token.throwIfCancelled();
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
        } catch (SocketException e) {
            if (token.isCancelled()) {
                throw token.cancellationError();
            }
            throw e;
        } finally {
            closeQuietly(socket);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Failed to close probe socket: {}", e.getMessage());
        }
    }
}
