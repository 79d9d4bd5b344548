package com.ryuqq.watchdog.core.spi;

import com.ryuqq.watchdog.core.context.CancellationToken;

import java.io.IOException;
import java.time.Duration;

/**
 * TCP handshake 포트.
 *
 * <p>연결을 맺은 뒤 즉시 닫습니다. 데이터는 송수신하지 않습니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TcpConnector {

    /**
     * host:port 로 TCP 연결을 시도하고 성공 시 즉시 닫음.
     *
     * <p>구현체는 토큰이 취소되면 진행 중인 connect를 중단해야 합니다.</p>
     *
     * @param host 대상 호스트 (IP 리터럴 또는 호스트명)
     * @param port 대상 포트
     * @param timeout connect 제한 시간
     * @param token 취소 토큰
     * @throws IOException 연결 실패 (거부, 타임아웃, 경로 없음)
     */
    void connect(String host, int port, Duration timeout, CancellationToken token) throws IOException;
}
