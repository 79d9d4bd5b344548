package com.ryuqq.watchdog.core.spi;

import com.ryuqq.watchdog.core.context.CancellationToken;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * HTTP HEAD 도달성 포트.
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HttpProber {

    /**
     * HEAD 요청을 보내고 상태 코드를 반환.
     *
     * <p>리다이렉트는 따라가지 않습니다. 응답 본문은 읽지 않습니다.</p>
     *
     * @param uri 대상 URL
     * @param userAgent User-Agent 헤더 값
     * @param timeout 요청 전체 제한 시간
     * @param token 취소 토큰 (취소 시 진행 중인 요청 중단)
     * @return HTTP 상태 코드
     * @throws IOException 연결 실패 또는 타임아웃
     */
    int head(URI uri, String userAgent, Duration timeout, CancellationToken token) throws IOException;
}
