package com.ryuqq.watchdog.testkit;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.spi.HttpProber;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * URL별 시나리오를 따르는 in-memory HTTP 포트.
 *
 * <p>시나리오 키는 {@link URI#toString()} 입니다. 시나리오가 없는 URL은 기본 응답(200)을 반환합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ScriptedHttpProber implements HttpProber {

    /** 연결 거부. */
    public static final int REFUSED = -1;

    /** 타임아웃만큼 대기 후 {@link HttpTimeoutException}. */
    public static final int TIMEOUT = -2;

    /** 토큰이 취소될 때까지 대기. */
    public static final int HANG = -3;

    private final Scripts<Integer> scripts = new Scripts<>(200);

    /**
     * URL의 시도별 응답 지정 (상태 코드 또는 {@link #REFUSED}, {@link #TIMEOUT}, {@link #HANG}).
     *
     * @return this
     */
    public ScriptedHttpProber script(String url, Integer... responses) {
        scripts.script(url, responses);
        return this;
    }

    /**
     * 시나리오가 없는 URL의 응답 지정 (기본값 200).
     *
     * @return this
     */
    public ScriptedHttpProber otherwise(int response) {
        scripts.otherwise(response);
        return this;
    }

    public int requests(String url) {
        return scripts.attempts(url);
    }

    @Override
    public int head(URI uri, String userAgent, Duration timeout, CancellationToken token) throws IOException {
        int response = scripts.next(uri.toString());
        if (response == REFUSED) {
            throw new ConnectException("Connection refused: " + uri);
        }
        if (response == TIMEOUT) {
            token.sleep(timeout);
            throw new HttpTimeoutException("request timed out: " + uri);
        }
        if (response == HANG) {
            token.sleep(Duration.ofDays(1));
            throw new HttpTimeoutException("request timed out: " + uri);
        }
        return response;
    }
}
