package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.spi.HttpProber;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link HttpClient} 기반 HEAD 요청.
 *
 * <p>리다이렉트를 따르지 않으므로 3xx 상태 코드가 그대로 반환됩니다.
 * 토큰이 취소되면 진행 중인 요청 future를 취소합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class JdkHttpProber implements HttpProber {

    private final HttpClient client;

    /**
     * 리다이렉트를 따르지 않는 기본 클라이언트로 생성.
     */
    public JdkHttpProber() {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    /**
     * 주어진 클라이언트로 생성.
     *
     * @param client HTTP 클라이언트
     * @throws IllegalArgumentException client가 null인 경우
     */
    public JdkHttpProber(HttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    @Override
    public int head(URI uri, String userAgent, Duration timeout, CancellationToken token) throws IOException {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new HttpTimeoutException("request timed out: no time remaining for " + uri);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .header("User-Agent", userAgent)
            .timeout(timeout)
            .build();

        CompletableFuture<HttpResponse<Void>> response = client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        try (CancellationToken.Registration ignored = token.onCancel(() -> response.cancel(true))) {
            return response.get().statusCode();
        } catch (CancellationException e) {
            throw token.isCancelled() ? token.cancellationError() : e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            response.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("HEAD request to " + uri + " interrupted");
        }
    }

    private static IOException unwrap(Throwable cause) {
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        return new IOException("HEAD request failed: " + cause, cause);
    }
}
