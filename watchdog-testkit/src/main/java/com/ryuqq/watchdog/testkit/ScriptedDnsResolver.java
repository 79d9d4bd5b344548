package com.ryuqq.watchdog.testkit;

import com.ryuqq.watchdog.core.spi.DnsResolver;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * resolver별 시나리오를 따르는 in-memory DNS 포트.
 *
 * <p>시나리오 키는 resolver 주소({@code host:port})이며, 시도는 도메인 질의 1회 단위로 소비됩니다.
 * {@link #unknownDomain(String)}으로 등록한 도메인은 어느 resolver에서도 NXDOMAIN입니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ScriptedDnsResolver implements DnsResolver {

    /**
     * 질의 결과.
     */
    public enum Outcome {
        /** 주소 1개 반환. */
        RESOLVE,
        /** 빈 응답. */
        EMPTY,
        /** resolver 도달 불가 ({@link PortUnreachableException}). */
        UNREACHABLE,
        /** 타임아웃만큼 대기 후 {@link SocketTimeoutException}. */
        TIMEOUT
    }

    static final String RESOLVED_ADDRESS = "192.0.2.1";

    private final Scripts<Outcome> scripts = new Scripts<>(Outcome.RESOLVE);
    private final Set<String> unknownDomains = ConcurrentHashMap.newKeySet();

    /**
     * resolver의 질의별 결과 지정 (마지막 결과는 이후 질의에 반복 적용).
     *
     * @return this
     */
    public ScriptedDnsResolver script(String resolverAddress, Outcome... outcomes) {
        scripts.script(resolverAddress, outcomes);
        return this;
    }

    /**
     * 시나리오가 없는 resolver의 결과 지정 (기본값 RESOLVE).
     *
     * @return this
     */
    public ScriptedDnsResolver otherwise(Outcome outcome) {
        scripts.otherwise(outcome);
        return this;
    }

    /**
     * 모든 resolver에서 NXDOMAIN으로 응답할 도메인 등록.
     *
     * @return this
     */
    public ScriptedDnsResolver unknownDomain(String domain) {
        unknownDomains.add(domain);
        return this;
    }

    public int queries(String resolverAddress) {
        return scripts.attempts(resolverAddress);
    }

    @Override
    public List<String> resolve(String resolverAddress, String domain, Duration timeout) throws IOException {
        Outcome outcome = scripts.next(resolverAddress);
        if (unknownDomains.contains(domain)) {
            throw new UnknownHostException("no such host: " + domain);
        }
        switch (outcome) {
            case RESOLVE:
                return List.of(RESOLVED_ADDRESS);
            case EMPTY:
                return List.of();
            case UNREACHABLE:
                throw new PortUnreachableException("ICMP port unreachable: " + resolverAddress);
            case TIMEOUT:
                try {
                    Thread.sleep(timeout.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("DNS query interrupted");
                }
                throw new SocketTimeoutException("DNS query to " + resolverAddress + " timed out");
            default:
                throw new IllegalStateException("unknown outcome");
        }
    }
}
