package com.ryuqq.watchdog.core.spi;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * 특정 DNS 서버를 대상으로 하는 이름 조회 포트.
 *
 * <p>시스템 resolver가 아니라 지정된 서버에 직접 질의해야 합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DnsResolver {

    /**
     * 도메인의 주소 레코드 조회.
     *
     * @param resolverAddress 질의할 DNS 서버 ("host:port")
     * @param domain 조회할 도메인
     * @param timeout 질의 제한 시간
     * @return 조회된 주소 목록 (레코드가 없으면 빈 목록)
     * @throws IOException 서버 무응답, 타임아웃, NXDOMAIN 등
     */
    List<String> resolve(String resolverAddress, String domain, Duration timeout) throws IOException;
}
