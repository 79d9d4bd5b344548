package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.application.config.ConnectivityConfig;
import com.ryuqq.watchdog.application.config.EnvironmentConfigLoader;
import com.ryuqq.watchdog.application.tiered.ConnectivityMonitor;
import com.ryuqq.watchdog.application.tiered.TestScheduler;
import com.ryuqq.watchdog.application.tiered.TieredTester;

import java.time.Clock;

/**
 * JDK 네트워크 어댑터로 구성된 테스터 팩토리.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (TieredTester tester = ConnectivityTesters.fromEnvironment()) {
 *     ConnectivityMonitor monitor = ConnectivityTesters.monitor(tester);
 *     TieredResult result = monitor.tick(CancellationToken.withTimeout(Duration.ofMinutes(1)));
 * }
 * </pre>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ConnectivityTesters {

    private ConnectivityTesters() {
    }

    /**
     * 주어진 설정으로 테스터 생성.
     *
     * @param config 연결성 설정
     * @return 테스터 (호출자가 close 해야 함)
     */
    public static TieredTester create(ConnectivityConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * 주어진 설정과 시계로 테스터 생성.
     *
     * @param config 연결성 설정
     * @param clock Circuit Breaker 및 timestamp용 시계
     * @return 테스터 (호출자가 close 해야 함)
     */
    public static TieredTester create(ConnectivityConfig config, Clock clock) {
        return new TieredTester(config, new SocketTcpConnector(), new JndiDnsResolver(), new JdkHttpProber(), clock);
    }

    /**
     * 프로세스 환경 변수로 설정을 로드하여 테스터 생성.
     *
     * @return 테스터 (호출자가 close 해야 함)
     */
    public static TieredTester fromEnvironment() {
        return create(new EnvironmentConfigLoader().load());
    }

    /**
     * 테스터를 감싸는 사이클 모니터 생성 (기본 감사 간격).
     *
     * @param tester 테스터
     * @return 모니터
     */
    public static ConnectivityMonitor monitor(TieredTester tester) {
        return new ConnectivityMonitor(new TestScheduler(tester));
    }
}
