/**
 * Network Adapter Layer - 네트워크 포트의 JDK 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.watchdog.adapter.network.SocketTcpConnector} - TCP handshake ({@code java.net.Socket})</li>
 *   <li>{@link com.ryuqq.watchdog.adapter.network.JndiDnsResolver} - 서버 지정 DNS 질의 (JNDI DNS provider)</li>
 *   <li>{@link com.ryuqq.watchdog.adapter.network.JdkHttpProber} - HTTP HEAD ({@code java.net.http.HttpClient})</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-network (SocketTcpConnector, JndiDnsResolver, JdkHttpProber)
 *   ↓ implements
 * core/spi (TcpConnector, DnsResolver, HttpProber)
 *   ↑ used by
 * application (ProbeRunner → LightweightTestSuite / ComprehensiveTestSuite → TieredTester)
 * </pre>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.adapter.network;
