/**
 * 네트워크 프리미티브 포트 (Hexagonal Architecture의 Outbound Port).
 *
 * <p>애플리케이션 계층은 이 인터페이스에만 의존하고, 실제 소켓/DNS/HTTP 구현은
 * {@code watchdog-adapter-network} 모듈이 제공합니다. 테스트에서는
 * {@code watchdog-testkit}의 scripted 구현이나 Mockito mock을 주입합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.core.spi;
