/**
 * 계층형 테스트 오케스트레이션.
 *
 * <ul>
 *   <li>{@link com.ryuqq.watchdog.application.tiered.TieredTester} - lightweight → comprehensive 에스컬레이션</li>
 *   <li>{@link com.ryuqq.watchdog.application.tiered.TestScheduler} - 실패 이력 기반 comprehensive 강제</li>
 *   <li>{@link com.ryuqq.watchdog.application.tiered.ConnectivityMonitor} - 사이클 드라이버</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.application.tiered;
