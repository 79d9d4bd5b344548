/**
 * 연결성 테스트 설정.
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.application.config;
