/**
 * 보호 메커니즘이 감싸는 실행 단위.
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.core.executor;
