/**
 * In-memory scripted network for connectivity tests.
 *
 * <p>{@link com.ryuqq.watchdog.testkit.ScriptedTcpConnector}, {@link com.ryuqq.watchdog.testkit.ScriptedDnsResolver}
 * and {@link com.ryuqq.watchdog.testkit.ScriptedHttpProber} replay per-target outcomes so that breaker, retry and
 * escalation behavior can be verified without touching the network.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
package com.ryuqq.watchdog.testkit;
