package com.ryuqq.watchdog.core.protection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 연속 실패 기반 Circuit Breaker 구현체.
 *
 * <p>연속 실패 수가 {@code failureThreshold}에 도달하면 OPEN으로 전이하고,
 * 마지막 실패로부터 {@code resetTimeout}이 지나면 시험 호출 한 건만 통과시킵니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>모든 상태 전이는 단일 모니터({@code synchronized})로 직렬화됩니다.</li>
 *   <li>임계값을 넘기는 실패와 OPEN 전이는 같은 임계 구역에서 일어나므로
 *       동시 실패가 하나의 임계값 통과로 중복 계산되지 않습니다.</li>
 *   <li>OPEN → HALF_OPEN 결정도 임계 구역 안에서 이루어지므로 경합하는 호출자 중
 *       정확히 한 건만 시험 호출로 통과하고 나머지는 계속 fast-fail 합니다.</li>
 *   <li>시험 허가는 세대 번호를 가지며, HALF_OPEN 전이는 현재 세대의 허가만 일으킵니다.
 *       OPEN 이전에 통과한 호출의 뒤늦은 결과는 카운터에만 반영됩니다.</li>
 *   <li>{@link #getState()}는 volatile 필드만 읽는 lock-free 조회입니다.</li>
 * </ul>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private volatile CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private volatile int consecutiveFailures;
    private volatile Instant lastFailureTime;
    private boolean trialInFlight;
    private long trialGeneration;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param name breaker 이름 (예: "dns", "http")
     * @param config 설정
     * @throws IllegalArgumentException name 또는 config가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param name breaker 이름
     * @param config 설정
     * @param clock resetTimeout 계산에 사용할 시계
     * @throws IllegalArgumentException 인자가 null이거나 name이 빈 문자열인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.failureThreshold = config.failureThreshold();
        this.resetTimeout = config.resetTimeout();
        this.clock = clock;
    }

    @Override
    public synchronized Optional<Permit> tryAcquire() {
        switch (state) {
            case CLOSED:
                return Optional.of(new Permit(false, trialGeneration));
            case OPEN:
                if (!resetTimeoutElapsed()) {
                    return Optional.empty();
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
                return Optional.of(grantTrial());
            case HALF_OPEN:
                if (trialInFlight) {
                    return Optional.empty();
                }
                return Optional.of(grantTrial());
            default:
                return Optional.empty();
        }
    }

    @Override
    public synchronized void recordSuccess(Permit permit) {
        if (state == CircuitBreakerState.HALF_OPEN) {
            if (!isCurrentTrial(permit)) {
                log.debug("Circuit breaker '{}' ignored a stale success during the trial call", name);
                return;
            }
            trialInFlight = false;
            consecutiveFailures = 0;
            transitionTo(CircuitBreakerState.CLOSED);
        } else if (state == CircuitBreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
        // OPEN: 차단 이전에 통과한 호출의 뒤늦은 성공은 시험 호출이 아니므로 무시
    }

    @Override
    public synchronized void recordFailure(Permit permit, Throwable throwable) {
        consecutiveFailures++;

        if (state == CircuitBreakerState.HALF_OPEN) {
            // 이전 호출의 뒤늦은 실패는 카운터만 증가, 전이는 시험 호출이 결정
            if (isCurrentTrial(permit)) {
                lastFailureTime = clock.instant();
                trialInFlight = false;
                transitionTo(CircuitBreakerState.OPEN);
            }
        } else {
            lastFailureTime = clock.instant();
            if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= failureThreshold) {
                transitionTo(CircuitBreakerState.OPEN);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Circuit breaker '{}' recorded failure {}/{}: {}",
                name, consecutiveFailures, failureThreshold,
                throwable == null ? "unknown" : throwable.getMessage());
        }
    }

    @Override
    public synchronized void releasePermission(Permit permit) {
        if (state == CircuitBreakerState.HALF_OPEN && isCurrentTrial(permit)) {
            trialInFlight = false;
        }
    }

    @Override
    public CircuitBreakerState getState() {
        CircuitBreakerState current = state;
        if (current == CircuitBreakerState.OPEN && resetTimeoutElapsed()) {
            return CircuitBreakerState.HALF_OPEN;
        }
        return current;
    }

    @Override
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public synchronized void reset() {
        consecutiveFailures = 0;
        trialInFlight = false;
        transitionTo(CircuitBreakerState.CLOSED);
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * 마지막 실패 시각 조회.
     *
     * @return 마지막 실패 시각 (실패 이력이 없으면 null)
     */
    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" + name + ", state=" + getState().label()
            + ", consecutiveFailures=" + consecutiveFailures + '}';
    }

    private Permit grantTrial() {
        trialInFlight = true;
        trialGeneration++;
        return new Permit(true, trialGeneration);
    }

    private boolean isCurrentTrial(Permit permit) {
        return permit != null && permit.trial() && trialInFlight && permit.generation() == trialGeneration;
    }

    private boolean resetTimeoutElapsed() {
        Instant last = lastFailureTime;
        if (last == null) {
            return true;
        }
        return Duration.between(last, clock.instant()).compareTo(resetTimeout) >= 0;
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.info("Circuit breaker '{}' transitioned {} -> {} (consecutiveFailures={})",
            name, previous.label(), next.label(), consecutiveFailures);
    }
}
