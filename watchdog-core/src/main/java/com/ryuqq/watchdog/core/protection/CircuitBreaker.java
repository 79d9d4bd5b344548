package com.ryuqq.watchdog.core.protection;

import com.ryuqq.watchdog.core.context.ProbeCancelledException;
import com.ryuqq.watchdog.core.executor.ProbeAction;

import java.util.Optional;

/**
 * Circuit Breaker SPI.
 *
 * <p>프로브 대상의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 복구 중인 엔드포인트에 요청이 몰리지 않도록 합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 단 하나의 시험 요청으로 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = new ConsecutiveFailureCircuitBreaker("dns", new CircuitBreakerConfig());
 *
 * try {
 *     cb.execute(() -> connector.connect(host, port, timeout, token));
 * } catch (CircuitOpenException e) {
 *     // OPEN 상태: 작업이 실행되지 않음
 * }
 * }</pre>
 *
 * <p>구현체는 여러 프로브 스레드가 공유하므로 모든 상태 전이를 직렬화해야 합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허가 요청.
     *
     * <ul>
     *   <li>CLOSED: 항상 일반 허가 반환 (정상 통과)</li>
     *   <li>OPEN (resetTimeout 미경과): empty 반환 (즉시 차단)</li>
     *   <li>OPEN (resetTimeout 경과) / HALF_OPEN: 시험 허가 한 건만 반환</li>
     * </ul>
     *
     * <p>허가를 받은 호출자는 반드시 {@link #recordSuccess(Permit)}, {@link #recordFailure(Permit, Throwable)},
     * {@link #releasePermission(Permit)} 중 하나를 호출해야 합니다.</p>
     *
     * @return 허가 (차단 시 empty)
     */
    Optional<Permit> tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 리셋</li>
     *   <li>HALF_OPEN: 현재 시험 허가인 경우에만 CLOSED로 전이</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}로 받은 허가
     */
    void recordSuccess(Permit permit);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 증가, 임계값 도달 시 같은 임계 구역에서 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 현재 시험 허가인 경우에만 즉시 OPEN으로 전이 (타이머 재시작),
     *       그 외에는 카운터만 증가</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}로 받은 허가
     * @param throwable 발생한 예외
     */
    void recordFailure(Permit permit, Throwable throwable);

    /**
     * 결과를 기록하지 않고 허가만 반납.
     *
     * <p>작업이 대상의 상태와 무관한 이유(취소)로 끝났을 때 사용합니다.
     * 현재 시험 허가라면 HALF_OPEN 시험 슬롯을 다음 호출자에게 돌려줍니다.</p>
     *
     * @param permit {@link #tryAcquire()}로 받은 허가
     */
    void releasePermission(Permit permit);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * <p>상태를 변경하지 않는 순수 조회입니다. HALF_OPEN은 "OPEN이면서 resetTimeout이 경과함"의
     * 파생 뷰이기도 합니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 연속 실패 수 조회.
     *
     * @return 연속 실패 수
     */
    int getConsecutiveFailures();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * OPEN 상태 여부.
     *
     * @return 현재 상태가 OPEN이면 true (resetTimeout이 지나 HALF_OPEN으로 보이면 false)
     */
    default boolean isOpen() {
        return getState() == CircuitBreakerState.OPEN;
    }

    /**
     * Circuit Breaker 보호 하에 작업 실행.
     *
     * <p>차단 시 작업을 호출하지 않고 {@link CircuitOpenException}을 던집니다.
     * 취소({@link ProbeCancelledException})는 대상 실패로 세지 않고 허가만 반납합니다.</p>
     *
     * @param action 보호 대상 작업
     * @throws CircuitOpenException Circuit Breaker가 요청을 차단한 경우
     * @throws Exception 작업이 던진 예외 (그대로 전파)
     */
    default void execute(ProbeAction action) throws Exception {
        Permit permit = tryAcquire().orElseThrow(() -> new CircuitOpenException(getName()));

        boolean recorded = false;
        try {
            action.run();
            recordSuccess(permit);
            recorded = true;
        } catch (ProbeCancelledException e) {
            throw e;
        } catch (Exception e) {
            recordFailure(permit, e);
            recorded = true;
            throw e;
        } finally {
            if (!recorded) {
                releasePermission(permit);
            }
        }
    }

    /**
     * Circuit Breaker 이름 (로깅 및 오류 메시지용).
     *
     * @return 이름
     */
    String getName();

    /**
     * 통과 허가.
     *
     * <p>{@code generation}은 HALF_OPEN 진입마다 새로 발급되는 시험 세대입니다.
     * 결과를 기록할 때 breaker는 이 값으로 현재 시험 호출과 뒤늦게 끝난 이전 호출을 구분합니다.</p>
     *
     * @param trial 시험 호출 허가 여부
     * @param generation 발급 시점의 시험 세대
     */
    record Permit(boolean trial, long generation) {
    }
}
