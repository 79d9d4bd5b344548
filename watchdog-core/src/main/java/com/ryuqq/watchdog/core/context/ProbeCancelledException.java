package com.ryuqq.watchdog.core.context;

import java.util.concurrent.CancellationException;

/**
 * 취소 또는 데드라인 초과로 작업이 중단되었음을 나타내는 예외.
 *
 * <p>{@link CancellationToken}이 취소된 상태에서 대기(backoff sleep, join barrier)나
 * 네트워크 I/O를 시도하면 발생합니다. 다른 예외로 래핑하지 않고 그대로 전파합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public class ProbeCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    /**
     * 취소 사유.
     */
    public enum Reason {
        /** 호출자가 명시적으로 취소함. */
        CANCELLED,
        /** 토큰의 데드라인이 지남. */
        DEADLINE_EXCEEDED
    }

    private final Reason reason;

    /**
     * 생성자.
     *
     * @param reason 취소 사유
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public ProbeCancelledException(Reason reason, String message) {
        super(message);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        this.reason = reason;
    }

    /**
     * 명시적 취소 예외 생성.
     *
     * @return CANCELLED 사유의 예외
     */
    public static ProbeCancelledException cancelled() {
        return new ProbeCancelledException(Reason.CANCELLED, "operation cancelled");
    }

    /**
     * 데드라인 초과 예외 생성.
     *
     * @return DEADLINE_EXCEEDED 사유의 예외
     */
    public static ProbeCancelledException deadlineExceeded() {
        return new ProbeCancelledException(Reason.DEADLINE_EXCEEDED, "deadline exceeded");
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유
     */
    public Reason getReason() {
        return reason;
    }

    /**
     * 데드라인 초과로 인한 취소인지 확인.
     *
     * @return DEADLINE_EXCEEDED인 경우 true
     */
    public boolean isDeadlineExceeded() {
        return reason == Reason.DEADLINE_EXCEEDED;
    }
}
