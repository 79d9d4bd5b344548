package com.ryuqq.watchdog.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 협력적 취소 토큰.
 *
 * <p>연결성 테스트의 모든 중단 지점(네트워크 I/O, 재시도 backoff 대기,
 * 프로브 join barrier)은 이 토큰을 통해 취소를 관찰합니다.</p>
 *
 * <p><strong>토큰 트리:</strong></p>
 * <pre>
 * root (호출자, 선택적 데드라인)
 *   │
 *   ├─► suite (connectionTimeout × 4)
 *   │     └─► probe 작업들이 공유
 *   └─► suite (2 × (connectionTimeout + httpTimeout))
 * </pre>
 *
 * <ul>
 *   <li>부모가 취소되면 모든 자식도 같은 사유로 취소됩니다.</li>
 *   <li>자식의 데드라인은 자신의 타임아웃과 부모 데드라인 중 이른 쪽입니다.</li>
 *   <li>{@link #close()}는 Go의 {@code cancel()}처럼 토큰을 취소하고 부모와의 연결을 해제합니다.</li>
 * </ul>
 *
 * <p>모든 메서드는 thread-safe 합니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class CancellationToken implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final long POLL_INTERVAL_MS = 10;
    private static final ScheduledThreadPoolExecutor DEADLINE_TIMER = createDeadlineTimer();

    private final CancellationToken parent;
    private final boolean bounded;
    private final long deadlineNanos;
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Object lock = new Object();

    // lock으로 보호
    private final List<Runnable> listeners = new ArrayList<>();
    private ScheduledFuture<?> deadlineTask;
    private Registration parentRegistration;

    private volatile ProbeCancelledException cause;

    private CancellationToken(CancellationToken parent, Duration timeout) {
        this.parent = parent;

        boolean ownBounded = timeout != null;
        long ownDeadline = ownBounded ? System.nanoTime() + saturatedNanos(timeout) : 0L;

        if (parent != null && parent.bounded) {
            if (!ownBounded || parent.deadlineNanos - ownDeadline < 0) {
                ownDeadline = parent.deadlineNanos;
            }
            ownBounded = true;
        }
        this.bounded = ownBounded;
        this.deadlineNanos = ownDeadline;
    }

    /**
     * 데드라인 없는 루트 토큰 생성.
     *
     * @return 새 토큰
     */
    public static CancellationToken create() {
        return link(new CancellationToken(null, null));
    }

    /**
     * 데드라인이 있는 루트 토큰 생성.
     *
     * @param timeout 현재 시각부터의 제한 시간
     * @return 새 토큰
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public static CancellationToken withTimeout(Duration timeout) {
        validateTimeout(timeout);
        return link(new CancellationToken(null, timeout));
    }

    /**
     * 부모의 취소와 데드라인을 상속하는 자식 토큰 생성.
     *
     * @return 자식 토큰
     */
    public CancellationToken child() {
        return link(new CancellationToken(this, null));
    }

    /**
     * 추가 제한 시간을 가진 자식 토큰 생성.
     *
     * @param timeout 자식 토큰의 제한 시간 (부모 데드라인이 더 이르면 부모 기준)
     * @return 자식 토큰
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public CancellationToken childWithTimeout(Duration timeout) {
        validateTimeout(timeout);
        return link(new CancellationToken(this, timeout));
    }

    /**
     * 토큰 취소 (CANCELLED).
     *
     * <p>이미 취소된 토큰이면 아무 동작도 하지 않습니다.</p>
     */
    public void cancel() {
        cancel(ProbeCancelledException.cancelled());
    }

    /**
     * 취소 여부 확인.
     *
     * <p>데드라인이 지났다면 타이머보다 먼저 관찰한 쪽에서 취소를 확정합니다.</p>
     *
     * @return 취소되었거나 데드라인이 지난 경우 true
     */
    public boolean isCancelled() {
        if (cause != null) {
            return true;
        }
        if (bounded && System.nanoTime() - deadlineNanos >= 0) {
            cancel(ProbeCancelledException.deadlineExceeded());
            return true;
        }
        return false;
    }

    /**
     * 취소 원인 조회.
     *
     * @return 취소 원인 (취소되지 않았으면 empty)
     */
    public Optional<ProbeCancelledException> cause() {
        return isCancelled() ? Optional.of(cause) : Optional.empty();
    }

    /**
     * 취소된 경우 즉시 예외 발생.
     *
     * @throws ProbeCancelledException 토큰이 취소된 경우
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw cancellationError();
        }
    }

    /**
     * 현재 취소 원인과 같은 사유의 새 예외 생성.
     *
     * <p>여러 스레드가 동일한 예외 인스턴스를 공유하지 않도록 매번 새로 생성합니다.</p>
     *
     * @return 취소 예외
     * @throws IllegalStateException 토큰이 아직 취소되지 않은 경우
     */
    public ProbeCancelledException cancellationError() {
        ProbeCancelledException current = cause;
        if (current == null) {
            throw new IllegalStateException("token is not cancelled");
        }
        return new ProbeCancelledException(current.getReason(), current.getMessage());
    }

    /**
     * 데드라인 보유 여부.
     *
     * @return 데드라인이 있으면 true
     */
    public boolean hasDeadline() {
        return bounded;
    }

    /**
     * 데드라인까지 남은 시간.
     *
     * @return 남은 시간 (데드라인이 없으면 empty, 지났으면 {@link Duration#ZERO})
     */
    public Optional<Duration> remaining() {
        if (!bounded) {
            return Optional.empty();
        }
        long nanos = deadlineNanos - System.nanoTime();
        return Optional.of(nanos > 0 ? Duration.ofNanos(nanos) : Duration.ZERO);
    }

    /**
     * 주어진 타임아웃을 남은 시간으로 제한.
     *
     * @param timeout 원하는 타임아웃
     * @return min(timeout, remaining)
     */
    public Duration boundedTimeout(Duration timeout) {
        Optional<Duration> remaining = remaining();
        if (remaining.isPresent() && remaining.get().compareTo(timeout) < 0) {
            return remaining.get();
        }
        return timeout;
    }

    /**
     * 취소 시 실행할 리스너 등록.
     *
     * <p>이미 취소된 토큰이면 호출 스레드에서 즉시 실행합니다.
     * 블로킹 I/O(소켓 connect, HTTP 요청)를 중단시키는 데 사용합니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (cause == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        runListener(listener);
        return () -> { };
    }

    /**
     * 취소 가능한 대기 (재시도 backoff).
     *
     * <p>토큰이 취소되면 남은 대기 시간과 관계없이 즉시 깨어납니다.</p>
     *
     * @param duration 대기 시간
     * @throws ProbeCancelledException 대기 전 또는 대기 중 취소된 경우, 스레드가 인터럽트된 경우
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        try {
            if (cancelledLatch.await(saturatedNanos(duration), TimeUnit.NANOSECONDS)) {
                throw cancellationError();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeCancelledException(ProbeCancelledException.Reason.CANCELLED, "sleep interrupted");
        }
    }

    /**
     * 취소 가능한 join barrier 대기.
     *
     * <p>latch가 0이 되거나 토큰이 취소될 때까지 대기합니다 (10ms 소프트 폴링).</p>
     *
     * @param latch 완료 카운트다운 latch
     * @return 모든 작업이 완료되면 true, 취소가 먼저 일어나면 false
     * @throws ProbeCancelledException 대기 중 스레드가 인터럽트된 경우
     */
    public boolean awaitCompletion(CountDownLatch latch) {
        try {
            while (!latch.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (isCancelled()) {
                    return latch.getCount() == 0;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeCancelledException(ProbeCancelledException.Reason.CANCELLED, "wait interrupted");
        }
    }

    /**
     * 토큰 종료.
     *
     * <p>토큰을 취소하여 남은 자식 작업을 정리하고, 데드라인 타이머와 부모 연결을 해제합니다.</p>
     */
    @Override
    public void close() {
        cancel(new ProbeCancelledException(ProbeCancelledException.Reason.CANCELLED, "token closed"));
        Registration registration;
        synchronized (lock) {
            registration = parentRegistration;
            parentRegistration = null;
        }
        if (registration != null) {
            registration.close();
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + (cause != null)
            + ", deadline=" + remaining().map(d -> d.toMillis() + "ms").orElse("none") + '}';
    }

    private void cancel(ProbeCancelledException reason) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cause != null) {
                return;
            }
            cause = reason;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
            if (deadlineTask != null) {
                deadlineTask.cancel(false);
                deadlineTask = null;
            }
        }
        cancelledLatch.countDown();
        for (Runnable listener : toRun) {
            runListener(listener);
        }
    }

    private static CancellationToken link(CancellationToken token) {
        if (token.parent != null) {
            CancellationToken parent = token.parent;
            Registration registration = parent.onCancel(() -> token.cancel(parent.cancellationError()));
            synchronized (token.lock) {
                token.parentRegistration = registration;
            }
        }
        if (token.bounded) {
            long delay = token.deadlineNanos - System.nanoTime();
            if (delay <= 0) {
                token.cancel(ProbeCancelledException.deadlineExceeded());
            } else {
                synchronized (token.lock) {
                    if (token.cause == null) {
                        token.deadlineTask = DEADLINE_TIMER.schedule(
                            () -> token.cancel(ProbeCancelledException.deadlineExceeded()),
                            delay, TimeUnit.NANOSECONDS);
                    }
                }
            }
        }
        return token;
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed", e);
        }
    }

    private static void validateTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    private static ScheduledThreadPoolExecutor createDeadlineTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cancellation-deadline-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    /**
     * 취소 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * 리스너 등록 해제 (여러 번 호출해도 안전).
         */
        @Override
        void close();
    }
}
