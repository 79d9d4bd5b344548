package com.ryuqq.watchdog.application.suite;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.DetailKeys;
import com.ryuqq.watchdog.core.model.Details;
import com.ryuqq.watchdog.core.model.ErrorType;
import com.ryuqq.watchdog.core.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 병렬 map + join barrier.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>작업마다 하나의 태스크를 제출 (제한 없는 fan-out, 대상 수는 보통 10개 이하)</li>
 *   <li>결과는 입력 순서와 1:1 대응하는 고정 크기 슬롯에 한 번만 기록</li>
 *   <li>모든 태스크 완료 또는 suite 토큰 취소까지 대기 (조기 중단 없음)</li>
 *   <li>호출자 토큰이 취소되었으면 취소 예외 전파</li>
 *   <li>suite 데드라인만 지났으면 미완료 슬롯을 timeout 실패로 채움</li>
 * </ol>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
final class ProbeFanOut {

    private static final Logger log = LoggerFactory.getLogger(ProbeFanOut.class);

    static final String DEADLINE_ERROR = "suite deadline exceeded before probe completed";

    private final ExecutorService executor;
    private final Clock clock;

    ProbeFanOut(ExecutorService executor, Clock clock) {
        if (executor == null || clock == null) {
            throw new IllegalArgumentException("executor and clock cannot be null");
        }
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 모든 작업 실행 후 입력 순서대로 결과 반환.
     *
     * @param caller 호출자 토큰
     * @param suiteToken suite 데드라인 토큰 (caller의 자식)
     * @param tasks 작업 목록
     * @return 입력 순서의 결과 목록
     * @throws com.ryuqq.watchdog.core.context.ProbeCancelledException 호출자 토큰이 취소된 경우
     * @throws IllegalStateException executor가 종료되어 작업을 제출할 수 없는 경우
     */
    List<ProbeResult> run(CancellationToken caller, CancellationToken suiteToken, List<ProbeTask> tasks) {
        int size = tasks.size();
        AtomicReferenceArray<ProbeResult> slots = new AtomicReferenceArray<>(size);
        CountDownLatch done = new CountDownLatch(size);

        for (int i = 0; i < size; i++) {
            int index = i;
            ProbeTask task = tasks.get(i);
            try {
                executor.execute(() -> {
                    try {
                        slots.set(index, task.probe().apply(suiteToken));
                    } catch (RuntimeException e) {
                        log.warn("{} probe to {} threw unexpectedly", task.kind().code(), task.target(), e);
                        slots.set(index, failed(task, "probe failed: " + e.getMessage(), ErrorType.OTHER));
                    } finally {
                        done.countDown();
                    }
                });
            } catch (RejectedExecutionException e) {
                suiteToken.cancel();
                throw new IllegalStateException("probe executor is shut down", e);
            }
        }

        boolean completed = suiteToken.awaitCompletion(done);
        caller.throwIfCancelled();
        if (!completed) {
            log.debug("Suite deadline exceeded with {} of {} probes outstanding", done.getCount(), size);
        }

        List<ProbeResult> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ProbeResult result = slots.get(i);
            results.add(result != null ? result : failed(tasks.get(i), DEADLINE_ERROR, ErrorType.TIMEOUT));
        }
        return results;
    }

    private ProbeResult failed(ProbeTask task, String error, ErrorType type) {
        Details details = Details.builder()
            .put(DetailKeys.ERROR, error)
            .put(DetailKeys.ERROR_TYPE, type.code())
            .build();
        return ProbeResult.notExecuted(task.kind(), task.target(), clock.instant(), error, details);
    }
}
