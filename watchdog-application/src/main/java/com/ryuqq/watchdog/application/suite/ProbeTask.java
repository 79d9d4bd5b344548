package com.ryuqq.watchdog.application.suite;

import com.ryuqq.watchdog.core.context.CancellationToken;
import com.ryuqq.watchdog.core.model.ProbeKind;
import com.ryuqq.watchdog.core.model.ProbeResult;

import java.util.function.Function;

/**
 * fan-out 슬롯 하나에 대응하는 프로브 작업.
 *
 * @param kind 프로브 종류 (미완료 슬롯 결과 생성용)
 * @param target 대상 (미완료 슬롯 결과 생성용)
 * @param probe suite 토큰을 받아 결과를 만드는 함수
 * @author Watchdog Team
 * @since 1.0.0
 */
record ProbeTask(ProbeKind kind, String target, Function<CancellationToken, ProbeResult> probe) {

    ProbeTask {
        if (kind == null || probe == null) {
            throw new IllegalArgumentException("kind and probe cannot be null");
        }
        if (target == null) {
            target = "";
        }
    }
}
