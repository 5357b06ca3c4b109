package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.core.model.RunId;

import java.util.List;

/**
 * StallDetector 스캔 결과.
 *
 * @param stalled 이번 스캔에서 STALLED로 표시된 Run
 * @param expired 이번 스캔에서 만료되어 FAILED가 된 Run (EXPIRE 전략만 해당)
 * @author Factory Team
 * @since 1.0.0
 */
public record StallScanResult(List<RunId> stalled, List<RunId> expired) {

    public StallScanResult {
        stalled = stalled == null ? List.of() : List.copyOf(stalled);
        expired = expired == null ? List.of() : List.copyOf(expired);
    }
}
