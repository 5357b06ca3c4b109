package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.gate.GateResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hone 단계 결과.
 *
 * <p>모든 게이트를 통과한 경우에만 봉인된 Receipt를 포함합니다.
 * Receipt는 Run이 COMPLETED가 될 때 Run에 부착됩니다.</p>
 *
 * @param gateResults 게이트 결과 (GateKind 선언 순서)
 * @param gateScore 통과한 게이트 수
 * @param allPassed 전체 통과 여부
 * @param sealedReceipt 봉인된 Receipt (전체 통과 시에만, 아니면 null)
 * @param completedAt 완료 시각
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record HoneResult(
    List<GateResult> gateResults,
    int gateScore,
    boolean allPassed,
    Receipt sealedReceipt,
    Instant completedAt
) {

    public HoneResult {
        gateResults = gateResults == null ? List.of() : List.copyOf(gateResults);
        if (allPassed != (sealedReceipt != null)) {
            throw new IllegalArgumentException("sealedReceipt must be present exactly when all gates passed");
        }
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
    }

    public List<GateKind> passedGates() {
        return gateResults.stream().filter(GateResult::passed).map(GateResult::gate).toList();
    }

    public List<GateKind> failedGates() {
        return gateResults.stream().filter(g -> !g.passed()).map(GateResult::gate).toList();
    }

    public Optional<GateResult> resultOf(GateKind gate) {
        return gateResults.stream().filter(g -> g.gate() == gate).findFirst();
    }
}
