package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.gate.GateResult;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 모든 게이트를 통과한 Run의 완료 증명.
 *
 * <p>봉인 후 변경 불가. 유일한 예외는 {@link #approveDeploy()}로 한 번만 켤 수 있는
 * deployApproved 플래그입니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class Receipt {

    private final String id;
    private final RunId runId;
    private final List<GateResult> gateResults;
    private final List<GateKind> gatesPassed;
    private final List<GateKind> gatesFailed;
    private final List<Artifact> artifacts;
    private final CostActual costActual;
    private final String varianceFromEstimate;
    private final Instant sealedAt;
    private final String sealedBy;
    private final AtomicBoolean deployApproved = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 게이트 수가 전체 게이트 수와 다른 경우
     */
    public Receipt(
        String id,
        RunId runId,
        List<GateResult> gateResults,
        List<Artifact> artifacts,
        CostActual costActual,
        String varianceFromEstimate,
        Instant sealedAt,
        String sealedBy
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (gateResults == null || gateResults.size() != GateKind.count()) {
            throw new IllegalArgumentException(
                "gateResults must cover all " + GateKind.count() + " gates");
        }
        if (costActual == null || sealedAt == null) {
            throw new IllegalArgumentException("costActual and sealedAt cannot be null");
        }
        if (sealedBy == null || sealedBy.isBlank()) {
            throw new IllegalArgumentException("sealedBy cannot be null or blank");
        }
        this.id = id;
        this.runId = runId;
        this.gateResults = List.copyOf(gateResults);
        this.gatesPassed = this.gateResults.stream().filter(GateResult::passed).map(GateResult::gate).toList();
        this.gatesFailed = this.gateResults.stream().filter(g -> !g.passed()).map(GateResult::gate).toList();
        this.artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        this.costActual = costActual;
        this.varianceFromEstimate = Objects.requireNonNullElse(varianceFromEstimate, formatVariance(0.0));
        this.sealedAt = sealedAt;
        this.sealedBy = sealedBy;
    }

    /**
     * 배포 승인 (한 번만 가능).
     *
     * @throws IllegalStateException 이미 승인된 경우
     */
    public void approveDeploy() {
        if (!deployApproved.compareAndSet(false, true)) {
            throw new IllegalStateException("Deploy already approved for receipt: " + id);
        }
    }

    /**
     * 편차 비율을 부호 있는 백분율 문자열로 변환 (예: 0.052 → "+5.2%").
     *
     * @param signedRatio 부호 있는 편차 비율
     * @return 백분율 문자열
     */
    public static String formatVariance(double signedRatio) {
        // 반올림 후 포맷하여 -0.0% 방지
        double percent = Math.round(signedRatio * 1000) / 10.0;
        return String.format(Locale.ROOT, "%+.1f%%", percent);
    }

    public String getId() {
        return id;
    }

    public RunId getRunId() {
        return runId;
    }

    public int getGateScore() {
        return gatesPassed.size();
    }

    public List<GateResult> getGateResults() {
        return gateResults;
    }

    public List<GateKind> getGatesPassed() {
        return gatesPassed;
    }

    public List<GateKind> getGatesFailed() {
        return gatesFailed;
    }

    public List<Artifact> getArtifacts() {
        return artifacts;
    }

    public CostActual getCostActual() {
        return costActual;
    }

    public String getVarianceFromEstimate() {
        return varianceFromEstimate;
    }

    public Instant getSealedAt() {
        return sealedAt;
    }

    public String getSealedBy() {
        return sealedBy;
    }

    public boolean isDeployApproved() {
        return deployApproved.get();
    }

    @Override
    public String toString() {
        return "Receipt{" +
            "id='" + id + '\'' +
            ", runId=" + runId +
            ", gateScore=" + getGateScore() +
            ", deployApproved=" + deployApproved.get() +
            '}';
    }
}
