package com.ryuqq.factory.application.controller;

import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;

/**
 * ingestEvent 결과.
 *
 * <p>정책 거부는 예외가 아니라 이 값으로 표현됩니다.</p>
 *
 * <p><strong>네 가지 처분:</strong></p>
 * <ul>
 *   <li>REJECTED: 수락 안 됨 (reason: paused, source_not_allowed, budget_exceeded)</li>
 *   <li>QUEUED: 수락 후 대기열 보관, runId 없음 (reason: queued)</li>
 *   <li>AWAITING_APPROVAL: Run 생성, 사람의 승인 대기</li>
 *   <li>EXECUTED: Run 생성 후 단계 실행까지 마침 (runStatus로 최종 상태 확인)</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class IngestResult {

    public static final String REASON_PAUSED = "paused";
    public static final String REASON_SOURCE_NOT_ALLOWED = "source_not_allowed";
    public static final String REASON_BUDGET_EXCEEDED = "budget_exceeded";
    public static final String REASON_QUEUED = "queued";
    public static final String REASON_AWAITING_APPROVAL = "awaiting_approval";
    public static final String REASON_EXECUTED = "executed";

    /**
     * 처분 종류.
     */
    public enum Disposition {
        REJECTED,
        QUEUED,
        AWAITING_APPROVAL,
        EXECUTED
    }

    private final Disposition disposition;
    private final RunId runIdOrNull;
    private final RunStatus runStatusOrNull;
    private final String reason;
    private final String detail;

    private IngestResult(Disposition disposition, RunId runIdOrNull, RunStatus runStatusOrNull,
                         String reason, String detail) {
        if (disposition == null) {
            throw new IllegalArgumentException("disposition cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        this.disposition = disposition;
        this.runIdOrNull = runIdOrNull;
        this.runStatusOrNull = runStatusOrNull;
        this.reason = reason;
        this.detail = detail;
    }

    public static IngestResult rejected(String reason, String detail) {
        return new IngestResult(Disposition.REJECTED, null, null, reason, detail);
    }

    public static IngestResult queued(String detail) {
        return new IngestResult(Disposition.QUEUED, null, null, REASON_QUEUED, detail);
    }

    /**
     * @throws IllegalArgumentException runId가 null인 경우
     */
    public static IngestResult awaitingApproval(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null for awaiting approval result");
        }
        return new IngestResult(Disposition.AWAITING_APPROVAL, runId, RunStatus.AWAITING_APPROVAL,
            REASON_AWAITING_APPROVAL, "Run " + runId + " requires human approval");
    }

    /**
     * @throws IllegalArgumentException runId 또는 status가 null인 경우
     */
    public static IngestResult executed(RunId runId, RunStatus status) {
        if (runId == null || status == null) {
            throw new IllegalArgumentException("runId and status cannot be null for executed result");
        }
        return new IngestResult(Disposition.EXECUTED, runId, status, REASON_EXECUTED,
            "Run " + runId + " finished in " + status);
    }

    /**
     * 수락 여부 (REJECTED가 아니면 true).
     */
    public boolean isAccepted() {
        return disposition != Disposition.REJECTED;
    }

    public boolean isAwaitingApproval() {
        return disposition == Disposition.AWAITING_APPROVAL;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    /**
     * @return Run ID, QUEUED/REJECTED이면 null
     */
    public RunId getRunIdOrNull() {
        return runIdOrNull;
    }

    public RunStatus getRunStatusOrNull() {
        return runStatusOrNull;
    }

    public String getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "IngestResult{" +
            "disposition=" + disposition +
            ", runId=" + runIdOrNull +
            ", reason='" + reason + '\'' +
            '}';
    }
}
