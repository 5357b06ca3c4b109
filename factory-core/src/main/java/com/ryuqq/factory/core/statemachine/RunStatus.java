package com.ryuqq.factory.core.statemachine;

import com.ryuqq.factory.core.model.Phase;

/**
 * Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ─┬─► AWAITING_APPROVAL ─► APPROVED
 *          └─► APPROVED
 *                 │
 *                 ▼
 * FOSTERING ─► FOSTER_COMPLETE ─► DEVELOPING ─► DEVELOP_COMPLETE ─► HONING
 *                                    ▲                                │
 *                                    └──────── (cycle-back) ──────────┤
 *                                                                     ├─► HONE_COMPLETE ─► COMPLETED
 *                                                                     └─► FAILED
 *
 * 직교 상태: PAUSED, STALLED (진행 중 상태에서 진입, 재개 시 단계에 맞는 상태로 복귀)
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum RunStatus {

    /** Manifest 생성 직후, 레인 결정 전. */
    PENDING,

    /** 사람의 승인 대기 (Guide Me 레인). */
    AWAITING_APPROVAL,

    /** 승인됨 (명시적 또는 자동), 단계 실행 대기. */
    APPROVED,

    FOSTERING,
    FOSTER_COMPLETE,
    DEVELOPING,
    DEVELOP_COMPLETE,
    HONING,
    HONE_COMPLETE,

    /** 완료 (Receipt 봉인됨). */
    COMPLETED,

    /** 실패 (영구). */
    FAILED,

    /** 수동 일시정지. */
    PAUSED,

    /** 정체 감지됨 (사람의 재개 또는 거부 필요). */
    STALLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 진행이 보류된 상태인지 확인 (PAUSED, STALLED).
     */
    public boolean isHeld() {
        return this == PAUSED || this == STALLED;
    }

    /**
     * 승인 결정을 기다리는 상태인지 확인 (PENDING, AWAITING_APPROVAL).
     */
    public boolean isAwaitingDecision() {
        return this == PENDING || this == AWAITING_APPROVAL;
    }

    /**
     * 단계 실행 흐름 안에 있는 상태인지 확인 (APPROVED ~ HONE_COMPLETE).
     */
    public boolean isInFlight() {
        return !isTerminal() && !isHeld() && !isAwaitingDecision();
    }

    /**
     * 이 상태가 속한 단계.
     *
     * @return 단계, 단계와 무관한 상태면 null
     */
    public Phase phase() {
        return switch (this) {
            case FOSTERING, FOSTER_COMPLETE -> Phase.FOSTER;
            case DEVELOPING, DEVELOP_COMPLETE -> Phase.DEVELOP;
            case HONING, HONE_COMPLETE -> Phase.HONE;
            default -> null;
        };
    }
}
