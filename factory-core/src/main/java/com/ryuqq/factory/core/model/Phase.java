package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.statemachine.RunStatus;

/**
 * 고정된 3단계 파이프라인 단계.
 *
 * <p>순서는 항상 FOSTER → DEVELOP → HONE 이며, 토큰 예산 배분 비율은 설계 상수입니다
 * (15% / 65% / 20%).</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum Phase {

    /** 컨텍스트 수집 및 요구사항 정리. */
    FOSTER(0.15, RunStatus.FOSTERING, RunStatus.FOSTER_COMPLETE),

    /** 산출물 생성. */
    DEVELOP(0.65, RunStatus.DEVELOPING, RunStatus.DEVELOP_COMPLETE),

    /** 검증 게이트 실행. */
    HONE(0.20, RunStatus.HONING, RunStatus.HONE_COMPLETE);

    private final double tokenWeight;
    private final RunStatus activeStatus;
    private final RunStatus completeStatus;

    Phase(double tokenWeight, RunStatus activeStatus, RunStatus completeStatus) {
        this.tokenWeight = tokenWeight;
        this.activeStatus = activeStatus;
        this.completeStatus = completeStatus;
    }

    public double tokenWeight() {
        return tokenWeight;
    }

    /**
     * 이 단계를 실행 중일 때의 상태 (예: FOSTERING).
     */
    public RunStatus activeStatus() {
        return activeStatus;
    }

    /**
     * 이 단계가 끝났을 때의 상태 (예: FOSTER_COMPLETE).
     */
    public RunStatus completeStatus() {
        return completeStatus;
    }

    /**
     * 다음 단계.
     *
     * @return 다음 단계, HONE이면 null
     */
    public Phase next() {
        return switch (this) {
            case FOSTER -> DEVELOP;
            case DEVELOP -> HONE;
            case HONE -> null;
        };
    }
}
