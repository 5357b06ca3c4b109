package com.ryuqq.factory.core.model;

/**
 * 3단계 실행 계획 묶음.
 *
 * @param foster Foster 단계 계획
 * @param develop Develop 단계 계획
 * @param hone Hone 단계 계획
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record ExecutionPlan(PhasePlan foster, PhasePlan develop, PhasePlan hone) {

    public ExecutionPlan {
        if (foster == null || develop == null || hone == null) {
            throw new IllegalArgumentException("every phase plan is required (foster, develop, hone)");
        }
    }

    public PhasePlan forPhase(Phase phase) {
        return switch (phase) {
            case FOSTER -> foster;
            case DEVELOP -> develop;
            case HONE -> hone;
        };
    }
}
