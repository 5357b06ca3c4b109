package com.ryuqq.factory.core.model;

import java.util.List;

/**
 * 단계별 실행 계획.
 *
 * @param steps 단계 내 스텝 목록 (순서 유지)
 * @param estimatedTokens 이 단계에 미리 배정된 토큰
 * @param executors 이 단계를 수행하는 실행자 이름
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record PhasePlan(List<String> steps, long estimatedTokens, List<String> executors) {

    public PhasePlan {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("estimatedTokens must be non-negative (current: " + estimatedTokens + ")");
        }
        steps = List.copyOf(steps);
        executors = executors == null ? List.of() : List.copyOf(executors);
    }
}
