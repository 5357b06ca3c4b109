package com.ryuqq.factory.application.controller;

import com.ryuqq.factory.core.model.RunId;

import java.time.Instant;
import java.util.List;

/**
 * Controller 집계 상태.
 *
 * @param enabled 정책상 활성화 여부
 * @param state 요약 상태
 * @param activeChambers ACTIVE/WATCHING Chamber 수
 * @param activeRuns 종료되지 않은 Run 수
 * @param queuedEvents 대기열 Event 수
 * @param pendingApprovals 승인 대기 Run 수
 * @param stalledRuns 정체 Run 수
 * @param recentCompletions 최근 완료 Run
 * @param periodCost 이번 달 지출
 * @param uptimeSeconds Controller 생성 후 경과 시간 (초)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record StatusReport(
    boolean enabled,
    State state,
    int activeChambers,
    int activeRuns,
    int queuedEvents,
    int pendingApprovals,
    int stalledRuns,
    List<RecentCompletion> recentCompletions,
    PeriodCost periodCost,
    long uptimeSeconds
) {

    public StatusReport {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (periodCost == null) {
            throw new IllegalArgumentException("periodCost cannot be null");
        }
        recentCompletions = recentCompletions == null ? List.of() : List.copyOf(recentCompletions);
    }

    /**
     * 요약 상태: 비활성이면 PAUSED, 활성 Run이 있으면 ACTIVE, 없으면 IDLE.
     */
    public enum State {
        ACTIVE,
        PAUSED,
        IDLE
    }

    public record RecentCompletion(RunId runId, String scope, Instant completedAt, int gateScore) {
    }

    /**
     * @param totalUsd 이번 달 누적 지출
     * @param budgetCapUsd 월 예산 상한
     * @param utilizationPct 사용률 (%), 상한이 0이면 0
     */
    public record PeriodCost(double totalUsd, double budgetCapUsd, double utilizationPct) {

        public static PeriodCost of(double totalUsd, double budgetCapUsd) {
            double utilization = budgetCapUsd > 0 ? totalUsd / budgetCapUsd * 100 : 0.0;
            return new PeriodCost(totalUsd, budgetCapUsd, utilization);
        }
    }
}
