package com.ryuqq.factory.core.model;

import java.time.ZonedDateTime;

/**
 * 프로세스 전역 운영 정책 (불변 record).
 *
 * <p>Controller는 매 {@code ingestEvent} 호출마다 최신 Policy 스냅샷을 읽습니다.
 * 정책은 버전 관리되지 않으며, 변경은 다음 Event부터 적용됩니다 (소급 적용 없음).</p>
 *
 * <p><strong>설정 항목 (기본값):</strong></p>
 * <ul>
 *   <li>enabled: Controller 활성화 여부 (true)</li>
 *   <li>autoApproveThresholdUsd: 자동 승인 비용 상한 (5.0)</li>
 *   <li>maxConcurrentRuns: 동시 활성 Run 상한 (3)</li>
 *   <li>operatingHours: 운영 시간 (ALWAYS)</li>
 *   <li>stallTimeoutMinutes: 정체 판단 시간 (15분)</li>
 *   <li>monthlyBudgetCapUsd: 월 예산 상한 (500.0)</li>
 *   <li>allowedSources: 허용 소스 (all)</li>
 *   <li>autoWireEnabled: 자동 연결 (true)</li>
 *   <li>healthRemediationMode: 헬스 복구 방식 (RESTART_THEN_SCALE)</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 * @param enabled Controller 활성화 여부
 * @param autoApproveThresholdUsd 자동 승인 비용 상한 (0 이상)
 * @param maxConcurrentRuns 동시 활성 Run 상한 (1 이상)
 * @param operatingHours 운영 시간
 * @param customHours CUSTOM 운영 시간대 (CUSTOM이 아니면 null 허용)
 * @param stallTimeoutMinutes 정체 판단 시간 (분, 1 이상)
 * @param monthlyBudgetCapUsd 월 예산 상한 (0 이상)
 * @param allowedSources 허용 소스
 * @param autoWireEnabled 자동 연결 여부
 * @param healthRemediationMode 헬스 복구 방식
 */
public record Policy(
    boolean enabled,
    double autoApproveThresholdUsd,
    int maxConcurrentRuns,
    OperatingHours operatingHours,
    CustomHours customHours,
    long stallTimeoutMinutes,
    double monthlyBudgetCapUsd,
    AllowedSources allowedSources,
    boolean autoWireEnabled,
    HealthRemediationMode healthRemediationMode
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Policy {
        if (autoApproveThresholdUsd < 0) {
            throw new IllegalArgumentException(
                "autoApproveThresholdUsd must be non-negative (current: " + autoApproveThresholdUsd + ")"
            );
        }
        if (maxConcurrentRuns <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentRuns must be positive (current: " + maxConcurrentRuns + ")"
            );
        }
        if (operatingHours == null) {
            throw new IllegalArgumentException("operatingHours cannot be null");
        }
        if (operatingHours == OperatingHours.CUSTOM && customHours == null) {
            throw new IllegalArgumentException("customHours cannot be null when operatingHours is CUSTOM");
        }
        if (stallTimeoutMinutes <= 0) {
            throw new IllegalArgumentException(
                "stallTimeoutMinutes must be positive (current: " + stallTimeoutMinutes + ")"
            );
        }
        if (monthlyBudgetCapUsd < 0) {
            throw new IllegalArgumentException(
                "monthlyBudgetCapUsd must be non-negative (current: " + monthlyBudgetCapUsd + ")"
            );
        }
        if (allowedSources == null) {
            throw new IllegalArgumentException("allowedSources cannot be null");
        }
        if (healthRemediationMode == null) {
            throw new IllegalArgumentException("healthRemediationMode cannot be null");
        }
    }

    /**
     * 기본 정책 생성.
     *
     * @return 기본값으로 채운 Policy
     */
    public static Policy defaults() {
        return new Policy(true, 5.0, 3, OperatingHours.ALWAYS, null, 15, 500.0,
            AllowedSources.all(), true, HealthRemediationMode.RESTART_THEN_SCALE);
    }

    /**
     * 부분 변경 적용.
     *
     * <p>patch에서 null인 항목은 현재 값을 유지합니다.</p>
     *
     * @param patch 변경 항목
     * @return 병합된 새 Policy
     * @throws IllegalArgumentException patch가 null이거나 병합 결과가 유효하지 않은 경우
     */
    public Policy merge(PolicyPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        return new Policy(
            patch.enabled() != null ? patch.enabled() : enabled,
            patch.autoApproveThresholdUsd() != null ? patch.autoApproveThresholdUsd() : autoApproveThresholdUsd,
            patch.maxConcurrentRuns() != null ? patch.maxConcurrentRuns() : maxConcurrentRuns,
            patch.operatingHours() != null ? patch.operatingHours() : operatingHours,
            patch.customHours() != null ? patch.customHours() : customHours,
            patch.stallTimeoutMinutes() != null ? patch.stallTimeoutMinutes() : stallTimeoutMinutes,
            patch.monthlyBudgetCapUsd() != null ? patch.monthlyBudgetCapUsd() : monthlyBudgetCapUsd,
            patch.allowedSources() != null ? patch.allowedSources() : allowedSources,
            patch.autoWireEnabled() != null ? patch.autoWireEnabled() : autoWireEnabled,
            patch.healthRemediationMode() != null ? patch.healthRemediationMode() : healthRemediationMode
        );
    }

    /**
     * stallTimeoutMinutes를 밀리초로 변환.
     */
    public long stallTimeoutMs() {
        return stallTimeoutMinutes * 60_000L;
    }

    /**
     * 주어진 시각이 운영 시간 내인지 확인.
     */
    public boolean isWithinOperatingHours(ZonedDateTime now) {
        return operatingHours.isOpen(now, customHours);
    }

    public Policy withEnabled(boolean enabled) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withAutoApproveThresholdUsd(double autoApproveThresholdUsd) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withMaxConcurrentRuns(int maxConcurrentRuns) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withOperatingHours(OperatingHours operatingHours, CustomHours customHours) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withStallTimeoutMinutes(long stallTimeoutMinutes) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withMonthlyBudgetCapUsd(double monthlyBudgetCapUsd) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public Policy withAllowedSources(AllowedSources allowedSources) {
        return new Policy(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }
}
