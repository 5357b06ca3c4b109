package com.ryuqq.factory.core.model;

/**
 * Policy 부분 변경 요청.
 *
 * <p>null인 항목은 변경하지 않습니다. {@link Policy#merge(PolicyPatch)}로 적용합니다.</p>
 *
 * <pre>
 * Policy updated = policy.merge(PolicyPatch.empty().withMaxConcurrentRuns(5));
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record PolicyPatch(
    Boolean enabled,
    Double autoApproveThresholdUsd,
    Integer maxConcurrentRuns,
    OperatingHours operatingHours,
    CustomHours customHours,
    Long stallTimeoutMinutes,
    Double monthlyBudgetCapUsd,
    AllowedSources allowedSources,
    Boolean autoWireEnabled,
    HealthRemediationMode healthRemediationMode
) {

    /**
     * 변경 항목이 없는 패치.
     */
    public static PolicyPatch empty() {
        return new PolicyPatch(null, null, null, null, null, null, null, null, null, null);
    }

    public PolicyPatch withEnabled(Boolean enabled) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public PolicyPatch withAutoApproveThresholdUsd(Double autoApproveThresholdUsd) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public PolicyPatch withMaxConcurrentRuns(Integer maxConcurrentRuns) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public PolicyPatch withMonthlyBudgetCapUsd(Double monthlyBudgetCapUsd) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public PolicyPatch withAllowedSources(AllowedSources allowedSources) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }

    public PolicyPatch withStallTimeoutMinutes(Long stallTimeoutMinutes) {
        return new PolicyPatch(enabled, autoApproveThresholdUsd, maxConcurrentRuns, operatingHours, customHours,
            stallTimeoutMinutes, monthlyBudgetCapUsd, allowedSources, autoWireEnabled, healthRemediationMode);
    }
}
