package com.ryuqq.factory.core.model;

/**
 * 비용 추정 결과.
 *
 * @param totalTokens 예상 토큰 수 (0 이상)
 * @param totalUsd 예상 비용 (USD, 0 이상)
 * @param discountPct 할인율 (%, 0~100)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record CostEstimate(long totalTokens, double totalUsd, double discountPct) {

    public CostEstimate {
        if (totalTokens < 0) {
            throw new IllegalArgumentException("totalTokens must be non-negative (current: " + totalTokens + ")");
        }
        if (totalUsd < 0) {
            throw new IllegalArgumentException("totalUsd must be non-negative (current: " + totalUsd + ")");
        }
        if (discountPct < 0 || discountPct > 100) {
            throw new IllegalArgumentException("discountPct must be between 0 and 100 (current: " + discountPct + ")");
        }
    }
}
