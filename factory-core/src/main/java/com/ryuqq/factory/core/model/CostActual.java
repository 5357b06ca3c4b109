package com.ryuqq.factory.core.model;

/**
 * Run의 실제 누적 비용.
 *
 * <p>{@link #plus(long, double)}로만 증가하며 감소하지 않습니다.</p>
 *
 * @param totalTokens 누적 토큰
 * @param totalUsd 누적 비용 (USD)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record CostActual(long totalTokens, double totalUsd) {

    public static final CostActual ZERO = new CostActual(0, 0.0);

    public CostActual {
        if (totalTokens < 0 || totalUsd < 0) {
            throw new IllegalArgumentException(
                "cost cannot be negative (tokens: " + totalTokens + ", usd: " + totalUsd + ")");
        }
    }

    /**
     * 비용 누적.
     *
     * @param tokens 추가 토큰 (0 이상)
     * @param usd 추가 비용 (0 이상)
     * @return 누적된 새 인스턴스
     * @throws IllegalArgumentException 음수 증분인 경우
     */
    public CostActual plus(long tokens, double usd) {
        if (tokens < 0 || usd < 0) {
            throw new IllegalArgumentException(
                "cost delta cannot be negative (tokens: " + tokens + ", usd: " + usd + ")");
        }
        return new CostActual(totalTokens + tokens, totalUsd + usd);
    }
}
