package com.ryuqq.factory.adapter.runner;

/**
 * AlwaysOnController 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 폴링 주기 (기본 30000ms = 30초)</li>
 *   <li>completedHistoryCapacity: 완료 이력 보관 개수 (기본 100)</li>
 *   <li>recentCompletionsLimit: 상태 보고에 포함할 최근 완료 개수 (기본 5)</li>
 *   <li>sealedBy: Receipt 봉인 주체 (기본 "factory-controller")</li>
 *   <li>usdPer1kTokens: 실제 비용 산정 단가 (기본 $0.003 / 1K 토큰)</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 * @param pollIntervalMs 폴링 주기 (밀리초, 양수여야 함)
 * @param completedHistoryCapacity 완료 이력 보관 개수 (1 이상이어야 함)
 * @param recentCompletionsLimit 최근 완료 개수 (0 이상이어야 함)
 * @param sealedBy Receipt 봉인 주체 (빈 문자열 불가)
 * @param usdPer1kTokens 1K 토큰당 실제 비용 (양수여야 함)
 */
public record ControllerConfig(
    long pollIntervalMs,
    int completedHistoryCapacity,
    int recentCompletionsLimit,
    String sealedBy,
    double usdPer1kTokens
) {

    /** 기본 토큰 단가 ($/1K 토큰). */
    public static final double DEFAULT_USD_PER_1K_TOKENS = 0.003;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=30000ms, completedHistoryCapacity=100,
     * recentCompletionsLimit=5, sealedBy="factory-controller", usdPer1kTokens=0.003</p>
     */
    public ControllerConfig() {
        this(30000, 100, 5, "factory-controller", DEFAULT_USD_PER_1K_TOKENS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ControllerConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (completedHistoryCapacity <= 0) {
            throw new IllegalArgumentException(
                "completedHistoryCapacity must be positive (current: " + completedHistoryCapacity + ")"
            );
        }
        if (recentCompletionsLimit < 0) {
            throw new IllegalArgumentException(
                "recentCompletionsLimit cannot be negative (current: " + recentCompletionsLimit + ")"
            );
        }
        if (sealedBy == null || sealedBy.isBlank()) {
            throw new IllegalArgumentException("sealedBy cannot be null or blank");
        }
        if (!(usdPer1kTokens > 0)) {
            throw new IllegalArgumentException(
                "usdPer1kTokens must be positive (current: " + usdPer1kTokens + ")"
            );
        }
    }

    public ControllerConfig withPollIntervalMs(long pollIntervalMs) {
        return new ControllerConfig(pollIntervalMs, completedHistoryCapacity, recentCompletionsLimit, sealedBy, usdPer1kTokens);
    }

    public ControllerConfig withCompletedHistoryCapacity(int completedHistoryCapacity) {
        return new ControllerConfig(pollIntervalMs, completedHistoryCapacity, recentCompletionsLimit, sealedBy, usdPer1kTokens);
    }

    public ControllerConfig withRecentCompletionsLimit(int recentCompletionsLimit) {
        return new ControllerConfig(pollIntervalMs, completedHistoryCapacity, recentCompletionsLimit, sealedBy, usdPer1kTokens);
    }

    public ControllerConfig withSealedBy(String sealedBy) {
        return new ControllerConfig(pollIntervalMs, completedHistoryCapacity, recentCompletionsLimit, sealedBy, usdPer1kTokens);
    }

    public ControllerConfig withUsdPer1kTokens(double usdPer1kTokens) {
        return new ControllerConfig(pollIntervalMs, completedHistoryCapacity, recentCompletionsLimit, sealedBy,
            usdPer1kTokens);
    }
}
