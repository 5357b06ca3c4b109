package com.ryuqq.factory.adapter.runner;

/**
 * StallDetector 설정 (불변 record).
 *
 * <p>정체 판정 기준 시간은 Policy의 stallTimeoutMinutes를 따르고, 이 설정은
 * 정체 이후의 처리만 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>strategy: 정체 처리 전략 (기본 MARK_STALLED)</li>
 *   <li>expiryGraceMs: EXPIRE 전략에서 STALLED 이후 FAILED까지의 유예 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 * @param strategy 정체 처리 전략 (null이 아니어야 함)
 * @param expiryGraceMs 만료 유예 시간 (밀리초, 양수여야 함)
 */
public record StallDetectorConfig(StallStrategy strategy, long expiryGraceMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: strategy=MARK_STALLED, expiryGraceMs=3600000ms (1시간)</p>
     */
    public StallDetectorConfig() {
        this(StallStrategy.MARK_STALLED, 3600000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StallDetectorConfig {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (expiryGraceMs <= 0) {
            throw new IllegalArgumentException(
                "expiryGraceMs must be positive (current: " + expiryGraceMs + ")"
            );
        }
    }

    public StallDetectorConfig withStrategy(StallStrategy strategy) {
        return new StallDetectorConfig(strategy, expiryGraceMs);
    }

    public StallDetectorConfig withExpiryGraceMs(long expiryGraceMs) {
        return new StallDetectorConfig(strategy, expiryGraceMs);
    }
}
