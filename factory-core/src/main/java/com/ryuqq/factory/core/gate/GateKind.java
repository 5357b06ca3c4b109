package com.ryuqq.factory.core.gate;

import com.ryuqq.factory.core.model.CostActual;
import com.ryuqq.factory.core.model.CostEstimate;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.spi.VerificationCheck;

import java.util.Locale;

/**
 * Hone 단계의 검증 게이트 (닫힌 집합, 선언 순서 = 평가 순서).
 *
 * <p>COST_ACCURACY를 제외한 게이트는 {@link VerificationCheck}에 위임합니다.
 * COST_ACCURACY는 현재 시도의 실제 비용과 추정 비용의 편차로 직접 계산합니다.</p>
 *
 * <pre>
 * variance = |actual - estimated| / estimated   (estimated == 0 이면 0)
 * passed   = variance &lt;= 15%
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum GateKind {

    CODE_QUALITY("code_quality"),
    TEST_PRESENCE("test_presence"),
    SECURITY("security"),
    PERFORMANCE("performance"),
    ACCESSIBILITY("accessibility"),
    RESPONSIVENESS("responsiveness"),
    BRAND_COMPLIANCE("brand_compliance"),

    COST_ACCURACY("cost_accuracy") {
        @Override
        public GateResult evaluate(Run run, VerificationCheck check) {
            if (run == null) {
                throw new IllegalArgumentException("run cannot be null");
            }
            CostEstimate estimate = run.getManifest().costEstimate();
            CostActual actual = run.getAttemptCost();
            double variance = variance(estimate.totalUsd(), actual.totalUsd());
            boolean passed = variance <= MAX_COST_VARIANCE;
            String evidence = String.format(Locale.ROOT,
                "Estimated $%.4f, actual $%.4f (variance %.1f%%)",
                estimate.totalUsd(), actual.totalUsd(), variance * 100);
            return new GateResult(this, passed, 1.0 - Math.min(variance, 1.0), evidence, null);
        }
    };

    /** 비용 정확도 게이트의 허용 편차 (15%). */
    public static final double MAX_COST_VARIANCE = 0.15;

    private final String wireName;

    GateKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 게이트 평가.
     *
     * @param run 평가 대상 Run
     * @param check 위임할 검증 체크
     * @return 게이트 결과
     * @throws IllegalArgumentException run 또는 check가 null인 경우
     */
    public GateResult evaluate(Run run, VerificationCheck check) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (check == null) {
            throw new IllegalArgumentException("check cannot be null");
        }
        CheckVerdict verdict = check.verify(this, run);
        if (verdict == null) {
            throw new IllegalStateException("VerificationCheck returned null verdict for " + this);
        }
        return GateResult.of(this, verdict);
    }

    /**
     * 추정 대비 실제 비용 편차 (비율).
     *
     * @param estimatedUsd 추정 비용
     * @param actualUsd 실제 비용
     * @return 편차 비율 (0.1 = 10%), 추정이 0이면 0
     */
    public static double variance(double estimatedUsd, double actualUsd) {
        if (estimatedUsd <= 0) {
            return 0.0;
        }
        return Math.abs(actualUsd - estimatedUsd) / estimatedUsd;
    }

    public static int count() {
        return values().length;
    }
}
