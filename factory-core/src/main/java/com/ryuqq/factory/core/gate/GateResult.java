package com.ryuqq.factory.core.gate;

/**
 * 게이트 하나의 평가 결과.
 *
 * @param gate 게이트 종류
 * @param passed 통과 여부
 * @param score 점수 (없으면 null)
 * @param evidence 판정 근거
 * @param details 상세 내용 (없으면 null)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record GateResult(GateKind gate, boolean passed, Double score, String evidence, String details) {

    public GateResult {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (evidence == null) {
            throw new IllegalArgumentException("evidence cannot be null");
        }
    }

    static GateResult of(GateKind gate, CheckVerdict verdict) {
        return new GateResult(gate, verdict.passed(), verdict.score(), verdict.evidence(), verdict.details());
    }
}
