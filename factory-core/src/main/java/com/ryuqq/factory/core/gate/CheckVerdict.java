package com.ryuqq.factory.core.gate;

/**
 * 외부 검증 체크의 판정.
 *
 * @param passed 통과 여부
 * @param score 점수 (없으면 null)
 * @param evidence 판정 근거 (한 줄)
 * @param details 상세 내용 (없으면 null)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record CheckVerdict(boolean passed, Double score, String evidence, String details) {

    public CheckVerdict {
        if (evidence == null || evidence.isBlank()) {
            throw new IllegalArgumentException("evidence cannot be null or blank");
        }
    }

    public static CheckVerdict pass(String evidence) {
        return new CheckVerdict(true, null, evidence, null);
    }

    public static CheckVerdict fail(String evidence) {
        return new CheckVerdict(false, null, evidence, null);
    }
}
