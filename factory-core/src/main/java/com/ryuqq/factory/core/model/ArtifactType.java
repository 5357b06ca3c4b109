package com.ryuqq.factory.core.model;

import java.util.Locale;

/**
 * Develop 단계 산출물 분류.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum ArtifactType {
    CODE,
    CONFIG,
    WORKFLOW,
    INTEGRATION,
    TEST;

    /**
     * 스텝 설명의 키워드로 산출물 종류 분류.
     *
     * <p>판단 순서: test → config/nginx/docker → workflow/wire → api/integration/mcp → 그 외 CODE</p>
     *
     * @param step 스텝 설명
     * @return 분류 결과
     */
    public static ArtifactType classify(String step) {
        if (step == null) {
            return CODE;
        }
        String lower = step.toLowerCase(Locale.ROOT);
        if (lower.contains("test")) {
            return TEST;
        }
        if (lower.contains("config") || lower.contains("nginx") || lower.contains("docker")) {
            return CONFIG;
        }
        if (lower.contains("workflow") || lower.contains("wire")) {
            return WORKFLOW;
        }
        if (lower.contains("api") || lower.contains("integration") || lower.contains("mcp")) {
            return INTEGRATION;
        }
        return CODE;
    }
}
