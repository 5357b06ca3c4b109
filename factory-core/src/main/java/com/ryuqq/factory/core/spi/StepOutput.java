package com.ryuqq.factory.core.spi;

/**
 * Output of one Develop step.
 *
 * @param path where the artifact was written, or null to let the engine assign one
 * @param content produced content (hashed into the artifact record)
 * @param tokensUsed tokens the executor spent on the step, or null when it does not report usage
 *                   (the engine then charges the step's share of the planned Develop tokens)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record StepOutput(String path, String content, Long tokensUsed) {

    public StepOutput {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (tokensUsed != null && tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed cannot be negative (current: " + tokensUsed + ")");
        }
    }

    public StepOutput(String path, String content) {
        this(path, content, null);
    }

    public static StepOutput of(String content) {
        return new StepOutput(null, content, null);
    }

    public StepOutput withTokensUsed(long tokensUsed) {
        return new StepOutput(path, content, tokensUsed);
    }

    public boolean reportsUsage() {
        return tokensUsed != null;
    }
}
