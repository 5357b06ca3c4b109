package com.ryuqq.factory.core.spi;

import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.RunId;

/**
 * Context handed to a {@link StepExecutor} with each Develop step.
 *
 * @param runId run being developed
 * @param manifest manifest of the run
 * @param wave 1-based wave number
 * @param attempt develop attempt (0 for the first pass, then the retry count)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record StepContext(RunId runId, Manifest manifest, int wave, int attempt) {

    public StepContext {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (wave < 1) {
            throw new IllegalArgumentException("wave must be positive (current: " + wave + ")");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
    }
}
