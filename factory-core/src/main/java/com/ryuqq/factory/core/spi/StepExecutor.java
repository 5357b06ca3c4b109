package com.ryuqq.factory.core.spi;

/**
 * Work executor SPI invoked for each Develop step.
 *
 * <p>Implementations own their own timeouts. Any exception thrown here fails the Run
 * (no retry at the pipeline layer).</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepExecutor {

    /**
     * Produces the artifact for one step.
     *
     * @param step step description from the manifest's Develop plan
     * @param context run context
     * @return step output (never null)
     */
    StepOutput execute(String step, StepContext context);
}
