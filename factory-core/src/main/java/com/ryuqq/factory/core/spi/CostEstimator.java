package com.ryuqq.factory.core.spi;

import com.ryuqq.factory.core.model.CostEstimate;

/**
 * Cost estimation SPI.
 *
 * <p>Pure function from a scope description to a token/cost estimate. Called once per
 * Manifest while it is built.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CostEstimator {

    /**
     * Estimates the cost of delivering the given scope.
     *
     * @param scope non-blank scope description
     * @return estimate (never null)
     */
    CostEstimate estimate(String scope);
}
