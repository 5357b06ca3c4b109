package com.ryuqq.factory.testkit.stub;

import com.ryuqq.factory.core.model.CostEstimate;
import com.ryuqq.factory.core.spi.CostEstimator;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CostEstimator stub returning a configurable estimate and recording requested scopes.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class StubCostEstimator implements CostEstimator {

    private volatile CostEstimate estimate;
    private final List<String> scopes = new CopyOnWriteArrayList<>();

    public StubCostEstimator(long totalTokens, double totalUsd) {
        this.estimate = new CostEstimate(totalTokens, totalUsd, 0.0);
    }

    public void setEstimate(long totalTokens, double totalUsd) {
        this.estimate = new CostEstimate(totalTokens, totalUsd, 0.0);
    }

    @Override
    public CostEstimate estimate(String scope) {
        scopes.add(scope);
        return estimate;
    }

    public List<String> getScopes() {
        return List.copyOf(scopes);
    }
}
