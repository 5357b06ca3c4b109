package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.core.manifest.ManifestBuilder;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.spi.ContextRetriever;
import com.ryuqq.factory.core.spi.CostEstimator;
import com.ryuqq.factory.core.spi.EventQueue;
import com.ryuqq.factory.core.spi.StepExecutor;
import com.ryuqq.factory.core.spi.Store;
import com.ryuqq.factory.core.spi.VerificationCheck;

import java.time.Clock;

/**
 * Runner 구성 요소 조립.
 *
 * <p>ControllerConfig의 이력 용량, 봉인 주체, 토큰 단가를 엔진에 전달하고,
 * 같은 Clock을 모든 구성 요소가 공유하도록 AlwaysOnController를 만듭니다.</p>
 *
 * <pre>{@code
 * AlwaysOnController controller = FactoryAssembly.builder(store, queue)
 *     .costEstimator(estimator)
 *     .contextRetriever(retriever)
 *     .stepExecutor(executor)
 *     .build();
 * controller.start();
 * }</pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class FactoryAssembly {

    private final Store store;
    private final EventQueue queue;
    private CostEstimator costEstimator;
    private ContextRetriever contextRetriever;
    private StepExecutor stepExecutor;
    private VerificationCheck verificationCheck = new ArtifactHeuristicCheck();
    private Policy policy = Policy.defaults();
    private ControllerConfig controllerConfig = new ControllerConfig();
    private StallDetectorConfig stallDetectorConfig = new StallDetectorConfig();
    private Clock clock = Clock.systemUTC();

    private FactoryAssembly(Store store, EventQueue queue) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        this.store = store;
        this.queue = queue;
    }

    public static FactoryAssembly builder(Store store, EventQueue queue) {
        return new FactoryAssembly(store, queue);
    }

    public FactoryAssembly costEstimator(CostEstimator costEstimator) {
        this.costEstimator = costEstimator;
        return this;
    }

    public FactoryAssembly contextRetriever(ContextRetriever contextRetriever) {
        this.contextRetriever = contextRetriever;
        return this;
    }

    public FactoryAssembly stepExecutor(StepExecutor stepExecutor) {
        this.stepExecutor = stepExecutor;
        return this;
    }

    /**
     * 게이트 검사기 교체 (기본: {@link ArtifactHeuristicCheck}).
     */
    public FactoryAssembly verificationCheck(VerificationCheck verificationCheck) {
        this.verificationCheck = verificationCheck;
        return this;
    }

    public FactoryAssembly policy(Policy policy) {
        this.policy = policy;
        return this;
    }

    public FactoryAssembly controllerConfig(ControllerConfig controllerConfig) {
        this.controllerConfig = controllerConfig;
        return this;
    }

    public FactoryAssembly stallDetectorConfig(StallDetectorConfig stallDetectorConfig) {
        this.stallDetectorConfig = stallDetectorConfig;
        return this;
    }

    public FactoryAssembly clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Controller 생성 (스케줄러는 시작하지 않음).
     *
     * @return 조립된 AlwaysOnController
     * @throws IllegalArgumentException 필수 구성 요소가 빠진 경우
     */
    public AlwaysOnController build() {
        if (costEstimator == null || contextRetriever == null || stepExecutor == null) {
            throw new IllegalArgumentException("costEstimator, contextRetriever and stepExecutor are required");
        }
        if (verificationCheck == null || policy == null || clock == null) {
            throw new IllegalArgumentException("verificationCheck, policy and clock cannot be null");
        }
        if (controllerConfig == null || stallDetectorConfig == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }

        CompletedRunHistory history = new CompletedRunHistory(controllerConfig.completedHistoryCapacity(), store);
        DefaultPipelineEngine engine = new DefaultPipelineEngine(store, contextRetriever, stepExecutor,
            verificationCheck, history, clock, controllerConfig.sealedBy(), controllerConfig.usdPer1kTokens());
        StallDetector stallDetector = new StallDetector(engine, clock, stallDetectorConfig);
        return new AlwaysOnController(new ManifestBuilder(costEstimator, clock), engine, store, queue,
            new PolicyHolder(policy), new SpendLedger(clock), stallDetector, controllerConfig, clock);
    }
}
