package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.adapter.inmemory.queue.InMemoryEventQueue;
import com.ryuqq.factory.adapter.inmemory.store.InMemoryStore;
import com.ryuqq.factory.application.controller.IngestResult;
import com.ryuqq.factory.core.model.EventSource;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;
import com.ryuqq.factory.testkit.clock.MutableClock;
import com.ryuqq.factory.testkit.fixture.FactoryFixtures;
import com.ryuqq.factory.testkit.stub.RecordingStepExecutor;
import com.ryuqq.factory.testkit.stub.StubContextRetriever;
import com.ryuqq.factory.testkit.stub.StubCostEstimator;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * FactoryAssembly 테스트.
 *
 * @author Factory Team
 * @since 1.0.0
 */
class FactoryAssemblyTest {

    @Test
    void build_설정한_봉인_주체와_이력_용량이_반영됨() {
        // given
        InMemoryStore store = new InMemoryStore();
        AlwaysOnController controller = FactoryAssembly.builder(store, new InMemoryEventQueue())
            .costEstimator(new StubCostEstimator(10_000, 0.03))
            .contextRetriever(StubContextRetriever.empty())
            .stepExecutor(new RecordingStepExecutor())
            .controllerConfig(new ControllerConfig().withSealedBy("night-shift").withCompletedHistoryCapacity(1))
            .clock(new MutableClock(FactoryFixtures.T0))
            .build();

        // when
        IngestResult first = controller.ingestEvent(
            FactoryFixtures.event("evt-1", EventSource.TICKET, Map.of("scope", "First")));
        IngestResult second = controller.ingestEvent(
            FactoryFixtures.event("evt-2", EventSource.TICKET, Map.of("scope", "Second")));

        // then
        Run latest = controller.getRun(second.getRunIdOrNull());
        assertThat(latest.getReceipt().orElseThrow().getSealedBy()).isEqualTo("night-shift");
        assertThat(store.findRun(first.getRunIdOrNull())).isEmpty();
        assertThat(controller.getStatus().recentCompletions()).hasSize(1);
    }

    @Test
    void build_거부된_Run도_이력_용량을_넘으면_Store에서_삭제() {
        // given
        InMemoryStore store = new InMemoryStore();
        AlwaysOnController controller = FactoryAssembly.builder(store, new InMemoryEventQueue())
            .costEstimator(new StubCostEstimator(2_500_000, 7.5))
            .contextRetriever(StubContextRetriever.empty())
            .stepExecutor(new RecordingStepExecutor())
            .controllerConfig(new ControllerConfig().withCompletedHistoryCapacity(1))
            .clock(new MutableClock(FactoryFixtures.T0))
            .build();
        RunId first = controller.ingestEvent(
            FactoryFixtures.event("evt-1", EventSource.TICKET, Map.of("scope", "First"))).getRunIdOrNull();
        RunId second = controller.ingestEvent(
            FactoryFixtures.event("evt-2", EventSource.TICKET, Map.of("scope", "Second"))).getRunIdOrNull();

        // when
        controller.rejectRun(first, "Out of scope");
        controller.rejectRun(second, "Out of scope");

        // then
        assertThat(store.findRun(first)).isEmpty();
        assertThat(store.findRun(second)).isPresent();
        assertThat(store.listRuns()).hasSize(1);
    }

    @Test
    void build_토큰_단가를_엔진에_전달() {
        // given
        AlwaysOnController controller = FactoryAssembly.builder(new InMemoryStore(), new InMemoryEventQueue())
            .costEstimator(new StubCostEstimator(10_000, 0.1))
            .contextRetriever(StubContextRetriever.empty())
            .stepExecutor(new RecordingStepExecutor())
            .controllerConfig(new ControllerConfig().withUsdPer1kTokens(0.01))
            .clock(new MutableClock(FactoryFixtures.T0))
            .build();

        // when
        IngestResult result = controller.ingestEvent(
            FactoryFixtures.event("evt-1", EventSource.TICKET, Map.of("scope", "Priced")));

        // then
        Run run = controller.getRun(result.getRunIdOrNull());
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCostActual().totalUsd()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void build_필수_구성_요소가_없으면_예외() {
        FactoryAssembly assembly = FactoryAssembly.builder(new InMemoryStore(), new InMemoryEventQueue());

        assertThatThrownBy(assembly::build)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("required");
    }

    @Test
    void controllerConfig_토큰_단가가_0이면_예외() {
        assertThatThrownBy(() -> new ControllerConfig().withUsdPer1kTokens(0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("usdPer1kTokens must be positive");
        assertThat(new ControllerConfig().usdPer1kTokens()).isEqualTo(ControllerConfig.DEFAULT_USD_PER_1K_TOKENS);
    }

    @Test
    void builder_store가_null이면_예외() {
        assertThatThrownBy(() -> FactoryAssembly.builder(null, new InMemoryEventQueue()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
