package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.adapter.inmemory.store.InMemoryStore;
import com.ryuqq.factory.core.exception.PhaseExecutionException;
import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.model.ArtifactType;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.DevelopResult;
import com.ryuqq.factory.core.model.ExecutionPlan;
import com.ryuqq.factory.core.model.HoneResult;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Phase;
import com.ryuqq.factory.core.model.PhasePlan;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;
import com.ryuqq.factory.testkit.clock.MutableClock;
import com.ryuqq.factory.testkit.fixture.FactoryFixtures;
import com.ryuqq.factory.testkit.stub.RecordingStepExecutor;
import com.ryuqq.factory.testkit.stub.ScriptedVerificationCheck;
import com.ryuqq.factory.testkit.stub.StubContextRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * DefaultPipelineEngine 테스트.
 *
 * <p>InMemoryStore와 testkit 스텁으로 실제 단계 흐름을 검증합니다:</p>
 * <ul>
 *   <li>단계별 상태 전이와 토큰 단가 기반 비용 누적</li>
 *   <li>웨이브 분할, 산출물 해시</li>
 *   <li>게이트 실패 시 재시도 상한</li>
 *   <li>협력자 예외 시 FAILED</li>
 *   <li>승인/거부/일시정지</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
class DefaultPipelineEngineTest {

    private MutableClock clock;
    private InMemoryStore store;
    private StubContextRetriever retriever;
    private RecordingStepExecutor executor;
    private ScriptedVerificationCheck check;
    private CompletedRunHistory history;
    private DefaultPipelineEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FactoryFixtures.T0);
        store = new InMemoryStore();
        retriever = new StubContextRetriever(List.of("pattern-a", "pattern-b"), 0.8);
        executor = new RecordingStepExecutor();
        check = ScriptedVerificationCheck.allPass();
        history = new CompletedRunHistory(100, store);
        engine = newEngine();
    }

    private DefaultPipelineEngine newEngine() {
        return new DefaultPipelineEngine(store, retriever, executor, check, history, clock, "factory-controller",
            FactoryFixtures.USD_PER_1K_TOKENS);
    }

    private Manifest manifest() {
        return FactoryFixtures.manifest("manifest-1", ChamberId.of("chamber-1"));
    }

    private Manifest manifestEstimatedAt(double estimatedUsd) {
        return FactoryFixtures.manifest("manifest-1", ChamberId.of("chamber-1"), estimatedUsd);
    }

    private Manifest withApproval(Manifest m) {
        return new Manifest(m.id(), m.triggerEventId(), m.triggerSource(), m.chamberId(), m.ownerId(), m.scope(),
            m.constraints(), m.dependencies(), m.risks(), m.plan(), m.costEstimate(), true, m.priority(),
            m.createdAt());
    }

    private Manifest withDevelopSteps(Manifest m, List<String> steps) {
        ExecutionPlan plan = new ExecutionPlan(m.plan().foster(),
            new PhasePlan(steps, m.plan().develop().estimatedTokens(), m.plan().develop().executors()),
            m.plan().hone());
        return new Manifest(m.id(), m.triggerEventId(), m.triggerSource(), m.chamberId(), m.ownerId(), m.scope(),
            m.constraints(), m.dependencies(), m.risks(), plan, m.costEstimate(), m.approvalRequired(),
            m.priority(), m.createdAt());
    }

    private RunId startAndFoster() {
        Run run = engine.startRun(manifest());
        engine.executeFoster(run.getId());
        return run.getId();
    }

    // ============================================================
    // 1. startRun
    // ============================================================

    @Test
    void startRun_승인_불필요하면_APPROVED로_시작() {
        // when
        Run run = engine.startRun(manifest());

        // then
        assertThat(run.getStatus()).isEqualTo(RunStatus.APPROVED);
        assertThat(run.getMaxRetries()).isEqualTo(3);
        assertThat(run.getRetryCount()).isZero();
        assertThat(store.findRun(run.getId())).isPresent();
        assertThat(store.findManifest("manifest-1")).isPresent();
    }

    @Test
    void startRun_승인_필요하면_AWAITING_APPROVAL로_대기() {
        // when
        Run run = engine.startRun(withApproval(manifest()));

        // then
        assertThat(run.getStatus()).isEqualTo(RunStatus.AWAITING_APPROVAL);
        assertThat(engine.pendingApprovals()).containsExactly(run);
        assertThat(engine.activeRuns()).containsExactly(run);
    }

    // ============================================================
    // 2. 단계 실행
    // ============================================================

    @Test
    void executeFoster_컨텍스트와_요구사항을_기록하고_Foster_비용만_누적() {
        // given
        Run run = engine.startRun(manifest());

        // when
        var result = engine.executeFoster(run.getId());

        // then
        assertThat(result.relatedPatterns()).containsExactly("pattern-a", "pattern-b");
        assertThat(result.relevance()).isEqualTo(0.8);
        assertThat(result.requirements()).containsEntry("scope", "scope of manifest-1")
            .containsEntry("eventSource", "ticket");
        assertThat(run.getStatus()).isEqualTo(RunStatus.FOSTER_COMPLETE);
        assertThat(run.getCostActual().totalTokens()).isEqualTo(150);
        assertThat(run.getCostActual().totalUsd()).isCloseTo(0.00045, within(1e-12));
        assertThat(retriever.getCalls()).isEqualTo(1);
    }

    @Test
    void executeDevelop_스텝마다_해시된_산출물과_웨이브_로그를_남김() {
        // given
        RunId runId = startAndFoster();

        // when
        DevelopResult result = engine.executeDevelop(runId);

        // then
        assertThat(result.artifacts()).hasSize(2);
        assertThat(result.artifacts().get(0).type()).isEqualTo(ArtifactType.CODE);
        assertThat(result.artifacts().get(0).path())
            .isEqualTo("artifacts/" + runId.getValue() + "/implement_solution");
        assertThat(result.artifacts().get(1).type()).isEqualTo(ArtifactType.TEST);
        assertThat(result.artifacts().get(0).hash())
            .isEqualTo(DefaultPipelineEngine.sha256("Implement solution @attempt 0 for " + runId))
            .hasSize(64);
        assertThat(result.buildLog()).containsExactly(
            "[Wave 1/1] Executing: Implement solution, Write tests",
            "[Wave 1/1] Complete - 2 artifacts produced");
        assertThat(result.wavesCompleted()).isEqualTo(1);
        assertThat(engine.getRun(runId).getStatus()).isEqualTo(RunStatus.DEVELOP_COMPLETE);
    }

    @Test
    void executeDevelop_3스텝_단위로_웨이브를_나눔() {
        // given
        List<String> steps = List.of("s1", "s2", "s3", "s4", "s5", "s6", "s7");
        Run run = engine.startRun(withDevelopSteps(manifest(), steps));
        engine.executeFoster(run.getId());

        // when
        DevelopResult result = engine.executeDevelop(run.getId());

        // then
        assertThat(result.wavesTotal()).isEqualTo(3);
        assertThat(executor.getInvocations())
            .extracting(invocation -> invocation.context().wave())
            .containsExactly(1, 1, 1, 2, 2, 2, 3);
        assertThat(result.buildLog()).hasSize(6);
    }

    @Test
    void executeHone_전체_통과하면_Receipt_봉인_후_HONE_COMPLETE() {
        // given
        RunId runId = startAndFoster();
        engine.executeDevelop(runId);

        // when
        HoneResult result = engine.executeHone(runId);

        // then
        assertThat(result.allPassed()).isTrue();
        assertThat(result.gateScore()).isEqualTo(8);
        assertThat(result.gateResults()).hasSize(GateKind.count());
        assertThat(result.sealedReceipt()).isNotNull();
        assertThat(engine.getRun(runId).getStatus()).isEqualTo(RunStatus.HONE_COMPLETE);
        // Receipt는 completeRun에서만 부착
        assertThat(engine.getRun(runId).getReceipt()).isEmpty();
    }

    @Test
    void completeRun_Receipt를_부착하고_저장하고_이력에_추가() {
        // given
        RunId runId = startAndFoster();
        engine.executeDevelop(runId);
        engine.executeHone(runId);
        clock.advance(Duration.ofSeconds(5));

        // when
        Run run = engine.completeRun(runId);

        // then
        Receipt receipt = run.getReceipt().orElseThrow();
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCompletedAt()).contains(FactoryFixtures.T0.plusSeconds(5));
        assertThat(receipt.getGatesPassed()).hasSize(8);
        assertThat(receipt.getGatesFailed()).isEmpty();
        assertThat(receipt.getArtifacts()).hasSize(2);
        assertThat(receipt.getVarianceFromEstimate()).isEqualTo("+0.0%");
        assertThat(receipt.getSealedBy()).isEqualTo("factory-controller");
        assertThat(store.findReceipt(runId)).containsSame(receipt);
        assertThat(run.getCostActual().totalTokens()).isEqualTo(1000);
        assertThat(run.getCostActual().totalUsd()).isCloseTo(0.003, within(1e-12));
        assertThat(engine.recentCompletions(5)).containsExactly(run);
        assertThat(engine.activeRuns()).isEmpty();
    }

    @Test
    void executeDevelop_스텝이_보고한_토큰으로_과금하고_미보고_스텝은_계획_몫으로_과금() {
        // given
        executor.reportTokens("Implement solution", 500);
        RunId runId = startAndFoster();

        // when
        engine.executeDevelop(runId);

        // then
        // Foster 150 + 보고 500 + 미보고 1/2 * 650
        Run run = engine.getRun(runId);
        assertThat(run.getCostActual().totalTokens()).isEqualTo(150 + 500 + 325);
        assertThat(run.getCostActual().totalUsd()).isCloseTo(0.975 * 0.003, within(1e-12));
    }

    @Test
    void 실제_비용은_추정_비용과_무관하게_토큰_단가로_산정() {
        // given
        Run run = engine.startRun(manifestEstimatedAt(1.0));

        // when
        engine.executeFoster(run.getId());

        // then
        assertThat(run.getCostActual().totalUsd()).isCloseTo(0.00045, within(1e-12));
    }

    // ============================================================
    // 3. 게이트 실패와 재시도
    // ============================================================

    @Test
    void executeHone_실패_후_재시도에서_통과하면_retryCount는_1() {
        // given
        check.failOnAttempt(0, GateKind.SECURITY, GateKind.PERFORMANCE);
        RunId runId = startAndFoster();
        engine.executeDevelop(runId);

        // when
        HoneResult first = engine.executeHone(runId);

        // then
        assertThat(first.allPassed()).isFalse();
        assertThat(first.gateScore()).isEqualTo(6);
        assertThat(first.failedGates()).containsExactly(GateKind.SECURITY, GateKind.PERFORMANCE);
        assertThat(engine.getRun(runId).getStatus()).isEqualTo(RunStatus.DEVELOPING);
        assertThat(engine.getRun(runId).getRetryCount()).isEqualTo(1);

        // when
        engine.executeDevelop(runId);
        HoneResult second = engine.executeHone(runId);
        Run run = engine.completeRun(runId);

        // then
        assertThat(second.allPassed()).isTrue();
        assertThat(run.getRetryCount()).isEqualTo(1);
        assertThat(run.getReceipt().orElseThrow().getGatesFailed()).isEmpty();
        assertThat(retriever.getCalls()).isEqualTo(1);
        assertThat(executor.getInvocations())
            .extracting(invocation -> invocation.context().attempt())
            .containsExactly(0, 0, 1, 1);
    }

    @Test
    void executeHone_재시도_소진하면_FAILED와_실패_게이트_기록() {
        // given
        check.failAlways(GateKind.SECURITY, GateKind.TEST_PRESENCE);
        RunId runId = startAndFoster();

        // when
        for (int attempt = 0; attempt <= 3; attempt++) {
            engine.executeDevelop(runId);
            engine.executeHone(runId);
        }

        // then
        Run run = engine.getRun(runId);
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getRetryCount()).isEqualTo(3);
        assertThat(run.getError())
            .contains("Verification failed after 3 retries. Failed gates: TEST_PRESENCE, SECURITY");
        assertThat(run.getReceipt()).isEmpty();
        assertThat(store.findReceipt(runId)).isEmpty();
        assertThat(executor.countFor("Implement solution")).isEqualTo(4);
        assertThatThrownBy(() -> engine.executeDevelop(runId))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void executeHone_재시도_후에도_COST_ACCURACY는_현재_시도_비용으로_판정() {
        // given
        check.failOnAttempt(0, GateKind.CODE_QUALITY);
        RunId runId = startAndFoster();
        engine.executeDevelop(runId);
        engine.executeHone(runId);
        engine.executeDevelop(runId);

        // when
        HoneResult second = engine.executeHone(runId);

        // then
        assertThat(second.resultOf(GateKind.COST_ACCURACY).orElseThrow().passed()).isTrue();
        assertThat(engine.getRun(runId).getCostActual().totalTokens()).isEqualTo(1850);
    }

    @Test
    void executeHone_추정이_실제와_어긋나면_COST_ACCURACY_실패로_재시도_소진_후_FAILED() {
        // given
        Run started = engine.startRun(manifestEstimatedAt(1.0));
        RunId runId = started.getId();
        engine.executeFoster(runId);

        // when
        HoneResult first = null;
        for (int attempt = 0; attempt <= 3; attempt++) {
            engine.executeDevelop(runId);
            HoneResult result = engine.executeHone(runId);
            if (first == null) {
                first = result;
            }
        }

        // then
        assertThat(first.failedGates()).containsExactly(GateKind.COST_ACCURACY);
        assertThat(first.resultOf(GateKind.COST_ACCURACY).orElseThrow().evidence())
            .contains("Estimated $1.0000, actual $0.0030");
        Run run = engine.getRun(runId);
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError())
            .contains("Verification failed after 3 retries. Failed gates: COST_ACCURACY");
        assertThat(engine.recentCompletions(5)).isEmpty();
        assertThat(engine.recentFailures(5)).containsExactly(run);
    }

    @Test
    void executeHone_스텝_토큰_초과_사용이면_COST_ACCURACY_실패로_Develop_재시도() {
        // given
        executor.reportTokens("Implement solution", 2_000);
        RunId runId = startAndFoster();
        engine.executeDevelop(runId);

        // when
        HoneResult first = engine.executeHone(runId);

        // then
        assertThat(first.failedGates()).containsExactly(GateKind.COST_ACCURACY);
        assertThat(engine.getRun(runId).getStatus()).isEqualTo(RunStatus.DEVELOPING);
        assertThat(engine.getRun(runId).getRetryCount()).isEqualTo(1);

        // when
        executor.reportTokens("Implement solution", 325);
        engine.executeDevelop(runId);
        HoneResult second = engine.executeHone(runId);

        // then
        assertThat(second.allPassed()).isTrue();
        assertThat(engine.completeRun(runId).getReceipt().orElseThrow().getVarianceFromEstimate())
            .isEqualTo("+0.0%");
    }

    // ============================================================
    // 4. 협력자 예외
    // ============================================================

    @Test
    void executeFoster_조회_실패하면_FAILED와_PhaseExecutionException() {
        // given
        retriever.failWith(new IllegalStateException("retrieval down"));
        Run run = engine.startRun(manifest());

        // when & then
        assertThatThrownBy(() -> engine.executeFoster(run.getId()))
            .isInstanceOf(PhaseExecutionException.class)
            .hasMessageContaining("retrieval down")
            .satisfies(e -> assertThat(((PhaseExecutionException) e).getPhase()).isEqualTo(Phase.FOSTER));
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError()).contains("retrieval down");
    }

    @Test
    void executeDevelop_스텝_실행_실패하면_재시도_없이_FAILED() {
        // given
        executor.failOn("Write tests", new RuntimeException("executor crashed"));
        RunId runId = startAndFoster();

        // when & then
        assertThatThrownBy(() -> engine.executeDevelop(runId))
            .isInstanceOf(PhaseExecutionException.class);
        Run run = engine.getRun(runId);
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError()).contains("executor crashed");
        assertThat(run.getRetryCount()).isZero();
        assertThat(engine.recentFailures(5)).containsExactly(run);
    }

    // ============================================================
    // 5. 승인 / 거부 / 일시정지
    // ============================================================

    @Test
    void approveRun_승인_대기가_아니면_예외() {
        // given
        Run run = engine.startRun(manifest());

        // when & then
        assertThatThrownBy(() -> engine.approveRun(run.getId()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cannot be approved");
    }

    @Test
    void rejectRun_사유를_그대로_기록하고_두번째_거부는_예외() {
        // given
        Run run = engine.startRun(withApproval(manifest()));

        // when
        engine.rejectRun(run.getId(), "Not this sprint");

        // then
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError()).contains("Not this sprint");
        assertThat(engine.recentFailures(5)).containsExactly(run);
        assertThat(engine.recentCompletions(5)).isEmpty();
        assertThatThrownBy(() -> engine.rejectRun(run.getId(), "again"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectRun_실행_시작_후에는_예외() {
        // given
        RunId runId = startAndFoster();

        // when & then
        assertThatThrownBy(() -> engine.rejectRun(runId, "too late"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cannot be rejected");
    }

    @Test
    void pauseRun_보류_중에는_다음_단계를_시작할_수_없고_resume하면_복귀() {
        // given
        RunId runId = startAndFoster();

        // when
        engine.pauseRun(runId);

        // then
        assertThat(engine.getRun(runId).getStatus()).isEqualTo(RunStatus.PAUSED);
        assertThatThrownBy(() -> engine.executeDevelop(runId))
            .isInstanceOf(IllegalStateException.class);

        // when
        Run resumed = engine.resumeRun(runId);

        // then
        assertThat(resumed.getStatus()).isEqualTo(RunStatus.FOSTER_COMPLETE);
        assertThat(resumed.getCurrentPhase()).isEqualTo(Phase.FOSTER);
    }

    @Test
    void getRun_알_수_없는_RunId는_예외() {
        assertThatThrownBy(() -> engine.getRun(RunId.of("missing")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unknown run");
    }
}
