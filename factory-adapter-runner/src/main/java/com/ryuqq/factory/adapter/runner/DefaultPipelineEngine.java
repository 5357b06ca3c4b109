package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.application.pipeline.PipelineEngine;
import com.ryuqq.factory.core.exception.PhaseExecutionException;
import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.gate.GateResult;
import com.ryuqq.factory.core.model.Artifact;
import com.ryuqq.factory.core.model.ArtifactType;
import com.ryuqq.factory.core.model.CostActual;
import com.ryuqq.factory.core.model.DevelopResult;
import com.ryuqq.factory.core.model.FosterResult;
import com.ryuqq.factory.core.model.HoneResult;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Phase;
import com.ryuqq.factory.core.model.PhasePlan;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.spi.ContextRetriever;
import com.ryuqq.factory.core.spi.RetrievedContext;
import com.ryuqq.factory.core.spi.StepContext;
import com.ryuqq.factory.core.spi.StepExecutor;
import com.ryuqq.factory.core.spi.StepOutput;
import com.ryuqq.factory.core.spi.Store;
import com.ryuqq.factory.core.spi.VerificationCheck;
import com.ryuqq.factory.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Foster → Develop → Hone 파이프라인 기본 구현.
 *
 * <p>각 단계는 호출자(컨트롤러)가 순서대로 호출하며, 이 클래스는 다음 단계를 스스로
 * 시작하지 않습니다.</p>
 *
 * <p><strong>단계별 처리:</strong></p>
 * <pre>
 * Foster  : ContextRetriever 조회 → 요구사항 스냅샷 → Foster 계획 토큰 과금
 * Develop : 3스텝 단위 웨이브 → StepExecutor 호출 → SHA-256 해시 → 보고된 스텝 토큰 과금
 * Hone    : Hone 계획 토큰 과금 → 8개 게이트 평가
 *           전체 통과: Receipt 봉인, HONE_COMPLETE
 *           실패 + 재시도 여유: retryCount 증가, DEVELOPING (Foster 반복 없음)
 *           실패 + 재시도 소진: FAILED (실패 게이트 이름 기록)
 * </pre>
 *
 * <p><strong>실제 비용:</strong> 토큰 수에 설정된 단가(usdPer1kTokens)를 곱해 산정하며 추정치와 무관합니다.
 * Develop은 StepExecutor가 보고한 토큰을 과금하고, 보고하지 않은 스텝은 계획 토큰의 스텝당 몫으로 과금합니다.</p>
 *
 * <p><strong>협력자 예외:</strong> 단계 실행 중 협력자가 던진 예외는 재시도 없이 Run을 FAILED로
 * 만들고 {@link PhaseExecutionException}으로 전파됩니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class DefaultPipelineEngine implements PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineEngine.class);

    static final int STEPS_PER_WAVE = 3;

    private static final Set<RunStatus> REJECTABLE = EnumSet.of(
        RunStatus.PENDING, RunStatus.AWAITING_APPROVAL, RunStatus.STALLED
    );

    private final Store store;
    private final ContextRetriever contextRetriever;
    private final StepExecutor stepExecutor;
    private final VerificationCheck verificationCheck;
    private final CompletedRunHistory history;
    private final Clock clock;
    private final String sealedBy;
    private final double usdPer1kTokens;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param contextRetriever Foster 컨텍스트 조회기
     * @param stepExecutor Develop 스텝 실행기
     * @param verificationCheck Hone 게이트 검증기
     * @param history 완료 이력
     * @param clock 시각 소스
     * @param sealedBy Receipt 봉인 주체
     * @param usdPer1kTokens 1K 토큰당 실제 비용
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultPipelineEngine(
        Store store,
        ContextRetriever contextRetriever,
        StepExecutor stepExecutor,
        VerificationCheck verificationCheck,
        CompletedRunHistory history,
        Clock clock,
        String sealedBy,
        double usdPer1kTokens
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (contextRetriever == null) {
            throw new IllegalArgumentException("contextRetriever cannot be null");
        }
        if (stepExecutor == null) {
            throw new IllegalArgumentException("stepExecutor cannot be null");
        }
        if (verificationCheck == null) {
            throw new IllegalArgumentException("verificationCheck cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sealedBy == null || sealedBy.isBlank()) {
            throw new IllegalArgumentException("sealedBy cannot be null or blank");
        }
        if (!(usdPer1kTokens > 0)) {
            throw new IllegalArgumentException("usdPer1kTokens must be positive (current: " + usdPer1kTokens + ")");
        }
        this.store = store;
        this.contextRetriever = contextRetriever;
        this.stepExecutor = stepExecutor;
        this.verificationCheck = verificationCheck;
        this.history = history;
        this.clock = clock;
        this.sealedBy = sealedBy;
        this.usdPer1kTokens = usdPer1kTokens;
    }

    @Override
    public Run startRun(Manifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        Instant now = clock.instant();
        store.saveManifest(manifest);

        Run run = new Run(RunId.generate(), manifest, MAX_RETRIES, now);
        run.transitionTo(manifest.approvalRequired() ? RunStatus.AWAITING_APPROVAL : RunStatus.APPROVED, now);
        store.saveRun(run);

        log.info("Run {} started for manifest {} (status: {})", run.getId(), manifest.id(), run.getStatus());
        return run;
    }

    @Override
    public FosterResult executeFoster(RunId runId) {
        Run run = getRun(runId);
        Manifest manifest = run.getManifest();
        run.beginPhase(Phase.FOSTER, clock.instant());
        store.saveRun(run);
        log.info("Run {} entering Foster", runId);

        RetrievedContext context;
        try {
            context = contextRetriever.retrieve(manifest.scope());
        } catch (RuntimeException e) {
            throw failPhase(run, Phase.FOSTER, e);
        }
        if (context == null) {
            context = RetrievedContext.EMPTY;
        }

        Map<String, Object> requirements = new LinkedHashMap<>();
        requirements.put("scope", manifest.scope());
        requirements.put("constraints", manifest.constraints());
        requirements.put("dependencies", manifest.dependencies());
        requirements.put("risks", manifest.risks());
        requirements.put("eventSource", manifest.triggerSource().wireName());
        requirements.put("triggerEventId", manifest.triggerEventId());

        Instant now = clock.instant();
        FosterResult result = new FosterResult(context.patterns(), context.relevance(), requirements, now);
        chargePlanned(run, Phase.FOSTER, now);
        run.recordFoster(result, now);
        store.saveRun(run);

        log.info("Run {} Foster complete ({} related patterns)", runId, result.relatedPatterns().size());
        return result;
    }

    @Override
    public DevelopResult executeDevelop(RunId runId) {
        Run run = getRun(runId);
        Manifest manifest = run.getManifest();
        run.beginPhase(Phase.DEVELOP, clock.instant());
        store.saveRun(run);

        List<String> steps = manifest.plan().develop().steps();
        int attempt = run.getRetryCount();
        int totalWaves = (steps.size() + STEPS_PER_WAVE - 1) / STEPS_PER_WAVE;
        log.info("Run {} entering Develop ({} steps, {} waves, attempt {})", runId, steps.size(), totalWaves, attempt);

        List<Artifact> artifacts = new ArrayList<>();
        List<String> buildLog = new ArrayList<>();
        long reportedTokens = 0;
        int unreportedSteps = 0;
        try {
            for (int wave = 1; wave <= totalWaves; wave++) {
                List<String> waveSteps = steps.subList(
                    (wave - 1) * STEPS_PER_WAVE, Math.min(wave * STEPS_PER_WAVE, steps.size()));
                buildLog.add("[Wave " + wave + "/" + totalWaves + "] Executing: " + String.join(", ", waveSteps));

                StepContext stepContext = new StepContext(runId, manifest, wave, attempt);
                for (String step : waveSteps) {
                    StepOutput output = executeStep(step, stepContext);
                    artifacts.add(toArtifact(runId, step, output));
                    if (output.reportsUsage()) {
                        reportedTokens += output.tokensUsed();
                    } else {
                        unreportedSteps++;
                    }
                }

                buildLog.add("[Wave " + wave + "/" + totalWaves + "] Complete - "
                    + waveSteps.size() + " artifacts produced");
            }
        } catch (RuntimeException e) {
            throw failPhase(run, Phase.DEVELOP, e);
        }

        Instant now = clock.instant();
        DevelopResult result = new DevelopResult(artifacts, buildLog, totalWaves, totalWaves, attempt, now);
        long developTokens = reportedTokens
            + plannedShare(manifest.plan().develop().estimatedTokens(), unreportedSteps, steps.size());
        charge(run, Phase.DEVELOP, developTokens, now);
        run.recordDevelop(result, now);
        store.saveRun(run);

        log.info("Run {} Develop complete ({} artifacts)", runId, artifacts.size());
        return result;
    }

    @Override
    public HoneResult executeHone(RunId runId) {
        Run run = getRun(runId);
        run.beginPhase(Phase.HONE, clock.instant());
        chargePlanned(run, Phase.HONE, clock.instant());
        store.saveRun(run);
        log.info("Run {} entering Hone", runId);

        List<GateResult> gateResults = new ArrayList<>();
        try {
            for (GateKind gate : GateKind.values()) {
                gateResults.add(gate.evaluate(run, verificationCheck));
            }
        } catch (RuntimeException e) {
            throw failPhase(run, Phase.HONE, e);
        }

        int gateScore = (int) gateResults.stream().filter(GateResult::passed).count();
        boolean allPassed = gateScore == GateKind.count();
        Instant now = clock.instant();

        if (allPassed) {
            Receipt receipt = seal(run, gateResults, now);
            HoneResult result = new HoneResult(gateResults, gateScore, true, receipt, now);
            run.recordHone(result, now);
            store.saveRun(run);
            log.info("Run {} passed all {} gates, receipt {} sealed", runId, gateScore, receipt.getId());
            return result;
        }

        HoneResult result = new HoneResult(gateResults, gateScore, false, null, now);
        run.recordHone(result, now);
        if (run.getStatus().isTerminal()) {
            log.warn("Run {} ended as {} while Hone was running, gate results discarded", runId, run.getStatus());
            return result;
        }
        String failedGates = result.failedGates().stream()
            .map(GateKind::name)
            .collect(Collectors.joining(", "));

        if (run.getRetryCount() < run.getMaxRetries()) {
            run.cycleBack(now);
            log.warn("Run {} failed gates [{}], cycling back to Develop (retry {}/{})",
                runId, failedGates, run.getRetryCount(), run.getMaxRetries());
        } else {
            run.fail("Verification failed after " + run.getMaxRetries() + " retries. Failed gates: " + failedGates, now);
            log.warn("Run {} failed gates [{}] with retries exhausted", runId, failedGates);
        }
        store.saveRun(run);
        if (run.getStatus() == RunStatus.FAILED) {
            history.add(run);
        }
        return result;
    }

    @Override
    public Run completeRun(RunId runId) {
        Run run = getRun(runId);
        run.complete(clock.instant());
        Receipt receipt = run.getReceipt().orElseThrow(
            () -> new IllegalStateException("Run " + runId + " completed without receipt"));
        store.saveReceipt(receipt);
        store.saveRun(run);
        history.add(run);

        log.info("Run {} completed (cost ${}, retries {})",
            runId, String.format(Locale.ROOT, "%.4f", run.getCostActual().totalUsd()), run.getRetryCount());
        return run;
    }

    @Override
    public Run approveRun(RunId runId) {
        Run run = getRun(runId);
        RunStatus status = run.getStatus();
        if (!status.isAwaitingDecision()) {
            throw new IllegalStateException("Run " + runId + " cannot be approved from status " + status);
        }
        run.transitionTo(RunStatus.APPROVED, clock.instant());
        store.saveRun(run);
        log.info("Run {} approved", runId);
        return run;
    }

    @Override
    public Run pauseRun(RunId runId) {
        Run run = getRun(runId);
        run.pause(clock.instant());
        store.saveRun(run);
        log.info("Run {} paused during {}", runId, run.getCurrentPhase());
        return run;
    }

    @Override
    public Run resumeRun(RunId runId) {
        Run run = getRun(runId);
        RunStatus target = run.resume(clock.instant());
        store.saveRun(run);
        log.info("Run {} resumed to {}", runId, target);
        return run;
    }

    @Override
    public Run markStalled(RunId runId) {
        Run run = getRun(runId);
        run.markStalled(clock.instant());
        store.saveRun(run);
        log.warn("Run {} marked STALLED (last update: {})", runId, run.getUpdatedAt());
        return run;
    }

    @Override
    public Run rejectRun(RunId runId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        Run run = getRun(runId);
        RunStatus status = run.getStatus();
        if (!REJECTABLE.contains(status)) {
            throw new IllegalStateException("Run " + runId + " cannot be rejected from status " + status);
        }
        run.fail(reason, clock.instant());
        store.saveRun(run);
        history.add(run);
        log.info("Run {} rejected: {}", runId, reason);
        return run;
    }

    @Override
    public Run failRun(RunId runId, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        Run run = getRun(runId);
        run.fail(message, clock.instant());
        store.saveRun(run);
        history.add(run);
        log.warn("Run {} failed: {}", runId, message);
        return run;
    }

    @Override
    public Run getRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return store.findRun(runId)
            .orElseThrow(() -> new IllegalStateException("Unknown run: " + runId.getValue()));
    }

    @Override
    public List<Run> activeRuns() {
        return store.listRuns().stream()
            .filter(run -> !run.getStatus().isTerminal())
            .toList();
    }

    @Override
    public List<Run> pendingApprovals() {
        return store.listRuns().stream()
            .filter(run -> run.getStatus() == RunStatus.AWAITING_APPROVAL)
            .toList();
    }

    @Override
    public List<Run> recentCompletions(int limit) {
        return history.recent(limit);
    }

    @Override
    public List<Run> recentFailures(int limit) {
        return history.recentFailures(limit);
    }

    private void chargePlanned(Run run, Phase phase, Instant now) {
        PhasePlan plan = run.getManifest().plan().forPhase(phase);
        charge(run, phase, plan.estimatedTokens(), now);
    }

    /**
     * 토큰 수에 단가를 곱해 누적. 추정 비용은 참조하지 않음.
     */
    private void charge(Run run, Phase phase, long tokens, Instant now) {
        run.charge(phase, tokens, priceOf(tokens), now);
    }

    private double priceOf(long tokens) {
        return tokens / 1000.0 * usdPer1kTokens;
    }

    /**
     * 사용량을 보고하지 않은 스텝의 계획 토큰 몫. 스텝이 없으면 계획 토큰 전체.
     */
    static long plannedShare(long plannedTokens, int unreportedSteps, int totalSteps) {
        if (totalSteps == 0) {
            return plannedTokens;
        }
        return Math.round((double) plannedTokens * unreportedSteps / totalSteps);
    }

    private StepOutput executeStep(String step, StepContext stepContext) {
        StepOutput output = stepExecutor.execute(step, stepContext);
        if (output == null) {
            throw new IllegalStateException("StepExecutor returned no output for step: " + step);
        }
        return output;
    }

    private Artifact toArtifact(RunId runId, String step, StepOutput output) {
        String path = output.path() != null ? output.path() : defaultPath(runId, step);
        return new Artifact(ArtifactType.classify(step), step, path, sha256(output.content()));
    }

    private PhaseExecutionException failPhase(Run run, Phase phase, RuntimeException cause) {
        PhaseExecutionException failure = new PhaseExecutionException(run.getId(), phase, cause);
        if (!run.getStatus().isTerminal()) {
            run.fail(PhaseExecutionException.messageOf(cause), clock.instant());
            store.saveRun(run);
            history.add(run);
        }
        log.error("Run {} failed during {}", run.getId(), phase, cause);
        return failure;
    }

    private Receipt seal(Run run, List<GateResult> gateResults, Instant now) {
        double estimated = run.getManifest().costEstimate().totalUsd();
        CostActual attempt = run.getAttemptCost();
        double signedVariance = estimated > 0 ? (attempt.totalUsd() - estimated) / estimated : 0.0;
        List<Artifact> artifacts = run.getDevelopResult()
            .map(DevelopResult::artifacts)
            .orElse(List.of());
        return new Receipt(
            "receipt-" + UUID.randomUUID(),
            run.getId(),
            gateResults,
            artifacts,
            run.getCostActual(),
            Receipt.formatVariance(signedVariance),
            now,
            sealedBy
        );
    }

    static String defaultPath(RunId runId, String step) {
        return "artifacts/" + runId.getValue() + "/" + step.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
