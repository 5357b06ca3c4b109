package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.application.controller.FactoryController;
import com.ryuqq.factory.application.controller.IngestResult;
import com.ryuqq.factory.application.controller.StatusReport;
import com.ryuqq.factory.application.pipeline.PipelineEngine;
import com.ryuqq.factory.application.runtime.PollingRuntime;
import com.ryuqq.factory.core.exception.PhaseExecutionException;
import com.ryuqq.factory.core.manifest.ManifestBuilder;
import com.ryuqq.factory.core.model.Chamber;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.ChamberStatus;
import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.model.HoneResult;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.PolicyPatch;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.spi.EventQueue;
import com.ryuqq.factory.core.spi.Store;
import com.ryuqq.factory.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 상시 가동 Factory 컨트롤러.
 *
 * <p>모든 Event의 단일 진입점이며, Policy 검사 → Manifest 생성 → Run 시작 → Foster/Develop/Hone
 * 순차 실행까지 담당합니다. 주기적 폴링으로 정체 Run을 감지하고 대기열을 FIFO로 소진합니다.</p>
 *
 * <p><strong>수락 검사 순서 (첫 실패에서 중단):</strong></p>
 * <pre>
 * 1. policy.enabled        → 아니면 거부 (paused)
 * 2. allowedSources        → 아니면 거부 (source_not_allowed)
 * 3. operatingHours        → 아니면 대기열 (queued)
 * 4. monthlySpend &lt; cap    → 아니면 거부 (budget_exceeded, 대기열 없음)
 * 5. activeRuns &lt; maxConcurrentRuns → 아니면 대기열 (queued)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>수락 검사와 startRun은 하나의 락 안에서 실행되어 활성 Run 수가 상한을 넘지 않음</li>
 *   <li>단계 실행은 락 밖에서 호출 스레드가 수행</li>
 *   <li>지출은 Run 완료 시점에만 {@link SpendLedger}와 Chamber에 기록</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class AlwaysOnController implements FactoryController, PollingRuntime {

    private static final Logger log = LoggerFactory.getLogger(AlwaysOnController.class);

    private final ManifestBuilder manifestBuilder;
    private final PipelineEngine engine;
    private final Store store;
    private final EventQueue queue;
    private final PolicyHolder policyHolder;
    private final SpendLedger spendLedger;
    private final StallDetector stallDetector;
    private final ControllerConfig config;
    private final Clock clock;

    private final ReentrantLock admissionLock = new ReentrantLock();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final Instant startedAt;

    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AlwaysOnController(
        ManifestBuilder manifestBuilder,
        PipelineEngine engine,
        Store store,
        EventQueue queue,
        PolicyHolder policyHolder,
        SpendLedger spendLedger,
        StallDetector stallDetector,
        ControllerConfig config,
        Clock clock
    ) {
        if (manifestBuilder == null) {
            throw new IllegalArgumentException("manifestBuilder cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (policyHolder == null) {
            throw new IllegalArgumentException("policyHolder cannot be null");
        }
        if (spendLedger == null) {
            throw new IllegalArgumentException("spendLedger cannot be null");
        }
        if (stallDetector == null) {
            throw new IllegalArgumentException("stallDetector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.manifestBuilder = manifestBuilder;
        this.engine = engine;
        this.store = store;
        this.queue = queue;
        this.policyHolder = policyHolder;
        this.spendLedger = spendLedger;
        this.stallDetector = stallDetector;
        this.config = config;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    // ── Event Processing ──────────────────────────────────────

    @Override
    public IngestResult ingestEvent(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        IngestResult result = admit(event);
        if (result.getDisposition() == IngestResult.Disposition.QUEUED) {
            queue.enqueue(event);
            log.warn("Event {} queued: {}", event.id(), result.getDetail());
        }
        return result;
    }

    /**
     * 수락 검사 후 Run 시작, 승인이 필요 없으면 세 단계를 끝까지 실행.
     *
     * <p>대기열 처리 결과(QUEUED)는 돌려주기만 하고 대기열에는 넣지 않습니다.
     * 대기열 삽입 위치는 호출자가 정합니다.</p>
     */
    private IngestResult admit(Event event) {
        Policy policy = policyHolder.get();
        Run run;

        admissionLock.lock();
        try {
            if (!policy.enabled()) {
                return IngestResult.rejected(IngestResult.REASON_PAUSED, "Factory controller is paused");
            }
            if (!policy.allowedSources().permits(event.source())) {
                return IngestResult.rejected(IngestResult.REASON_SOURCE_NOT_ALLOWED,
                    "Event source '" + event.source().wireName() + "' is disabled in policy");
            }
            if (!policy.isWithinOperatingHours(ZonedDateTime.now(clock))) {
                return IngestResult.queued("Queued - outside operating hours");
            }
            double spend = spendLedger.monthlySpend();
            if (spend >= policy.monthlyBudgetCapUsd()) {
                return IngestResult.rejected(IngestResult.REASON_BUDGET_EXCEEDED, String.format(Locale.ROOT,
                    "Monthly budget cap reached ($%.2f/$%.2f)", spend, policy.monthlyBudgetCapUsd()));
            }
            int active = engine.activeRuns().size();
            if (active >= policy.maxConcurrentRuns()) {
                return IngestResult.queued(
                    "Queued - max concurrent runs reached (" + active + "/" + policy.maxConcurrentRuns() + ")");
            }

            Manifest manifest = manifestBuilder.buildManifest(event, policy);
            Instant now = clock.instant();
            Chamber chamber = ensureChamber(manifest, now);
            run = engine.startRun(manifest);
            chamber.attachRun(run.getId(), now);
            store.saveChamber(chamber);
            eventsProcessed.incrementAndGet();
        } finally {
            admissionLock.unlock();
        }

        if (run.getStatus() == RunStatus.AWAITING_APPROVAL) {
            log.info("Run {} awaiting approval (estimate ${})", run.getId(),
                run.getManifest().costEstimate().totalUsd());
            return IngestResult.awaitingApproval(run.getId());
        }

        drive(run.getId());
        return IngestResult.executed(run.getId(), engine.getRun(run.getId()).getStatus());
    }

    private Chamber ensureChamber(Manifest manifest, Instant now) {
        ChamberId chamberId = manifest.chamberId();
        return store.findChamber(chamberId).orElseGet(() -> {
            Chamber created = new Chamber(chamberId, manifest.ownerId(), now);
            store.saveChamber(created);
            log.info("Chamber {} created for owner {}", chamberId, manifest.ownerId());
            return created;
        });
    }

    /**
     * Run을 가능한 곳까지 진행.
     *
     * <p>종료, 보류, 다른 스레드에서 단계 실행 중이면 멈춥니다. Hone 실패 후 DEVELOPING으로
     * 되돌아온 Run은 Develop부터 다시 실행됩니다.</p>
     */
    private void drive(RunId runId) {
        try {
            while (true) {
                Run run = engine.getRun(runId);
                RunStatus status = run.getStatus();
                if (status.isTerminal() || status.isHeld() || run.isExecuting()) {
                    break;
                }
                switch (status) {
                    case APPROVED, FOSTERING -> engine.executeFoster(runId);
                    case FOSTER_COMPLETE, DEVELOPING -> engine.executeDevelop(runId);
                    case DEVELOP_COMPLETE, HONING -> engine.executeHone(runId);
                    case HONE_COMPLETE -> recordCompletion(engine.completeRun(runId));
                    default -> {
                        return;
                    }
                }
            }
        } catch (PhaseExecutionException e) {
            log.error("Run {} failed in {} phase: {}", e.getRunId(), e.getPhase(), e.getMessage());
        }
        Run run = engine.getRun(runId);
        if (run.getStatus() == RunStatus.FAILED) {
            releaseSlot(run);
        }
    }

    private void recordCompletion(Run run) {
        double spend = run.getCostActual().totalUsd();
        double monthly = spendLedger.record(spend);
        store.findChamber(run.getManifest().chamberId()).ifPresent(chamber -> {
            chamber.recordCompletion(run.getId(), spend);
            store.saveChamber(chamber);
        });
        log.info("Run {} spend ${} recorded (monthly total ${})", run.getId(),
            String.format(Locale.ROOT, "%.4f", spend), String.format(Locale.ROOT, "%.4f", monthly));
    }

    private void releaseSlot(Run run) {
        store.findChamber(run.getManifest().chamberId()).ifPresent(chamber -> {
            chamber.detachRun(run.getId());
            store.saveChamber(chamber);
        });
    }

    // ── Run Control ──────────────────────────────────────────

    @Override
    public Run approveRun(RunId runId) {
        engine.approveRun(runId);
        drive(runId);
        return engine.getRun(runId);
    }

    @Override
    public Run rejectRun(RunId runId, String reason) {
        Run run = engine.rejectRun(runId, reason);
        releaseSlot(run);
        return run;
    }

    @Override
    public Run getRun(RunId runId) {
        return engine.getRun(runId);
    }

    @Override
    public List<Run> activeRuns() {
        return engine.activeRuns();
    }

    @Override
    public Run pauseRun(RunId runId) {
        return engine.pauseRun(runId);
    }

    @Override
    public Run resumeRun(RunId runId) {
        engine.resumeRun(runId);
        drive(runId);
        return engine.getRun(runId);
    }

    @Override
    public Receipt approveDeploy(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        Receipt receipt = store.findReceipt(runId)
            .orElseThrow(() -> new IllegalStateException("No receipt sealed for run " + runId.getValue()));
        receipt.approveDeploy();
        log.info("Deploy approved for run {} (receipt {})", runId, receipt.getId());
        return receipt;
    }

    // ── Status ──────────────────────────────────────────────

    @Override
    public StatusReport getStatus() {
        Policy policy = policyHolder.get();
        List<Run> active = engine.activeRuns();
        int stalled = (int) active.stream().filter(r -> r.getStatus() == RunStatus.STALLED).count();
        int activeChambers = (int) store.listChambers().stream()
            .filter(c -> c.getStatus() == ChamberStatus.ACTIVE || c.getStatus() == ChamberStatus.WATCHING)
            .count();

        List<StatusReport.RecentCompletion> recent = engine.recentCompletions(config.recentCompletionsLimit())
            .stream()
            .map(r -> new StatusReport.RecentCompletion(
                r.getId(),
                r.getManifest().scope(),
                r.getCompletedAt().orElse(r.getUpdatedAt()),
                r.getHoneResult().map(HoneResult::gateScore).orElse(0)))
            .toList();

        StatusReport.State state;
        if (!policy.enabled()) {
            state = StatusReport.State.PAUSED;
        } else if (!active.isEmpty()) {
            state = StatusReport.State.ACTIVE;
        } else {
            state = StatusReport.State.IDLE;
        }

        return new StatusReport(
            policy.enabled(),
            state,
            activeChambers,
            active.size(),
            queue.size(),
            engine.pendingApprovals().size(),
            stalled,
            recent,
            StatusReport.PeriodCost.of(spendLedger.monthlySpend(), policy.monthlyBudgetCapUsd()),
            Duration.between(startedAt, clock.instant()).getSeconds()
        );
    }

    // ── Policy ──────────────────────────────────────────────

    @Override
    public void pause() {
        policyHolder.update(PolicyPatch.empty().withEnabled(false));
        stop();
        log.info("Factory paused");
    }

    @Override
    public void resume() {
        policyHolder.update(PolicyPatch.empty().withEnabled(true));
        start();
        log.info("Factory resumed");
    }

    @Override
    public Policy getPolicy() {
        return policyHolder.get();
    }

    @Override
    public Policy replacePolicy(Policy policy) {
        Policy replaced = policyHolder.replace(policy);
        log.info("Policy replaced: {}", replaced);
        return replaced;
    }

    @Override
    public Policy updatePolicy(PolicyPatch patch) {
        Policy updated = policyHolder.update(patch);
        log.info("Policy updated: {}", updated);
        return updated;
    }

    // ── Chambers ────────────────────────────────────────────

    @Override
    public Optional<Chamber> getChamber(ChamberId chamberId) {
        return store.findChamber(chamberId);
    }

    @Override
    public List<Chamber> listChambers() {
        return store.listChambers();
    }

    @Override
    public Chamber setChamberStatus(ChamberId chamberId, ChamberStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        Chamber chamber = store.findChamber(chamberId)
            .orElseThrow(() -> new IllegalStateException("Unknown chamber: " + chamberId));
        chamber.setStatus(status);
        store.saveChamber(chamber);
        log.info("Chamber {} set to {} (poll interval {}ms)", chamberId, status, status.pollIntervalMs());
        return chamber;
    }

    // ── Polling Runtime ─────────────────────────────────────

    /**
     * 폴링 1회: 정체 스캔 후 대기열을 FIFO로 소진.
     *
     * <p>대기열 선두 Event를 수락할 수 없으면(운영 시간 외, 동시 실행 상한) 선두에 되돌리고
     * 소진을 멈춥니다. 거부된 Event는 버려집니다.</p>
     */
    @Override
    public void pollCycle() {
        Policy policy = policyHolder.get();
        StallScanResult scan = stallDetector.scan(policy);
        for (RunId expired : scan.expired()) {
            releaseSlot(engine.getRun(expired));
        }

        int drained = 0;
        if (policy.enabled()) {
            drained = drainQueue();
        }

        int active = engine.activeRuns().size();
        if (eventsProcessed.get() > 0 || active > 0) {
            log.debug("Poll cycle heartbeat: active={}, queued={}, drained={}, processed={}",
                active, queue.size(), drained, eventsProcessed.get());
        }
    }

    private int drainQueue() {
        int drained = 0;
        while (queue.size() > 0) {
            Optional<Event> next = queue.poll();
            if (next.isEmpty()) {
                break;
            }
            Event event = next.get();
            IngestResult result;
            try {
                result = admit(event);
            } catch (RuntimeException e) {
                log.error("Failed to process queued event {}, dropping it", event.id(), e);
                continue;
            }
            if (result.getDisposition() == IngestResult.Disposition.QUEUED) {
                queue.requeueFirst(event);
                log.debug("Queue drain stopped at event {}: {}", event.id(), result.getDetail());
                break;
            }
            if (result.getDisposition() == IngestResult.Disposition.REJECTED) {
                log.warn("Queued event {} dropped: {} ({})", event.id(), result.getReason(), result.getDetail());
            }
            drained++;
        }
        return drained;
    }

    @Override
    public synchronized void start() {
        if (!policyHolder.get().enabled()) {
            log.info("Controller disabled by policy, not starting");
            return;
        }
        if (scheduler != null) {
            log.warn("Controller already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "factory-poll");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safePollCycle, 0, config.pollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Always-on factory controller started (poll interval {}ms)", config.pollIntervalMs());
    }

    @Override
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Controller stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void safePollCycle() {
        try {
            pollCycle();
        } catch (RuntimeException e) {
            log.error("Poll cycle failed", e);
        }
    }
}
