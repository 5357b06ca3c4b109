package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.statemachine.RunStatus;
import com.ryuqq.factory.core.statemachine.RunTransition;

import java.time.Instant;
import java.util.Optional;

/**
 * Manifest 하나를 Foster → Develop → Hone으로 진행시키는 가변 실행 기록.
 *
 * <p>모든 상태 변경은 {@link RunTransition}으로 검증되며, 메서드는 동기화되어 있어
 * 단계 실행 스레드와 pause/resume/stall 호출이 동시에 들어와도 안전합니다.</p>
 *
 * <p><strong>비용:</strong></p>
 * <ul>
 *   <li>costActual: Run 전체 누적 비용 (감소하지 않음)</li>
 *   <li>attemptCost: 현재 시도의 비용 (cycle-back 시 Foster 비용으로 되돌아감)</li>
 * </ul>
 *
 * <p><strong>보류 중 단계 완료:</strong> PAUSED/STALLED 동안 끝난 단계는 결과만 기록하고
 * 상태는 보류로 유지합니다. 재개 시 {@link #resumeTarget()}으로 복귀합니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class Run {

    private final RunId id;
    private final Manifest manifest;
    private final int maxRetries;
    private final Instant startedAt;

    private RunStatus status;
    private Phase currentPhase;
    private Phase lastCompletedPhase;
    private boolean executing;
    private FosterResult fosterResult;
    private DevelopResult developResult;
    private HoneResult honeResult;
    private int retryCount;
    private CostActual costActual = CostActual.ZERO;
    private CostActual attemptCost = CostActual.ZERO;
    private CostActual fosterCost = CostActual.ZERO;
    private Instant updatedAt;
    private Instant completedAt;
    private Receipt receipt;
    private String error;

    /**
     * 생성자 (PENDING 상태로 시작).
     *
     * @param id Run ID
     * @param manifest 실행할 Manifest
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @param now 생성 시각
     */
    public Run(RunId id, Manifest manifest, int maxRetries, Instant now) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        this.id = id;
        this.manifest = manifest;
        this.maxRetries = maxRetries;
        this.startedAt = now;
        this.updatedAt = now;
        this.status = RunStatus.PENDING;
    }

    /**
     * 검증 후 상태 전이.
     *
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public synchronized void transitionTo(RunStatus next, Instant now) {
        status = RunTransition.transition(status, next);
        updatedAt = now;
        if (next.isTerminal()) {
            completedAt = now;
            executing = false;
        }
    }

    /**
     * 단계 시작.
     *
     * <p>직전 단계 완료 상태에서 단계 진행 상태로 전이합니다. 이미 해당 단계 진행 상태이고
     * 실행 중이 아니면 (cycle-back 직후) 전이 없이 다시 진입합니다.</p>
     *
     * @throws IllegalStateException 이미 단계가 실행 중이거나, 보류 상태이거나, 전이가 허용되지 않는 경우
     */
    public synchronized void beginPhase(Phase phase, Instant now) {
        if (status.isHeld()) {
            throw new IllegalStateException("Run " + id + " is " + status + ", resume it before starting " + phase);
        }
        if (executing) {
            throw new IllegalStateException(
                "Run " + id + " is already executing phase " + currentPhase);
        }
        if (status != phase.activeStatus()) {
            transitionTo(phase.activeStatus(), now);
        } else {
            updatedAt = now;
        }
        currentPhase = phase;
        executing = true;
    }

    /**
     * 단계 비용 누적.
     */
    public synchronized void charge(Phase phase, long tokens, double usd, Instant now) {
        costActual = costActual.plus(tokens, usd);
        attemptCost = attemptCost.plus(tokens, usd);
        if (phase == Phase.FOSTER) {
            fosterCost = attemptCost;
        }
        updatedAt = now;
    }

    public synchronized void recordFoster(FosterResult result, Instant now) {
        this.fosterResult = result;
        finishPhase(Phase.FOSTER, now);
    }

    public synchronized void recordDevelop(DevelopResult result, Instant now) {
        this.developResult = result;
        finishPhase(Phase.DEVELOP, now);
    }

    /**
     * Hone 결과 기록.
     *
     * <p>전체 통과 시 단계 완료 처리하고, 실패 시 결과만 기록합니다
     * (이후 {@link #cycleBack(Instant)} 또는 실패 처리).</p>
     */
    public synchronized void recordHone(HoneResult result, Instant now) {
        this.honeResult = result;
        if (status.isTerminal()) {
            return;
        }
        if (result.allPassed()) {
            finishPhase(Phase.HONE, now);
        } else {
            updatedAt = now;
        }
    }

    /**
     * 게이트 실패 후 Develop으로 되돌아감 (Foster는 반복하지 않음).
     *
     * @throws IllegalStateException 재시도 한도에 도달한 경우
     */
    public synchronized void cycleBack(Instant now) {
        if (retryCount >= maxRetries) {
            throw new IllegalStateException(
                "Run " + id + " exhausted retries (" + retryCount + "/" + maxRetries + ")");
        }
        retryCount++;
        executing = false;
        currentPhase = Phase.DEVELOP;
        lastCompletedPhase = Phase.FOSTER;
        attemptCost = fosterCost;
        if (status.isHeld()) {
            updatedAt = now;
        } else {
            transitionTo(RunStatus.DEVELOPING, now);
        }
    }

    /**
     * Run 완료: Hone에서 봉인된 Receipt를 부착하고 COMPLETED로 전이.
     *
     * @throws IllegalStateException HONE_COMPLETE가 아니거나 봉인된 Receipt가 없는 경우
     */
    public synchronized void complete(Instant now) {
        if (honeResult == null || honeResult.sealedReceipt() == null) {
            throw new IllegalStateException("Run " + id + " has no sealed receipt");
        }
        transitionTo(RunStatus.COMPLETED, now);
        receipt = honeResult.sealedReceipt();
    }

    /**
     * 실패 처리 (영구).
     *
     * @throws IllegalStateException 이미 종료 상태이거나 FAILED 전이가 허용되지 않는 경우
     */
    public synchronized void fail(String message, Instant now) {
        transitionTo(RunStatus.FAILED, now);
        error = message;
    }

    public synchronized void pause(Instant now) {
        transitionTo(RunStatus.PAUSED, now);
    }

    public synchronized void markStalled(Instant now) {
        transitionTo(RunStatus.STALLED, now);
    }

    /**
     * 보류 해제.
     *
     * @return 복귀한 상태
     * @throws IllegalStateException 보류 상태가 아닌 경우
     */
    public synchronized RunStatus resume(Instant now) {
        if (!status.isHeld()) {
            throw new IllegalStateException("Run " + id + " is not paused or stalled: " + status);
        }
        RunStatus target = resumeTarget();
        transitionTo(target, now);
        return target;
    }

    /**
     * 재개 시 복귀할 상태.
     *
     * <p>단계 시작 전이면 APPROVED, 보류 중 현재 단계가 끝났으면 해당 단계 완료 상태,
     * 아니면 해당 단계 진행 상태.</p>
     */
    public synchronized RunStatus resumeTarget() {
        if (currentPhase == null) {
            return RunStatus.APPROVED;
        }
        if (currentPhase == lastCompletedPhase) {
            return currentPhase.completeStatus();
        }
        return currentPhase.activeStatus();
    }

    /**
     * 다음에 실행할 단계.
     *
     * @return 다음 단계, 모든 단계가 끝났으면 null
     */
    public synchronized Phase nextPhase() {
        if (lastCompletedPhase == null) {
            return Phase.FOSTER;
        }
        return lastCompletedPhase.next();
    }

    private void finishPhase(Phase phase, Instant now) {
        if (status.isTerminal()) {
            // 실행 중 종료된 Run (예: STALLED 상태에서 거부됨)
            return;
        }
        executing = false;
        lastCompletedPhase = phase;
        if (status.isHeld()) {
            updatedAt = now;
        } else {
            transitionTo(phase.completeStatus(), now);
        }
    }

    public RunId getId() {
        return id;
    }

    public String getManifestId() {
        return manifest.id();
    }

    public Manifest getManifest() {
        return manifest;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized Phase getCurrentPhase() {
        return currentPhase;
    }

    public synchronized Phase getLastCompletedPhase() {
        return lastCompletedPhase;
    }

    public synchronized boolean isExecuting() {
        return executing;
    }

    public synchronized Optional<FosterResult> getFosterResult() {
        return Optional.ofNullable(fosterResult);
    }

    public synchronized Optional<DevelopResult> getDevelopResult() {
        return Optional.ofNullable(developResult);
    }

    public synchronized Optional<HoneResult> getHoneResult() {
        return Optional.ofNullable(honeResult);
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized CostActual getCostActual() {
        return costActual;
    }

    public synchronized CostActual getAttemptCost() {
        return attemptCost;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public synchronized Optional<Receipt> getReceipt() {
        return Optional.ofNullable(receipt);
    }

    public synchronized Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public synchronized String toString() {
        return "Run{" +
            "id=" + id +
            ", status=" + status +
            ", currentPhase=" + currentPhase +
            ", retryCount=" + retryCount + "/" + maxRetries +
            '}';
    }
}
