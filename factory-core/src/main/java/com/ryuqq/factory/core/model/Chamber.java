package com.ryuqq.factory.core.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 한 소유자가 감독하는 Run 묶음.
 *
 * <p>처음 참조될 때 생성되며 삭제되지 않습니다 (COMPLETED로만 표시).
 * 모든 변경 메서드는 동기화되어 있습니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class Chamber {

    private final ChamberId id;
    private final String ownerId;
    private final Instant createdAt;
    private final Set<RunId> activeRunIds = new LinkedHashSet<>();
    private ChamberStatus status;
    private int completedRunCount;
    private double totalSpendUsd;
    private Instant lastEventAt;

    public Chamber(ChamberId id, String ownerId, Instant createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.id = id;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
        this.status = ChamberStatus.ACTIVE;
        this.lastEventAt = createdAt;
    }

    public synchronized void attachRun(RunId runId, Instant at) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        activeRunIds.add(runId);
        lastEventAt = at;
    }

    /**
     * 완료된 Run 반영 (활성 목록에서 제거, 완료 수와 지출 누적).
     */
    public synchronized void recordCompletion(RunId runId, double spendUsd) {
        if (spendUsd < 0) {
            throw new IllegalArgumentException("spendUsd must be non-negative (current: " + spendUsd + ")");
        }
        activeRunIds.remove(runId);
        completedRunCount++;
        totalSpendUsd += spendUsd;
    }

    /**
     * 실패/거부된 Run을 활성 목록에서 제거 (지출은 누적하지 않음).
     */
    public synchronized void detachRun(RunId runId) {
        activeRunIds.remove(runId);
    }

    public synchronized void setStatus(ChamberStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        this.status = status;
    }

    public synchronized void touch(Instant at) {
        this.lastEventAt = at;
    }

    public ChamberId getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized ChamberStatus getStatus() {
        return status;
    }

    public synchronized long getPollIntervalMs() {
        return status.pollIntervalMs();
    }

    public synchronized List<RunId> getActiveRunIds() {
        return List.copyOf(activeRunIds);
    }

    public synchronized int getCompletedRunCount() {
        return completedRunCount;
    }

    public synchronized double getTotalSpendUsd() {
        return totalSpendUsd;
    }

    public synchronized Instant getLastEventAt() {
        return lastEventAt;
    }

    @Override
    public synchronized String toString() {
        return "Chamber{" +
            "id=" + id +
            ", ownerId='" + ownerId + '\'' +
            ", status=" + status +
            ", activeRuns=" + activeRunIds.size() +
            '}';
    }
}
