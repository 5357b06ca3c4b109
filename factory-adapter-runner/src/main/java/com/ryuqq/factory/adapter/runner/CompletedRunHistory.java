package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.spi.Store;
import com.ryuqq.factory.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 종료된 Run의 고정 크기 이력.
 *
 * <p>COMPLETED와 FAILED Run을 각각 별도의 링에 보관하며, 두 링 모두 같은 용량을 가집니다.
 * 용량을 넘으면 해당 링에서 가장 오래된 Run을 밀어내고 Store에서도 삭제합니다
 * (Run, Receipt, Manifest).</p>
 *
 * <p>종료 상태가 아닌 Run은 받지 않습니다. 진행 중인 Run이 밀려나 Store에서 삭제되면
 * 파이프라인이 존재하지 않는 Run을 다루게 되기 때문입니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class CompletedRunHistory {

    private static final Logger log = LoggerFactory.getLogger(CompletedRunHistory.class);

    private final int capacity;
    private final Store store;
    private final Deque<Run> completed = new ArrayDeque<>();
    private final Deque<Run> failed = new ArrayDeque<>();

    public CompletedRunHistory(int capacity, Store store) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.capacity = capacity;
        this.store = store;
    }

    /**
     * 종료된 Run 기록.
     *
     * @param run COMPLETED 또는 FAILED 상태의 Run
     * @throws IllegalArgumentException run이 null인 경우
     * @throws IllegalStateException run이 종료 상태가 아닌 경우
     */
    public synchronized void add(Run run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        RunStatus status = run.getStatus();
        if (!status.isTerminal()) {
            throw new IllegalStateException("Run " + run.getId() + " is not terminal (current: " + status + ")");
        }
        Deque<Run> ring = status == RunStatus.COMPLETED ? completed : failed;
        ring.addLast(run);
        while (ring.size() > capacity) {
            Run evicted = ring.removeFirst();
            store.deleteRun(evicted.getId());
            log.debug("Evicted {} run {} from history", evicted.getStatus(), evicted.getId());
        }
    }

    /**
     * 최근 완료 Run (오래된 것부터).
     *
     * @param limit 최대 개수
     */
    public synchronized List<Run> recent(int limit) {
        return tail(completed, limit);
    }

    /**
     * 최근 실패 Run (오래된 것부터).
     *
     * @param limit 최대 개수
     */
    public synchronized List<Run> recentFailures(int limit) {
        return tail(failed, limit);
    }

    public synchronized int size() {
        return completed.size();
    }

    public synchronized int failedSize() {
        return failed.size();
    }

    public int getCapacity() {
        return capacity;
    }

    private static List<Run> tail(Deque<Run> ring, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative (current: " + limit + ")");
        }
        List<Run> all = new ArrayList<>(ring);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
}
