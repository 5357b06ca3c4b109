package com.ryuqq.factory.adapter.inmemory.store;

import com.ryuqq.factory.core.model.Chamber;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.spi.Store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link Store} SPI for testing and single-process deployments.
 *
 * <p>Entities are kept in {@link ConcurrentHashMap}s for O(1) lookup. Runs and chambers also keep
 * an insertion-order index in a {@link ConcurrentLinkedQueue} so that list operations return
 * entities in the order they were first saved.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>manifests:</strong> manifest id → Manifest</li>
 *   <li><strong>runs / runOrder:</strong> RunId → Run, plus first-save order</li>
 *   <li><strong>chambers / chamberOrder:</strong> ChamberId → Chamber, plus first-save order</li>
 *   <li><strong>receipts:</strong> RunId → Receipt</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Runs and chambers are stored by reference, so later mutations are visible without re-saving</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public class InMemoryStore implements Store {

    private final ConcurrentHashMap<String, Manifest> manifests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RunId, Run> runs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<RunId> runOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<ChamberId, Chamber> chambers = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<ChamberId> chamberOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<RunId, Receipt> receipts = new ConcurrentHashMap<>();

    @Override
    public void saveManifest(Manifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        manifests.put(manifest.id(), manifest);
    }

    @Override
    public Optional<Manifest> findManifest(String manifestId) {
        if (manifestId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(manifests.get(manifestId));
    }

    @Override
    public void saveRun(Run run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (runs.put(run.getId(), run) == null) {
            runOrder.add(run.getId());
        }
    }

    @Override
    public Optional<Run> findRun(RunId runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<Run> listRuns() {
        return runOrder.stream()
            .map(runs::get)
            .filter(Objects::nonNull)
            .toList();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Receipt가 있으면 함께 삭제하고, 다른 Run이 참조하지 않는 Manifest도 삭제합니다.</p>
     */
    @Override
    public boolean deleteRun(RunId runId) {
        if (runId == null) {
            return false;
        }
        receipts.remove(runId);
        Run removed = runs.remove(runId);
        if (removed == null) {
            return false;
        }
        runOrder.remove(runId);
        String manifestId = removed.getManifest().id();
        boolean shared = runs.values().stream()
            .anyMatch(run -> run.getManifest().id().equals(manifestId));
        if (!shared) {
            manifests.remove(manifestId);
        }
        return true;
    }

    @Override
    public void saveChamber(Chamber chamber) {
        if (chamber == null) {
            throw new IllegalArgumentException("chamber cannot be null");
        }
        if (chambers.put(chamber.getId(), chamber) == null) {
            chamberOrder.add(chamber.getId());
        }
    }

    @Override
    public Optional<Chamber> findChamber(ChamberId chamberId) {
        if (chamberId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chambers.get(chamberId));
    }

    @Override
    public List<Chamber> listChambers() {
        return chamberOrder.stream()
            .map(chambers::get)
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public void saveReceipt(Receipt receipt) {
        if (receipt == null) {
            throw new IllegalArgumentException("receipt cannot be null");
        }
        receipts.put(receipt.getRunId(), receipt);
    }

    @Override
    public Optional<Receipt> findReceipt(RunId runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(receipts.get(runId));
    }

    /**
     * Clears all stored data (for testing purposes).
     */
    public void clear() {
        manifests.clear();
        runs.clear();
        runOrder.clear();
        chambers.clear();
        chamberOrder.clear();
        receipts.clear();
    }
}
