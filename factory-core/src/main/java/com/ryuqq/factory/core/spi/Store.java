package com.ryuqq.factory.core.spi;

import com.ryuqq.factory.core.model.Chamber;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;

import java.util.List;
import java.util.Optional;

/**
 * Repository SPI for Manifests, Runs, Chambers and Receipts.
 *
 * <p>The pipeline and controller hold no maps of their own; every lookup goes through this
 * interface so a durable store can replace the in-memory one without touching control flow.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>save* overwrites an existing entry with the same id</li>
 *   <li>list* returns snapshots in insertion order</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public interface Store {

    /**
     * @throws IllegalArgumentException if manifest is null
     */
    void saveManifest(Manifest manifest);

    Optional<Manifest> findManifest(String manifestId);

    /**
     * @throws IllegalArgumentException if run is null
     */
    void saveRun(Run run);

    Optional<Run> findRun(RunId runId);

    List<Run> listRuns();

    /**
     * Removes a run, its receipt and its manifest (used when a terminal run leaves the bounded history).
     * The manifest stays while another stored run still refers to it.
     *
     * @param runId run to remove
     * @return true if a run was removed
     */
    boolean deleteRun(RunId runId);

    /**
     * @throws IllegalArgumentException if chamber is null
     */
    void saveChamber(Chamber chamber);

    Optional<Chamber> findChamber(ChamberId chamberId);

    List<Chamber> listChambers();

    /**
     * @throws IllegalArgumentException if receipt is null
     */
    void saveReceipt(Receipt receipt);

    Optional<Receipt> findReceipt(RunId runId);
}
