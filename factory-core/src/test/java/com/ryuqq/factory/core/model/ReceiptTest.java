package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.gate.GateKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Receipt 테스트.
 *
 * @author Factory Team
 * @since 1.0.0
 */
class ReceiptTest {

    @Test
    void approveDeploy_FlipsOnce() {
        // Given
        Receipt receipt = TestManifests.receipt(RunId.of("run-1"));
        assertFalse(receipt.isDeployApproved());

        // When
        receipt.approveDeploy();

        // Then
        assertTrue(receipt.isDeployApproved());
        assertThrows(IllegalStateException.class, receipt::approveDeploy);
    }

    @Test
    void gateLists_CoverAllGates() {
        Receipt receipt = TestManifests.receipt(RunId.of("run-1"));

        assertEquals(GateKind.count(), receipt.getGatesPassed().size() + receipt.getGatesFailed().size());
        assertEquals(GateKind.count(), receipt.getGateScore());
    }

    @Test
    void constructor_PartialGateResults_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Receipt("r", RunId.of("run-1"),
            TestManifests.gates().subList(0, 3), List.of(), CostActual.ZERO, null,
            TestManifests.T0, "factory-controller"));
    }

    @Test
    void formatVariance_Signed() {
        assertEquals("+5.2%", Receipt.formatVariance(0.052));
        assertEquals("-10.0%", Receipt.formatVariance(-0.1));
        assertEquals("+0.0%", Receipt.formatVariance(0.0));
        assertEquals("+0.0%", Receipt.formatVariance(-1e-12));
    }

    @Test
    void costActual_RejectsNegativeDelta() {
        CostActual cost = new CostActual(10, 0.5);
        assertEquals(new CostActual(15, 0.75), cost.plus(5, 0.25));
        assertThrows(IllegalArgumentException.class, () -> cost.plus(-1, 0.0));
    }

    @Test
    void artifactType_ClassifiesByKeyword() {
        assertEquals(ArtifactType.TEST, ArtifactType.classify("Write tests"));
        assertEquals(ArtifactType.CONFIG, ArtifactType.classify("Update configurations"));
        assertEquals(ArtifactType.WORKFLOW, ArtifactType.classify("Wire integrations"));
        assertEquals(ArtifactType.INTEGRATION, ArtifactType.classify("Expose API endpoint"));
        assertEquals(ArtifactType.CODE, ArtifactType.classify("Implement solution"));
    }
}
