package com.ryuqq.factory.core.spi;

import com.ryuqq.factory.core.gate.CheckVerdict;
import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.model.Run;

/**
 * Verification check SPI used by the delegated Hone gates.
 *
 * <p>Called for every {@link GateKind} except {@link GateKind#COST_ACCURACY}, which is computed.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface VerificationCheck {

    /**
     * Verifies one gate against the run's current develop result.
     *
     * @param gate gate being evaluated
     * @param run run under verification
     * @return verdict (never null)
     */
    CheckVerdict verify(GateKind gate, Run run);
}
