/**
 * Verification gates evaluated during the Hone phase.
 *
 * <p>{@link com.ryuqq.factory.core.gate.GateKind} is a closed enumeration: adding a gate is a
 * compile-time change, and a Receipt always accounts for every constant.</p>
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.core.gate;
