/**
 * Deterministic clocks for time-dependent tests (stall timeouts, operating hours, monthly spend).
 *
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.testkit.clock;
