package com.ryuqq.factory.application.runtime;

/**
 * Periodic control loop.
 *
 * <p>Each cycle first scans for stalled runs, then drains the deferred event queue FIFO while
 * concurrency capacity and operating hours allow.</p>
 *
 * <p><strong>Runtime Flow:</strong></p>
 * <pre>
 * start() schedules pollCycle() every pollIntervalMs
 *   ↓
 * pollCycle():
 *   1. Stall scan (in-flight runs idle longer than stallTimeoutMinutes → STALLED)
 *   2. Queue drain (poll head, re-ingest, requeue at head when not admittable)
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Per-run and per-event errors are logged and the cycle continues</li>
 *   <li>A cycle never throws into the scheduler thread</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public interface PollingRuntime {

    /**
     * Runs one poll cycle synchronously. Safe to call directly (e.g. from tests).
     */
    void pollCycle();

    /**
     * Starts the periodic schedule. No-op when already running or when the policy is disabled.
     */
    void start();

    /**
     * Cancels the periodic schedule. State is kept.
     */
    void stop();

    boolean isRunning();
}
