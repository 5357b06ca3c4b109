/**
 * Run state machine package.
 *
 * <p>Transition rules for the Run lifecycle. Every status change on a
 * {@link com.ryuqq.factory.core.model.Run} goes through
 * {@link com.ryuqq.factory.core.statemachine.RunTransition}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RunStatus status = RunStatus.PENDING;
 * status = RunTransition.transition(status, RunStatus.APPROVED);
 * status = RunTransition.transition(status, RunStatus.FOSTERING);
 *
 * // This will throw IllegalStateException
 * RunTransition.validate(RunStatus.COMPLETED, RunStatus.DEVELOPING);
 * </pre>
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.core.statemachine;
