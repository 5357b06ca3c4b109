package com.ryuqq.factory.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

import static com.ryuqq.factory.core.statemachine.RunStatus.*;

/**
 * Run 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <pre>
 * PENDING           → AWAITING_APPROVAL | APPROVED | FAILED
 * AWAITING_APPROVAL → APPROVED | FAILED
 * APPROVED          → FOSTERING | PAUSED | STALLED | FAILED
 * FOSTERING         → FOSTER_COMPLETE | PAUSED | STALLED | FAILED
 * FOSTER_COMPLETE   → DEVELOPING | PAUSED | STALLED | FAILED
 * DEVELOPING        → DEVELOP_COMPLETE | PAUSED | STALLED | FAILED
 * DEVELOP_COMPLETE  → HONING | PAUSED | STALLED | FAILED
 * HONING            → HONE_COMPLETE | DEVELOPING | PAUSED | STALLED | FAILED
 * HONE_COMPLETE     → COMPLETED | PAUSED | STALLED | FAILED
 * PAUSED            → APPROVED ~ HONE_COMPLETE (재개) | FAILED
 * STALLED           → APPROVED ~ HONE_COMPLETE (재개) | PAUSED | FAILED
 * </pre>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class RunTransition {

    private static final Set<RunStatus> RESUME_TARGETS = EnumSet.of(
        APPROVED, FOSTERING, FOSTER_COMPLETE, DEVELOPING, DEVELOP_COMPLETE, HONING, HONE_COMPLETE
    );

    // Utility class - prevent instantiation
    private RunTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunStatus from, RunStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunStatus transition(RunStatus current, RunStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * 전이 허용 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(RunStatus from, RunStatus to) {
        if (from.isTerminal()) {
            return false;
        }
        // 진행 중 상태는 언제든 보류/실패 가능
        if (from.isInFlight() && (to == PAUSED || to == STALLED || to == FAILED)) {
            return true;
        }
        return switch (from) {
            case PENDING -> to == AWAITING_APPROVAL || to == APPROVED || to == FAILED;
            case AWAITING_APPROVAL -> to == APPROVED || to == FAILED;
            case APPROVED -> to == FOSTERING;
            case FOSTERING -> to == FOSTER_COMPLETE;
            case FOSTER_COMPLETE -> to == DEVELOPING;
            case DEVELOPING -> to == DEVELOP_COMPLETE;
            case DEVELOP_COMPLETE -> to == HONING;
            case HONING -> to == HONE_COMPLETE || to == DEVELOPING;
            case HONE_COMPLETE -> to == COMPLETED;
            case PAUSED -> RESUME_TARGETS.contains(to) || to == FAILED;
            case STALLED -> RESUME_TARGETS.contains(to) || to == PAUSED || to == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
