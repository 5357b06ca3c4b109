package com.ryuqq.factory.core.exception;

import com.ryuqq.factory.core.model.Phase;
import com.ryuqq.factory.core.model.RunId;

/**
 * 단계 실행 중 외부 협력자가 던진 예외를 감싸는 예외.
 *
 * <p>이 예외가 던져질 때 Run은 이미 FAILED로 전이되어 있고, 원인 메시지는
 * Run.error에 기록되어 있습니다. 재시도하지 않습니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public class PhaseExecutionException extends RuntimeException {

    private final RunId runId;
    private final Phase phase;

    public PhaseExecutionException(RunId runId, Phase phase, Throwable cause) {
        super("Phase " + phase + " failed for run " + runId + ": " + messageOf(cause), cause);
        this.runId = runId;
        this.phase = phase;
    }

    /**
     * 원인 예외의 메시지 (없으면 예외 클래스 이름).
     */
    public static String messageOf(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }

    public RunId getRunId() {
        return runId;
    }

    public Phase getPhase() {
        return phase;
    }
}
