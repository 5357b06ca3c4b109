package com.ryuqq.factory.testkit.stub;

import com.ryuqq.factory.core.spi.StepContext;
import com.ryuqq.factory.core.spi.StepExecutor;
import com.ryuqq.factory.core.spi.StepOutput;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * StepExecutor stub that records every invocation.
 *
 * <p>Content is derived from the step name and attempt so hashes differ between attempts.
 * A step can be configured to throw or to report the tokens it used.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class RecordingStepExecutor implements StepExecutor {

    /**
     * 기록된 호출.
     */
    public record Invocation(String step, StepContext context) {
    }

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, Long> reportedTokens = new ConcurrentHashMap<>();

    public void failOn(String step, RuntimeException failure) {
        failures.put(step, failure);
    }

    /**
     * 해당 스텝 출력에 토큰 사용량을 실어 보냄. 설정하지 않은 스텝은 사용량을 보고하지 않음.
     */
    public void reportTokens(String step, long tokens) {
        reportedTokens.put(step, tokens);
    }

    @Override
    public StepOutput execute(String step, StepContext context) {
        invocations.add(new Invocation(step, context));
        RuntimeException failure = failures.get(step);
        if (failure != null) {
            throw failure;
        }
        StepOutput output = StepOutput.of(step + " @attempt " + context.attempt() + " for " + context.runId());
        Long tokens = reportedTokens.get(step);
        return tokens != null ? output.withTokensUsed(tokens) : output;
    }

    public List<Invocation> getInvocations() {
        return List.copyOf(invocations);
    }

    public long countFor(String step) {
        return invocations.stream().filter(i -> i.step().equals(step)).count();
    }
}
