package com.ryuqq.factory.testkit.stub;

import com.ryuqq.factory.core.gate.CheckVerdict;
import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.spi.VerificationCheck;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * VerificationCheck stub that fails chosen gates on chosen attempts.
 *
 * <p>The attempt is the run's retry count when the gate is evaluated: 0 for the first Hone pass,
 * 1 after the first cycle-back, and so on. Gates without a script pass.</p>
 *
 * <pre>
 * ScriptedVerificationCheck check = ScriptedVerificationCheck.allPass()
 *     .failOnAttempt(0, GateKind.SECURITY, GateKind.PERFORMANCE);
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class ScriptedVerificationCheck implements VerificationCheck {

    private final Map<Integer, Set<GateKind>> failing = new ConcurrentHashMap<>();
    private final Set<GateKind> alwaysFailing = EnumSet.noneOf(GateKind.class);
    private final AtomicInteger calls = new AtomicInteger();

    private ScriptedVerificationCheck() {
    }

    public static ScriptedVerificationCheck allPass() {
        return new ScriptedVerificationCheck();
    }

    public ScriptedVerificationCheck failOnAttempt(int attempt, GateKind... gates) {
        Set<GateKind> set = EnumSet.noneOf(GateKind.class);
        set.addAll(Arrays.asList(gates));
        failing.put(attempt, set);
        return this;
    }

    public synchronized ScriptedVerificationCheck failAlways(GateKind... gates) {
        alwaysFailing.addAll(Arrays.asList(gates));
        return this;
    }

    @Override
    public CheckVerdict verify(GateKind gate, Run run) {
        calls.incrementAndGet();
        boolean fails;
        synchronized (this) {
            fails = alwaysFailing.contains(gate);
        }
        fails = fails || failing.getOrDefault(run.getRetryCount(), Set.of()).contains(gate);
        return fails
            ? CheckVerdict.fail(gate.wireName() + " failed on attempt " + run.getRetryCount())
            : CheckVerdict.pass(gate.wireName() + " passed");
    }

    public int getCalls() {
        return calls.get();
    }
}
