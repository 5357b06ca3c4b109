package com.ryuqq.factory.testkit.stub;

import com.ryuqq.factory.core.gate.CheckVerdict;
import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.testkit.fixture.FactoryFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptedVerificationCheckTest {

    private final Run run = new Run(RunId.of("run-1"),
        FactoryFixtures.manifest("manifest-1", ChamberId.of("chamber-1")), 3, FactoryFixtures.T0);

    @Test
    void allPass_모든_게이트를_통과시킨다() {
        // given
        ScriptedVerificationCheck check = ScriptedVerificationCheck.allPass();

        // when & then
        for (GateKind gate : GateKind.values()) {
            assertThat(check.verify(gate, run).passed()).isTrue();
        }
        assertThat(check.getCalls()).isEqualTo(GateKind.count());
    }

    @Test
    void failOnAttempt_해당_시도에서만_실패한다() {
        // given
        ScriptedVerificationCheck check = ScriptedVerificationCheck.allPass()
            .failOnAttempt(0, GateKind.SECURITY);

        // when
        CheckVerdict security = check.verify(GateKind.SECURITY, run);
        CheckVerdict quality = check.verify(GateKind.CODE_QUALITY, run);

        // then
        assertThat(security.passed()).isFalse();
        assertThat(security.evidence()).contains("attempt 0");
        assertThat(quality.passed()).isTrue();
    }

    @Test
    void failAlways_시도와_무관하게_실패한다() {
        // given
        ScriptedVerificationCheck check = ScriptedVerificationCheck.allPass()
            .failAlways(GateKind.TEST_PRESENCE);

        // then
        assertThat(check.verify(GateKind.TEST_PRESENCE, run).passed()).isFalse();
    }
}
