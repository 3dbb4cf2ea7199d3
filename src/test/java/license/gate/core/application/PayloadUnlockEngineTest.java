package license.gate.core.application;

import license.gate.core.Fixtures;
import license.gate.core.domain.RuleSet;
import license.gate.core.domain.RuleSetView;
import license.gate.core.licensing.EntitlementException;
import license.gate.core.licensing.ErrorKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static license.gate.core.Fixtures.SUMMARY_PROMPT;
import static license.gate.core.licensing.LicenseModels.RulePayload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PayloadUnlockEngineTest {

    private static final byte[] SECRET = "test-unlock-secret".getBytes(StandardCharsets.UTF_8);

    private final Fixtures.MapPayloadSource payloads = new Fixtures.MapPayloadSource();
    private final PayloadUnlockEngine engine = new PayloadUnlockEngine(SECRET, payloads);
    private final PayloadSealer sealer = new PayloadSealer(SECRET);

    private static ErrorKind kindOf(ThrowingCall call) {
        try {
            call.run();
            return null;
        } catch (EntitlementException e) {
            return e.getKind();
        }
    }

    interface ThrowingCall {
        void run() throws EntitlementException;
    }

    @Test
    void unlocksTheBlobSealedForTheIdentity() throws Exception {
        payloads.put("cust-1", sealer.seal("cust-1", Fixtures.rules()));

        RuleSet rules = engine.unlock("cust-1");
        RuleSetView view = new RuleSetView(rules, "cust-1", "wm_x");

        assertThat(view.prompt("summary")).isEqualTo(SUMMARY_PROMPT);
        assertThat(view.patterns(RuleSet.MODULE)).hasSize(2).first().isEqualTo("Chapter \\d+:\\s*([^.!?]+)");
        assertThat(view.confidenceThreshold(RuleSet.STEP)).hasValue(0.9);
        assertThat(view.categories()).containsExactly("module", "step", "flow", "taxonomy");
    }

    @Test
    void otherIdentityCannotDecrypt() {
        byte[] blob = sealer.seal("cust-1", Fixtures.rules());
        payloads.put("cust-2", blob);
        assertThat(kindOf(() -> engine.unlock("cust-2"))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
    }

    @Test
    void keysDifferPerIdentityAndAreStable() {
        byte[] k1 = engine.deriveKey("cust-1");
        assertThat(k1).hasSize(32);
        assertThat(engine.deriveKey("cust-1")).isEqualTo(k1);
        assertThat(engine.deriveKey("cust-2")).isNotEqualTo(k1);
        assertThat(PayloadUnlockEngine.deriveKey("other".getBytes(StandardCharsets.UTF_8), "cust-1")).isNotEqualTo(k1);
    }

    @Test
    void anyFlippedByteFailsAuthentication() {
        byte[] blob = sealer.seal("cust-1", Fixtures.rules());
        byte[] key = engine.deriveKey("cust-1");
        for (int i : new int[]{0, 11, 12, blob.length / 2, blob.length - 1}) {
            byte[] tampered = Arrays.copyOf(blob, blob.length);
            tampered[i] ^= 0x01;
            assertThat(kindOf(() -> engine.decrypt(tampered, key)))
                    .as("byte %d", i)
                    .isEqualTo(ErrorKind.DECRYPTION_FAILED);
        }
    }

    @Test
    void truncatedOrMissingBlobFails() {
        byte[] key = engine.deriveKey("cust-1");
        assertThat(kindOf(() -> engine.decrypt(new byte[27], key))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
        assertThat(kindOf(() -> engine.decrypt(null, key))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
        assertThat(kindOf(() -> engine.unlock("nobody"))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
    }

    @Test
    void authenticPayloadWithWrongShapeFails() {
        payloads.put("cust-1", sealer.seal("cust-1", "[1,2,3]".getBytes(StandardCharsets.UTF_8)));
        assertThat(kindOf(() -> engine.unlock("cust-1"))).isEqualTo(ErrorKind.DECRYPTION_FAILED);

        RulePayload missingPrompts = Fixtures.rules();
        missingPrompts.llmPrompts = null;
        payloads.put("cust-1", sealer.seal("cust-1", missingPrompts));
        assertThat(kindOf(() -> engine.unlock("cust-1"))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
    }

    @Test
    void thresholdOutsideUnitIntervalFails() {
        RulePayload bad = Fixtures.rules();
        bad.confidenceThresholds.put("module", 1.5);
        payloads.put("cust-1", sealer.seal("cust-1", bad));
        assertThat(kindOf(() -> engine.unlock("cust-1"))).isEqualTo(ErrorKind.DECRYPTION_FAILED);
    }

    @Test
    void optionalCategoriesDefaultToEmpty() throws Exception {
        RulePayload minimal = Fixtures.rules();
        minimal.flowPatterns = null;
        minimal.taxonomyPatterns = null;
        RuleSet rules = PayloadUnlockEngine.toRuleSet(minimal);
        assertThat(rules.patterns(RuleSet.FLOW)).isEmpty();
        assertThat(rules.patterns(RuleSet.TAXONOMY)).isEmpty();
    }

    @Test
    void sealingUsesFreshNonces() {
        byte[] a = sealer.seal("cust-1", Fixtures.rules());
        byte[] b = sealer.seal("cust-1", Fixtures.rules());
        assertThat(Arrays.copyOf(a, 12)).isNotEqualTo(Arrays.copyOf(b, 12));
    }

    @Test
    void wrongSecretIsRejected() {
        payloads.put("cust-1", new PayloadSealer("other".getBytes(StandardCharsets.UTF_8)).seal("cust-1", Fixtures.rules()));
        assertThatThrownBy(() -> engine.unlock("cust-1"))
                .isInstanceOf(EntitlementException.class)
                .hasMessageNotContaining("cust-1");
    }
}
