package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static license.gate.core.Fixtures.FEATURES;
import static license.gate.core.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LicenseCodecTest {

    private final LicenseIssuer issuer =
            new LicenseIssuer(new SignatureCodec("k".getBytes(StandardCharsets.UTF_8)), Duration.ofDays(14));

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static ErrorKind kindOf(byte[] bytes) {
        try {
            LicenseCodec.decodeEntitlement(bytes);
            return null;
        } catch (EntitlementException e) {
            return e.getKind();
        }
    }

    @Test
    void encodedRecordDecodesToSameClaims() throws Exception {
        EntitlementRecord issued = issuer.issue("cust-1", FEATURES, T0, "abc123", "sha256:feed", Map.of("tier", "pro"));
        byte[] bytes = LicenseCodec.encodeEntitlement(issued);

        String text = new String(bytes, StandardCharsets.UTF_8);
        assertThat(text).contains("\"anchor_timestamp\"", "\"issued_at\"", "\"license_id\"", "2024-12-13T20:57:36Z");

        EntitlementRecord decoded = LicenseCodec.decodeEntitlement(bytes);
        assertThat(decoded.identity()).isEqualTo("cust-1");
        assertThat(decoded.features()).containsExactly("llm_integration", "module_extraction", "step_extraction");
        assertThat(decoded.anchorTimestamp()).isEqualTo(T0);
        assertThat(decoded.expiresAt()).isEqualTo(T0.plus(Duration.ofDays(14)));
        assertThat(decoded.signature()).isEqualTo(issued.signature());
        assertThat(decoded.hwid()).isEqualTo("abc123");
        assertThat(decoded.buildHash()).isEqualTo("sha256:feed");
        assertThat(text).contains("\"build_hash\"");
        assertThat(decoded.metadata()).containsEntry("tier", "pro");
    }

    @Test
    void missingFieldsStayNullForStructuralLayer() throws Exception {
        EntitlementRecord r = LicenseCodec.decodeEntitlement(json("{\"identity\":\"cust-1\"}"));
        assertThat(r.features()).isNull();
        assertThat(r.signature()).isNull();
        assertThat(ValidationLayers.Structural.problem(r)).isEqualTo("Falta features.");
    }

    @Test
    void emptyAndGarbageInputIsMalformed() {
        assertThat(kindOf(new byte[0])).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(null)).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(json("not json"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(json("null"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(json("{\"identity\":\"a\"} {}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
    }

    @Test
    void unknownFieldIsMalformed() {
        assertThat(kindOf(json("{\"identity\":\"a\",\"grace_days\":30}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
    }

    @Test
    void duplicateKeyIsMalformed() {
        assertThat(kindOf(json("{\"identity\":\"a\",\"identity\":\"b\"}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
    }

    @Test
    void duplicateOrBlankFeatureIsMalformed() {
        assertThat(kindOf(json("{\"features\":[\"x\",\"x\"]}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(json("{\"features\":[\"x\",\"\"]}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
        assertThat(kindOf(json("{\"features\":[null]}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
    }

    @Test
    void badTimestampIsMalformed() {
        assertThat(kindOf(json("{\"anchor_timestamp\":\"yesterday\"}"))).isEqualTo(ErrorKind.MALFORMED_RECORD);
    }

    @Test
    void rulesRejectUnknownKeys() {
        assertThatThrownBy(() -> LicenseCodec.decodeRules(json("{\"module_patterns\":[],\"extra\":1}")))
                .isInstanceOf(java.io.IOException.class);
    }
}
