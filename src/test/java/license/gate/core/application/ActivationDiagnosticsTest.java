package license.gate.core.application;

import license.gate.core.licensing.ErrorKind;
import org.junit.jupiter.api.Test;

import static license.gate.core.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

public class ActivationDiagnosticsTest {

    @Test
    void keepsMostRecentFailuresUpToCapacity() {
        ActivationDiagnostics d = new ActivationDiagnostics(3);
        for (int i = 0; i < 5; i++) {
            d.record(T0.plusSeconds(i), "cust-" + i, ErrorKind.SIGNATURE_MISMATCH, "signature");
        }
        assertThat(d.recentFailures())
                .extracting(f -> f.identity)
                .containsExactly("cust-2", "cust-3", "cust-4");
    }

    @Test
    void lastFailurePerIdentity() {
        ActivationDiagnostics d = new ActivationDiagnostics();
        d.record(T0, "cust-1", ErrorKind.EXPIRED_ENTITLEMENT, "expiration");
        d.record(T0.plusSeconds(1), "cust-2", ErrorKind.MALFORMED_RECORD, "structural");
        d.record(T0.plusSeconds(2), "cust-1", ErrorKind.CLOCK_INTEGRITY_FAILURE, "clock");

        assertThat(d.lastFailure("cust-1")).get()
                .satisfies(f -> assertThat(f.kind).isEqualTo(ErrorKind.CLOCK_INTEGRITY_FAILURE));
        assertThat(d.lastFailure("cust-3")).isEmpty();
    }

    @Test
    void missingIdentityIsRecordedAsUnknown() {
        ActivationDiagnostics d = new ActivationDiagnostics();
        d.record(T0, null, ErrorKind.MALFORMED_RECORD, "structural");
        assertThat(d.lastFailure(ActivationDiagnostics.UNKNOWN_IDENTITY)).isPresent();

        d.clear();
        assertThat(d.recentFailures()).isEmpty();
    }
}
