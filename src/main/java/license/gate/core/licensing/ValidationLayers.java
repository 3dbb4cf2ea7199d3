package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;

import java.time.Duration;
import java.time.Instant;

/** Las seis capas, en el orden en que corren. */
public final class ValidationLayers {

    private ValidationLayers() {}

    /** 1. Forma: campos obligatorios presentes e {@code issued_at <= expires_at}. */
    public static final class Structural implements ValidationLayer {
        @Override public String name() { return "structural"; }
        @Override public ErrorKind failureKind() { return ErrorKind.MALFORMED_RECORD; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return problem(r) == null;
        }

        /** Devuelve null si ok; de lo contrario, el motivo del rechazo. */
        public static String problem(EntitlementRecord r) {
            if (r == null) return "Licencia ausente.";
            if (r.identity() == null || r.identity().isBlank()) return "Falta identity.";
            if (r.features() == null) return "Falta features.";
            for (String f : r.features()) {
                if (f.isBlank()) return "Feature vacía.";
            }
            if (r.issuedAt() == null) return "Falta issued_at.";
            if (r.expiresAt() == null) return "Falta expires_at.";
            if (r.anchorTimestamp() == null) return "Falta anchor_timestamp.";
            if (r.signature() == null || r.signature().isBlank()) return "Falta signature.";
            if (r.issuedAt().isAfter(r.expiresAt())) return "issued_at posterior a expires_at.";
            return null;
        }
    }

    /** 2. Expiración autoritativa: {@code now < anchor + ventana}. Ignora expires_at. */
    public static final class AuthoritativeExpiration implements ValidationLayer {
        private final Duration validityWindow;

        public AuthoritativeExpiration(Duration validityWindow) { this.validityWindow = validityWindow; }

        @Override public String name() { return "expiration"; }
        @Override public ErrorKind failureKind() { return ErrorKind.EXPIRED_ENTITLEMENT; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return now.isBefore(r.authoritativeExpiration(validityWindow));
        }
    }

    /** 3. Un ancla en el futuro indica un build corrupto o falsificado. */
    public static final class AnchorSanity implements ValidationLayer {
        @Override public String name() { return "anchor"; }
        @Override public ErrorKind failureKind() { return ErrorKind.ANCHOR_IN_FUTURE; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return !r.anchorTimestamp().isAfter(now);
        }
    }

    /** 4. Reloj local contra la referencia independiente. */
    public static final class ClockIntegrity implements ValidationLayer {
        private final ClockIntegrityChecker checker;

        public ClockIntegrity(ClockIntegrityChecker checker) { this.checker = checker; }

        @Override public String name() { return "clock"; }
        @Override public ErrorKind failureKind() { return ErrorKind.CLOCK_INTEGRITY_FAILURE; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return checker.check(now);
        }
    }

    /** 5. HMAC. */
    public static final class Signature implements ValidationLayer {
        private final SignatureCodec codec;

        public Signature(SignatureCodec codec) { this.codec = codec; }

        @Override public String name() { return "signature"; }
        @Override public ErrorKind failureKind() { return ErrorKind.SIGNATURE_MISMATCH; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return codec.verify(r);
        }
    }

    /** 6. Entorno de ejecución (lo decide la atestación inyectada). */
    public static final class Environment implements ValidationLayer {
        private final EnvironmentAttestation attestation;

        public Environment(EnvironmentAttestation attestation) { this.attestation = attestation; }

        @Override public String name() { return "environment"; }
        @Override public ErrorKind failureKind() { return ErrorKind.ENVIRONMENT_REJECTED; }

        @Override
        public boolean passes(EntitlementRecord r, Instant now) {
            return attestation.permits(r);
        }
    }
}
