package license.gate.core;

import license.gate.core.application.ActivationDiagnostics;
import license.gate.core.application.CoreSettings;
import license.gate.core.application.FeatureGate;
import license.gate.core.application.PayloadSealer;
import license.gate.core.application.PayloadUnlockEngine;
import license.gate.core.application.SessionStore;
import license.gate.core.domain.EntitlementRecord;
import license.gate.core.infrastructure.PayloadSource;
import license.gate.core.infrastructure.ReferenceClock;
import license.gate.core.licensing.ClockIntegrityChecker;
import license.gate.core.licensing.EnvironmentAttestation;
import license.gate.core.licensing.LicenseCodec;
import license.gate.core.licensing.LicenseIssuer;
import license.gate.core.licensing.SignatureCodec;
import license.gate.core.licensing.ValidationPipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static license.gate.core.licensing.LicenseModels.RulePayload;

/** Relojes controlables, settings de prueba y un arnés con store + gate armados. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-12-13T20:57:36Z");
    public static final List<String> FEATURES = List.of("module_extraction", "step_extraction", "llm_integration");
    public static final String SUMMARY_PROMPT =
            "Summarize the following maintenance procedure in three sentences.\nText: {text}";

    private Fixtures() {}

    public static CoreSettings settings() {
        return CoreSettings.builder()
                .signingSecret("test-signing-secret")
                .unlockSecret("test-unlock-secret")
                .build();
    }

    public static byte[] rulesBytes() {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/rules.json")) {
            if (in == null) throw new IllegalStateException("Falta /fixtures/rules.json");
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RulePayload rules() {
        try {
            return LicenseCodec.decodeRules(rulesBytes());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Reloj local que el test mueve a mano. */
    public static final class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant now) { this.now = now; }

        public void set(Instant now) { this.now = now; }
        public void advance(Duration d) { this.now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    /** Referencia que sigue al reloj local salvo que se le fije un desfase o se "caiga". */
    public static final class FollowingReferenceClock implements ReferenceClock {
        private final Clock local;
        private volatile Duration offset = Duration.ZERO;
        private volatile boolean available = true;

        public FollowingReferenceClock(Clock local) { this.local = local; }

        public void offset(Duration offset) { this.offset = offset; }
        public void available(boolean available) { this.available = available; }

        @Override
        public Optional<Instant> now() {
            return available ? Optional.of(local.instant().plus(offset)) : Optional.empty();
        }
    }

    public static final class MapPayloadSource implements PayloadSource {
        private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

        public void put(String identity, byte[] blob) { blobs.put(identity, blob); }

        @Override
        public Optional<byte[]> blobFor(String identity) {
            return Optional.ofNullable(blobs.get(identity)).map(byte[]::clone);
        }
    }

    /** Todo el núcleo armado con relojes y payloads controlables. */
    public static final class Harness {
        public final CoreSettings settings;
        public final MutableClock clock = new MutableClock(T0.plus(Duration.ofDays(1)));
        public final FollowingReferenceClock reference = new FollowingReferenceClock(clock);
        public final MapPayloadSource payloads = new MapPayloadSource();
        public final ActivationDiagnostics diagnostics = new ActivationDiagnostics();
        public final ValidationPipeline pipeline;
        public final SessionStore store;
        public final FeatureGate gate;
        public final LicenseIssuer issuer;
        public final PayloadSealer sealer;

        public Harness() {
            this(settings(), EnvironmentAttestation.permitAll());
        }

        public Harness(CoreSettings settings, EnvironmentAttestation environment) {
            this.settings = settings;
            SignatureCodec codec = new SignatureCodec(settings.signingSecret());
            this.pipeline = new ValidationPipeline(settings.validityWindow(), codec,
                    new ClockIntegrityChecker(settings.clockTolerance(), reference), environment);
            this.store = new SessionStore(pipeline, new PayloadUnlockEngine(settings.unlockSecret(), payloads),
                    settings, clock, diagnostics);
            this.gate = new FeatureGate(store);
            this.issuer = new LicenseIssuer(codec, settings.validityWindow());
            this.sealer = new PayloadSealer(settings.unlockSecret());
        }

        /** Emite una licencia anclada en T0 y deja sellado el payload de la identidad. */
        public EntitlementRecord provision(String identity) {
            return provision(identity, T0);
        }

        public EntitlementRecord provision(String identity, Instant anchor) {
            payloads.put(identity, sealer.seal(identity, rules()));
            return issuer.issue(identity, FEATURES, anchor);
        }
    }
}
