package license.gate.core;

import license.gate.core.application.ActivationDiagnostics;
import license.gate.core.application.CoreSettings;
import license.gate.core.application.FeatureGate;
import license.gate.core.application.PayloadUnlockEngine;
import license.gate.core.application.SessionHandle;
import license.gate.core.application.SessionStore;
import license.gate.core.domain.RuleSetView;
import license.gate.core.infrastructure.ClasspathPayloadSource;
import license.gate.core.infrastructure.HighWaterMarkClock;
import license.gate.core.infrastructure.MonotonicReferenceClock;
import license.gate.core.infrastructure.PayloadSource;
import license.gate.core.infrastructure.ReferenceClock;
import license.gate.core.licensing.ClockIntegrityChecker;
import license.gate.core.licensing.DeviceEnvironmentAttestation;
import license.gate.core.licensing.EntitlementException;
import license.gate.core.licensing.EnvironmentAttestation;
import license.gate.core.licensing.SignatureCodec;
import license.gate.core.licensing.ValidationPipeline;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Punto de entrada para la aplicación anfitriona.
 * <p>
 * {@link #activate} valida la licencia y desbloquea las reglas; {@link #isFeatureAvailable} y
 * {@link #listFeatures} responden sin lanzar; {@link #getRuleSet} entrega la configuración
 * al módulo de extracción. El motivo concreto de un rechazo solo aparece en {@link #diagnostics()}.
 */
public class ProtectedCore implements AutoCloseable {

    private final SessionStore store;
    private final FeatureGate gate;
    private final ActivationDiagnostics diagnostics;

    private ProtectedCore(SessionStore store, ActivationDiagnostics diagnostics) {
        this.store = store;
        this.gate = new FeatureGate(store);
        this.diagnostics = diagnostics;
    }

    public static Builder builder() { return new Builder(); }

    /** Activa la licencia serializada. Cualquier rechazo llega como ACTIVATION_FAILED. */
    public SessionHandle activate(byte[] entitlementBytes) throws EntitlementException {
        try {
            return store.activate(entitlementBytes);
        } catch (EntitlementException e) {
            throw EntitlementException.activationFailed();
        }
    }

    public boolean isFeatureAvailable(String identity, String feature) {
        return gate.checkAccess(identity, feature);
    }

    public List<String> listFeatures(String identity) {
        return gate.listFeatures(identity);
    }

    /** Vista de solo lectura; NOT_ACTIVATED o SESSION_EXPIRED si no hay sesión viva. */
    public RuleSetView getRuleSet(String identity) throws EntitlementException {
        return store.ruleSet(identity);
    }

    public boolean isLive(SessionHandle handle) {
        return store.isLive(handle);
    }

    public void teardown(SessionHandle handle) {
        store.teardown(handle);
    }

    // ---- Canal del operador ----

    public ActivationDiagnostics diagnostics() { return diagnostics; }

    public Map<String, String> securityReport(String identity) {
        return store.securityReport(identity);
    }

    SessionStore sessionStore() { return store; }

    /** Cierre del proceso: todas las sesiones se descartan. */
    @Override
    public void close() {
        store.teardownAll();
    }

    public static final class Builder {
        private CoreSettings settings;
        private Clock clock = Clock.systemUTC();
        private ReferenceClock referenceClock;
        private EnvironmentAttestation environment;
        private PayloadSource payloadSource;
        private ActivationDiagnostics diagnostics;

        private Builder() {}

        public Builder settings(CoreSettings settings) { this.settings = settings; return this; }
        /** Reloj local (el que un atacante podría mover). */
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder referenceClock(ReferenceClock referenceClock) { this.referenceClock = referenceClock; return this; }
        public Builder environment(EnvironmentAttestation environment) { this.environment = environment; return this; }
        public Builder payloadSource(PayloadSource payloadSource) { this.payloadSource = payloadSource; return this; }
        public Builder diagnostics(ActivationDiagnostics diagnostics) { this.diagnostics = diagnostics; return this; }

        public ProtectedCore build() {
            CoreSettings s = settings != null ? settings : CoreSettings.fromEnvironment();
            ReferenceClock ref = referenceClock != null ? referenceClock
                    : new HighWaterMarkClock(new MonotonicReferenceClock(clock, System::nanoTime));
            EnvironmentAttestation env = environment != null ? environment
                    : new DeviceEnvironmentAttestation(s.buildHash(), false);
            PayloadSource source = payloadSource != null ? payloadSource : new ClasspathPayloadSource(s.payloadResource());
            ActivationDiagnostics diag = diagnostics != null ? diagnostics : new ActivationDiagnostics();

            ValidationPipeline pipeline = new ValidationPipeline(
                    s.validityWindow(),
                    new SignatureCodec(s.signingSecret()),
                    new ClockIntegrityChecker(s.clockTolerance(), ref),
                    env);
            PayloadUnlockEngine engine = new PayloadUnlockEngine(s.unlockSecret(), source);
            SessionStore store = new SessionStore(pipeline, engine, s, clock, diag);
            return new ProtectedCore(store, diag);
        }
    }
}
