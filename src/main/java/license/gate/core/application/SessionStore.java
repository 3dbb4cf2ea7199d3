package license.gate.core.application;

import license.gate.core.domain.EntitlementRecord;
import license.gate.core.domain.RuleSet;
import license.gate.core.domain.RuleSetView;
import license.gate.core.licensing.EntitlementException;
import license.gate.core.licensing.ErrorKind;
import license.gate.core.licensing.LicenseCodec;
import license.gate.core.licensing.ValidationPipeline;
import license.gate.core.licensing.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registro de sesiones vivas, una por identidad. Activar y cerrar se serializan por franja de
 * identidades (locks fijos, no crecen con las identidades vistas); las consultas de estado corren en paralelo.
 */
public class SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    /** Locks por franja de identidades: cantidad fija sin importar cuántas identidades pasen. */
    static final int LOCK_STRIPES = 64;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    private final ValidationPipeline pipeline;
    private final PayloadUnlockEngine unlockEngine;
    private final CoreSettings settings;
    private final Clock clock;
    private final ActivationDiagnostics diagnostics;

    public SessionStore(ValidationPipeline pipeline,
                        PayloadUnlockEngine unlockEngine,
                        CoreSettings settings,
                        Clock clock,
                        ActivationDiagnostics diagnostics) {
        this.pipeline = pipeline;
        this.unlockEngine = unlockEngine;
        this.settings = settings;
        this.clock = clock;
        this.diagnostics = diagnostics;
        for (int i = 0; i < locks.length; i++) locks[i] = new ReentrantLock();
    }

    /** Decodifica y activa. JSON inválido -> MALFORMED_RECORD sin tocar el estado. */
    public SessionHandle activate(byte[] entitlementBytes) throws EntitlementException {
        EntitlementRecord record;
        try {
            record = LicenseCodec.decodeEntitlement(entitlementBytes);
        } catch (EntitlementException e) {
            fail(null, e.getKind(), "structural");
            throw e;
        }
        return activate(record);
    }

    /**
     * Corre el pipeline completo; si pasa, descifra las reglas y reemplaza la sesión anterior de la
     * misma identidad. Si algo falla no se modifica nada.
     */
    public SessionHandle activate(EntitlementRecord record) throws EntitlementException {
        Instant now = clock.instant();
        ValidationReport report = pipeline.run(record, now);
        String identity = record == null ? null : record.identity();
        if (!report.isValid()) {
            fail(identity, report.failureKind(), report.failedLayer());
            throw new EntitlementException(report.failureKind(),
                    "Licencia rechazada en la capa " + report.failedLayer());
        }

        ReentrantLock lock = lockFor(identity);
        lock.lock();
        try {
            RuleSet rules;
            try {
                rules = unlockEngine.unlock(identity);
            } catch (EntitlementException e) {
                fail(identity, e.getKind(), null);
                throw e;
            }
            Session fresh = new Session(record, rules, settings.watermarkSalt(), now);
            Session previous = sessions.put(identity, fresh);
            if (previous != null) {
                previous.close();
                LOG.info("Sesión de {} reemplazada por una nueva activación", identity);
            } else {
                LOG.info("Sesión activada para {}", identity);
            }
            return fresh.handle();
        } finally {
            lock.unlock();
        }
    }

    /** Vuelve a validar la licencia (no se cachea), revisa edad, inactividad y cupo. */
    public boolean isLive(SessionHandle handle) {
        if (handle == null) return false;
        Session session = sessions.get(handle.identity());
        if (session == null || !session.id().equals(handle.sessionId())) return false;
        return inspect(session, false) == Liveness.LIVE;
    }

    /** Cierra la sesión del handle y suelta su RuleSet. Un handle obsoleto no hace nada. */
    public void teardown(SessionHandle handle) {
        if (handle == null) return;
        ReentrantLock lock = lockFor(handle.identity());
        lock.lock();
        try {
            Session session = sessions.get(handle.identity());
            if (session != null && session.id().equals(handle.sessionId())) {
                sessions.remove(handle.identity(), session);
                session.close();
                LOG.debug("Sesión de {} cerrada", handle.identity());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Cierre del proceso: descarta todas las sesiones. */
    public void teardownAll() {
        for (Session session : sessions.values()) {
            teardown(session.handle());
        }
    }

    /** Vista de las reglas mientras la sesión siga viva. */
    public RuleSetView ruleSet(String identity) throws EntitlementException {
        Session session = identity == null ? null : sessions.get(identity);
        if (session == null) throw new EntitlementException(ErrorKind.NOT_ACTIVATED, "Sin activación");
        if (inspect(session, false) != Liveness.LIVE) {
            throw new EntitlementException(ErrorKind.SESSION_EXPIRED, "Sesión expirada");
        }
        return session.view();
    }

    /** Sesión actual de la identidad, viva o no; null si no hay. */
    Session sessionFor(String identity) {
        return identity == null ? null : sessions.get(identity);
    }

    /**
     * Evalúa la sesión; con {@code countAccess} además incrementa el contador.
     * Las sesiones revocadas o vencidas se descartan aquí.
     */
    Liveness inspect(Session session, boolean countAccess) {
        Instant now = clock.instant();
        boolean recordValid = pipeline.run(session.record(), now).isValid();
        Liveness state = countAccess
                ? session.recordAccess(recordValid, now, settings)
                : session.liveness(recordValid, now, settings);
        if (state.discards()) {
            LOG.info("Sesión de {} descartada: {}", session.identity(), state);
            teardown(session.handle());
        }
        return state;
    }

    /** Informe para el operador, estilo clave/valor. */
    public Map<String, String> securityReport(String identity) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("identity", String.valueOf(identity));
        Session session = sessionFor(identity);
        if (session == null) {
            info.put("license_valid", "false");
            info.put("session_state", "NOT_ACTIVATED");
        } else {
            Instant now = clock.instant();
            EntitlementRecord record = session.record();
            ValidationReport report = pipeline.run(record, now);
            info.put("license_valid", Boolean.toString(report.isValid()));
            if (!report.isValid()) info.put("failed_layer", report.failedLayer());
            info.put("signature_valid", Boolean.toString(pipeline.signatureCodec().verify(record)));
            info.put("days_remaining", Long.toString(record.daysRemaining(now, settings.validityWindow())));
            info.put("anchor_timestamp", record.anchorTimestamp().toString());
            info.put("expiration_date", record.authoritativeExpiration(settings.validityWindow()).toString());
            info.put("validity_window_days", Long.toString(settings.validityWindow().toDays()));
            info.put("session_start", session.startedAt().toString());
            info.put("last_access", session.lastAccess().toString());
            info.put("access_attempts", Long.toString(session.accessCount()));
            info.put("max_access_count", Long.toString(settings.maxAccessCount()));
            info.put("watermark", session.watermark());
            info.put("session_state", session.liveness(report.isValid(), now, settings).name());
        }
        diagnostics.lastFailure(String.valueOf(identity))
                .ifPresent(f -> info.put("last_failure", f.kind + (f.layer == null ? "" : "@" + f.layer)));
        return info;
    }

    /** Accesos registrados en la sesión actual de la identidad; 0 si no hay sesión. */
    public long accessCount(String identity) {
        Session session = sessionFor(identity);
        return session == null ? 0 : session.accessCount();
    }

    public int size() { return sessions.size(); }

    public Clock clock() { return clock; }

    private void fail(String identity, ErrorKind kind, String layer) {
        diagnostics.record(clock.instant(), identity, kind, layer);
        LOG.warn("Activación rechazada: identity={} kind={} layer={}",
                identity == null ? ActivationDiagnostics.UNKNOWN_IDENTITY : identity, kind, layer);
    }

    /** Misma identidad, mismo lock. Dos identidades pueden compartir franja. */
    ReentrantLock lockFor(String identity) {
        return locks[Math.floorMod(Objects.requireNonNull(identity).hashCode(), locks.length)];
    }
}
