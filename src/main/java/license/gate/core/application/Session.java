package license.gate.core.application;

import license.gate.core.domain.EntitlementRecord;
import license.gate.core.domain.RuleSet;
import license.gate.core.domain.RuleSetView;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Activación viva de una licencia. Dueña exclusiva del RuleSet descifrado.
 * El contador, la última actividad y el cierre se mutan bajo el write lock;
 * las lecturas toman el read lock para ver un estado consistente.
 */
final class Session {

    private final UUID id = UUID.randomUUID();
    private final EntitlementRecord record;
    private final RuleSet ruleSet;
    private final String watermark;
    private final Instant startedAt;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Instant lastAccess;
    private long accessCount;
    private boolean closed;

    Session(EntitlementRecord record, RuleSet ruleSet, String watermarkSalt, Instant startedAt) {
        this.record = record;
        this.ruleSet = ruleSet;
        this.watermark = watermark(record.identity(), watermarkSalt);
        this.startedAt = startedAt;
        this.lastAccess = startedAt;
    }

    UUID id() { return id; }
    EntitlementRecord record() { return record; }
    String identity() { return record.identity(); }
    String watermark() { return watermark; }
    Instant startedAt() { return startedAt; }

    SessionHandle handle() { return new SessionHandle(record.identity(), id); }

    RuleSetView view() { return new RuleSetView(ruleSet, record.identity(), watermark); }

    long accessCount() {
        lock.readLock().lock();
        try {
            return accessCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    Instant lastAccess() {
        lock.readLock().lock();
        try {
            return lastAccess;
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Estado sin tocar el contador. {@code recordValid} = resultado del pipeline sobre la licencia. */
    Liveness liveness(boolean recordValid, Instant now, CoreSettings settings) {
        lock.readLock().lock();
        try {
            return evaluate(recordValid, now, settings);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registra un acceso: evalúa el estado con el contador actual y luego lo incrementa
     * (una vez por llamada, aunque se niegue). Una sesión cerrada no cuenta.
     */
    Liveness recordAccess(boolean recordValid, Instant now, CoreSettings settings) {
        lock.writeLock().lock();
        try {
            Liveness state = evaluate(recordValid, now, settings);
            if (state == Liveness.CLOSED) return state;
            accessCount++;
            if (state == Liveness.LIVE) lastAccess = now;
            return state;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Cierra y suelta el RuleSet. Idempotente. */
    void close() {
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            ruleSet.discard();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Liveness evaluate(boolean recordValid, Instant now, CoreSettings settings) {
        if (closed) return Liveness.CLOSED;
        if (!recordValid) return Liveness.REVOKED;
        if (Duration.between(startedAt, now).compareTo(settings.sessionMaxAge()) >= 0) return Liveness.TIMED_OUT;
        if (Duration.between(lastAccess, now).compareTo(settings.sessionIdleTimeout()) >= 0) return Liveness.TIMED_OUT;
        if (accessCount >= settings.maxAccessCount()) return Liveness.QUOTA_EXHAUSTED;
        return Liveness.LIVE;
    }

    /** {@code wm_} + primeros 8 bytes de SHA-256(identity + sal) en hex. */
    static String watermark(String identity, String salt) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(identity.getBytes(StandardCharsets.UTF_8));
            md.update(salt.getBytes(StandardCharsets.UTF_8));
            byte[] d = md.digest();
            StringBuilder sb = new StringBuilder("wm_");
            for (int i = 0; i < 8; i++) sb.append(String.format("%02x", d[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible", e);
        }
    }
}
