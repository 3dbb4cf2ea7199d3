package license.gate.core.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.prefs.Preferences;

/**
 * Referencia que nunca retrocede entre ejecuciones: max(delegado, última hora vista).
 * La última hora vista se guarda en {@link Preferences}, así un reloj atrasado antes de arrancar se nota.
 */
public class HighWaterMarkClock implements ReferenceClock {
    private static final Logger LOG = LoggerFactory.getLogger(HighWaterMarkClock.class);

    static final String LAST_SEEN_KEY = "lastSeenEpochMillis";

    private final ReferenceClock delegate;
    private final Preferences prefs;

    public HighWaterMarkClock(ReferenceClock delegate) {
        this(delegate, Preferences.userNodeForPackage(HighWaterMarkClock.class));
    }

    public HighWaterMarkClock(ReferenceClock delegate, Preferences prefs) {
        this.delegate = delegate;
        this.prefs = prefs;
    }

    @Override
    public synchronized Optional<Instant> now() {
        Optional<Instant> current = delegate.now();
        if (current.isEmpty()) return current;
        try {
            long lastSeen = prefs.getLong(LAST_SEEN_KEY, Long.MIN_VALUE);
            long candidate = current.get().toEpochMilli();
            if (candidate > lastSeen) {
                prefs.putLong(LAST_SEEN_KEY, candidate);
                return current;
            }
            return Optional.of(Instant.ofEpochMilli(lastSeen));
        } catch (IllegalStateException | SecurityException e) {
            LOG.warn("No se pudo leer la marca de tiempo persistida", e);
            return Optional.empty();
        }
    }

    /** Última hora vista, si existe. */
    public Optional<Instant> lastSeen() {
        long lastSeen = prefs.getLong(LAST_SEEN_KEY, Long.MIN_VALUE);
        return lastSeen == Long.MIN_VALUE ? Optional.empty() : Optional.of(Instant.ofEpochMilli(lastSeen));
    }
}
