package license.gate.core.licensing;

import license.gate.core.infrastructure.ReferenceClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Compara el reloj local contra una referencia independiente; tolerancia fija. */
public class ClockIntegrityChecker {
    private static final Logger LOG = LoggerFactory.getLogger(ClockIntegrityChecker.class);

    private final Duration tolerance;
    private final ReferenceClock referenceClock;

    public ClockIntegrityChecker(Duration tolerance, ReferenceClock referenceClock) {
        if (tolerance == null || tolerance.isNegative() || tolerance.isZero()) {
            throw new IllegalArgumentException("Tolerancia de reloj inválida: " + tolerance);
        }
        this.tolerance = tolerance;
        this.referenceClock = referenceClock;
    }

    /** true si |local - referencia| es estrictamente menor que la tolerancia. */
    public boolean check(Instant local, Instant reference) {
        if (local == null || reference == null) return false;
        return Duration.between(local, reference).abs().compareTo(tolerance) < 0;
    }

    /** Igual que {@link #check(Instant, Instant)} pero pidiendo la referencia; sin referencia, falla. */
    public boolean check(Instant local) {
        Optional<Instant> reference;
        try {
            reference = referenceClock.now();
        } catch (RuntimeException e) {
            LOG.warn("Reloj de referencia no disponible", e);
            return false;
        }
        if (reference.isEmpty()) {
            LOG.warn("Reloj de referencia sin lectura; se rechaza");
            return false;
        }
        boolean ok = check(local, reference.get());
        if (!ok) LOG.warn("Deriva de reloj sospechosa: local={} referencia={}", local, reference.get());
        return ok;
    }

    public Duration tolerance() { return tolerance; }
}
