package license.gate.core.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Hora de pared tomada al arrancar + tiempo transcurrido según {@link System#nanoTime()}.
 * Mover el reloj del sistema después del arranque no mueve esta referencia.
 */
public class MonotonicReferenceClock implements ReferenceClock {

    private final Instant baseWall;
    private final long baseNanos;
    private final LongSupplier nanoTime;

    public MonotonicReferenceClock() {
        this(Clock.systemUTC(), System::nanoTime);
    }

    public MonotonicReferenceClock(Clock wallClock, LongSupplier nanoTime) {
        this.nanoTime = nanoTime;
        this.baseWall = wallClock.instant();
        this.baseNanos = nanoTime.getAsLong();
    }

    @Override
    public Optional<Instant> now() {
        long elapsed = nanoTime.getAsLong() - baseNanos;
        if (elapsed < 0) return Optional.empty(); // contador monotónico que retrocede: no confiable
        return Optional.of(baseWall.plus(Duration.ofNanos(elapsed)));
    }
}
