package license.gate.core.infrastructure;

import java.time.Instant;
import java.util.Optional;

/** Fuente de tiempo independiente del reloj del sistema. Vacío = no se pudo obtener (falla cerrado). */
public interface ReferenceClock {
    Optional<Instant> now();
}
