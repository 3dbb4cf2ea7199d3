package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;

import java.time.Instant;

/** Una capa del pipeline. Independiente de las demás. */
public interface ValidationLayer {

    /** Nombre corto para diagnóstico ("structural", "expiration", ...). */
    String name();

    /** Tipo de error que se reporta si la capa no pasa. */
    ErrorKind failureKind();

    boolean passes(EntitlementRecord record, Instant now);
}
