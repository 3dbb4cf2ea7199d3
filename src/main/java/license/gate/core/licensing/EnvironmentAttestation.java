package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;

/** Punto de extensión para comprobar el entorno de ejecución de cada despliegue. */
public interface EnvironmentAttestation {

    /** false si el entorno no está permitido para este registro. */
    boolean permits(EntitlementRecord record);

    static EnvironmentAttestation permitAll() {
        return record -> true;
    }
}
