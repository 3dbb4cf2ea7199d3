package license.gate.core.application;

/** Estado de una sesión al consultarla. */
public enum Liveness {
    LIVE,
    /** Cerrada explícitamente o reemplazada. */
    CLOSED,
    /** La licencia ya no valida (expiró, reloj, firma, entorno). */
    REVOKED,
    /** Superó la edad máxima o el tiempo de inactividad. */
    TIMED_OUT,
    /** Llegó al tope de accesos. */
    QUOTA_EXHAUSTED;

    /** Estados en los que el store descarta la sesión. */
    boolean discards() {
        return this == REVOKED || this == TIMED_OUT;
    }
}
