package license.gate.core.licensing;

/**
 * Fallo de activación o de acceso a la configuración.
 * No hay reintentos: una activación fallida requiere una licencia nueva.
 */
public class EntitlementException extends Exception {

    private final ErrorKind kind;

    public EntitlementException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EntitlementException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** Error genérico para el llamador: no dice qué capa falló ni lleva la causa. */
    public static EntitlementException activationFailed() {
        return new EntitlementException(ErrorKind.ACTIVATION_FAILED, "Activación fallida");
    }

    public ErrorKind getKind() { return kind; }
}
