package license.gate.core.licensing;

/** Motivo de rechazo. Solo llega al operador (diagnóstico); el llamador ve ACTIVATION_FAILED. */
public enum ErrorKind {
    MALFORMED_RECORD,
    EXPIRED_ENTITLEMENT,
    ANCHOR_IN_FUTURE,
    CLOCK_INTEGRITY_FAILURE,
    SIGNATURE_MISMATCH,
    ENVIRONMENT_REJECTED,
    DECRYPTION_FAILED,
    NOT_ACTIVATED,
    SESSION_EXPIRED,
    ACTIVATION_FAILED
}
