package license.gate.core.application;

import java.time.Duration;

public final class Defaults {
    private Defaults() {}

    // Vigencia y reloj
    public static final Duration VALIDITY_WINDOW = Duration.ofDays(14);
    public static final Duration CLOCK_TOLERANCE = Duration.ofHours(24);

    // Sesión
    public static final Duration SESSION_MAX_AGE = Duration.ofHours(24);
    public static final Duration SESSION_IDLE_TIMEOUT = Duration.ofHours(12);
    public static final long MAX_ACCESS_COUNT = 1000;

    // Secretos de ejemplo: en producción se inyectan al aprovisionar (ver CoreSettings.fromEnvironment)
    public static final String SIGNING_SECRET = "lgc_signing_2024_placeholder";
    public static final String UNLOCK_SECRET = "lgc_session_key_2024_placeholder";
    public static final String WATERMARK_SALT = "watermark_salt";

    // Payload embebido
    public static final String PAYLOAD_RESOURCE = "/payload/encrypted_payload.bin";

    // Variables de entorno / propiedades del sistema
    public static final String ENV_SIGNING_SECRET = "LICENSE_GATE_SIGNING_SECRET";
    public static final String ENV_UNLOCK_SECRET = "LICENSE_GATE_UNLOCK_SECRET";
    public static final String PROP_SIGNING_SECRET = "license.gate.signing-secret";
    public static final String PROP_UNLOCK_SECRET = "license.gate.unlock-secret";
    public static final String ENV_BUILD_HASH = "LICENSE_GATE_BUILD_HASH";
    public static final String PROP_BUILD_HASH = "license.gate.build-hash";
}
