package license.gate.core.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.UnaryOperator;

/**
 * Parámetros del núcleo. Inmutable; se arma con {@link #builder()} partiendo de {@link Defaults}.
 */
public final class CoreSettings {
    private static final Logger LOG = LoggerFactory.getLogger(CoreSettings.class);

    private final Duration validityWindow;
    private final Duration clockTolerance;
    private final Duration sessionMaxAge;
    private final Duration sessionIdleTimeout;
    private final long maxAccessCount;
    private final byte[] signingSecret;
    private final byte[] unlockSecret;
    private final String watermarkSalt;
    private final String payloadResource;
    private final String buildHash;

    private CoreSettings(Builder b) {
        this.validityWindow = positive(b.validityWindow, "validityWindow");
        this.clockTolerance = positive(b.clockTolerance, "clockTolerance");
        this.sessionMaxAge = positive(b.sessionMaxAge, "sessionMaxAge");
        this.sessionIdleTimeout = positive(b.sessionIdleTimeout, "sessionIdleTimeout");
        if (b.maxAccessCount <= 0) throw new IllegalArgumentException("maxAccessCount debe ser > 0");
        this.maxAccessCount = b.maxAccessCount;
        this.signingSecret = nonEmpty(b.signingSecret, "signingSecret");
        this.unlockSecret = nonEmpty(b.unlockSecret, "unlockSecret");
        this.watermarkSalt = b.watermarkSalt;
        this.payloadResource = b.payloadResource;
        this.buildHash = b.buildHash;
    }

    public static Builder builder() { return new Builder(); }

    public static CoreSettings defaults() { return builder().build(); }

    /**
     * Secretos aprovisionados: variable de entorno, luego propiedad del sistema, luego el valor de ejemplo.
     */
    public static CoreSettings fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static CoreSettings fromEnvironment(UnaryOperator<String> env) {
        Builder b = builder();
        String signing = lookup(env, Defaults.ENV_SIGNING_SECRET, Defaults.PROP_SIGNING_SECRET);
        String unlock = lookup(env, Defaults.ENV_UNLOCK_SECRET, Defaults.PROP_UNLOCK_SECRET);
        if (signing != null) b.signingSecret(signing);
        if (unlock != null) b.unlockSecret(unlock);
        b.buildHash(lookup(env, Defaults.ENV_BUILD_HASH, Defaults.PROP_BUILD_HASH));
        if (signing == null || unlock == null) {
            LOG.warn("Secretos no aprovisionados; se usan los valores de ejemplo embebidos");
        }
        return b.build();
    }

    private static String lookup(UnaryOperator<String> env, String envName, String property) {
        String v = env.apply(envName);
        if (v == null || v.isBlank()) v = System.getProperty(property);
        return v == null || v.isBlank() ? null : v;
    }

    public Duration validityWindow() { return validityWindow; }
    public Duration clockTolerance() { return clockTolerance; }
    public Duration sessionMaxAge() { return sessionMaxAge; }
    public Duration sessionIdleTimeout() { return sessionIdleTimeout; }
    public long maxAccessCount() { return maxAccessCount; }
    public byte[] signingSecret() { return Arrays.copyOf(signingSecret, signingSecret.length); }
    public byte[] unlockSecret() { return Arrays.copyOf(unlockSecret, unlockSecret.length); }
    public String watermarkSalt() { return watermarkSalt; }
    public String payloadResource() { return payloadResource; }
    /** Hash del artefacto en ejecución; null si no se aprovisionó (licencias atadas a build se rechazan). */
    public String buildHash() { return buildHash; }

    private static Duration positive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " debe ser positivo");
        return d;
    }

    private static byte[] nonEmpty(byte[] secret, String name) {
        if (secret == null || secret.length == 0) throw new IllegalArgumentException(name + " vacío");
        return Arrays.copyOf(secret, secret.length);
    }

    public static final class Builder {
        private Duration validityWindow = Defaults.VALIDITY_WINDOW;
        private Duration clockTolerance = Defaults.CLOCK_TOLERANCE;
        private Duration sessionMaxAge = Defaults.SESSION_MAX_AGE;
        private Duration sessionIdleTimeout = Defaults.SESSION_IDLE_TIMEOUT;
        private long maxAccessCount = Defaults.MAX_ACCESS_COUNT;
        private byte[] signingSecret = Defaults.SIGNING_SECRET.getBytes(StandardCharsets.UTF_8);
        private byte[] unlockSecret = Defaults.UNLOCK_SECRET.getBytes(StandardCharsets.UTF_8);
        private String watermarkSalt = Defaults.WATERMARK_SALT;
        private String payloadResource = Defaults.PAYLOAD_RESOURCE;
        private String buildHash;

        private Builder() {}

        public Builder validityWindow(Duration d) { this.validityWindow = d; return this; }
        public Builder clockTolerance(Duration d) { this.clockTolerance = d; return this; }
        public Builder sessionMaxAge(Duration d) { this.sessionMaxAge = d; return this; }
        public Builder sessionIdleTimeout(Duration d) { this.sessionIdleTimeout = d; return this; }
        public Builder maxAccessCount(long n) { this.maxAccessCount = n; return this; }
        public Builder signingSecret(String s) { this.signingSecret = s.getBytes(StandardCharsets.UTF_8); return this; }
        public Builder unlockSecret(String s) { this.unlockSecret = s.getBytes(StandardCharsets.UTF_8); return this; }
        public Builder watermarkSalt(String s) { this.watermarkSalt = s; return this; }
        public Builder payloadResource(String s) { this.payloadResource = s; return this; }
        public Builder buildHash(String s) { this.buildHash = s; return this; }

        public CoreSettings build() { return new CoreSettings(this); }
    }
}
