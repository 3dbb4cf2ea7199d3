package license.gate.core.domain;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Licencia ya deserializada: identidad, features, vigencia y firma.
 * <p>
 * La vigencia que cuenta es {@code anchorTimestamp + ventana}; {@code expiresAt} solo se muestra.
 * No valida nada al construirse: eso lo hace la capa estructural del pipeline.
 */
public final class EntitlementRecord {

    private final String licenseId;
    private final String identity;
    private final Set<String> features;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final Instant anchorTimestamp;
    private final String signature;
    private final String hwid;
    private final String buildHash;
    private final Map<String, String> metadata;

    private EntitlementRecord(Builder b) {
        this.licenseId = b.licenseId;
        this.identity = b.identity;
        this.features = b.features == null ? null : Collections.unmodifiableSet(new TreeSet<>(b.features));
        this.issuedAt = b.issuedAt;
        this.expiresAt = b.expiresAt;
        this.anchorTimestamp = b.anchorTimestamp;
        this.signature = b.signature;
        this.hwid = b.hwid;
        this.buildHash = b.buildHash;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder()
                .licenseId(licenseId)
                .identity(identity)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .anchorTimestamp(anchorTimestamp)
                .signature(signature)
                .hwid(hwid)
                .buildHash(buildHash)
                .metadata(metadata);
        if (features != null) b.features(features);
        return b;
    }

    public String licenseId() { return licenseId; }
    public String identity() { return identity; }
    /** Ordenadas alfabéticamente; {@code null} solo si el registro está incompleto. */
    public Set<String> features() { return features; }
    public Instant issuedAt() { return issuedAt; }
    /** Informativo (UI). Nunca decide el acceso. */
    public Instant expiresAt() { return expiresAt; }
    public Instant anchorTimestamp() { return anchorTimestamp; }
    public String signature() { return signature; }
    public String hwid() { return hwid; }
    /** Hash del artefacto distribuido al que queda atada; null si sirve para cualquier build. */
    public String buildHash() { return buildHash; }
    public Map<String, String> metadata() { return metadata; }

    public boolean hasFeature(String feature) {
        return features != null && feature != null && features.contains(feature);
    }

    /** Expiración autoritativa: ancla + ventana fija. */
    public Instant authoritativeExpiration(Duration validityWindow) {
        try {
            return anchorTimestamp.plus(validityWindow);
        } catch (DateTimeException | ArithmeticException e) {
            // ancla en el borde del rango: la capa de ancla es la que la rechaza
            return Instant.MAX;
        }
    }

    /** Días completos que quedan; 0 si ya expiró. */
    public long daysRemaining(Instant now, Duration validityWindow) {
        Instant expiration = authoritativeExpiration(validityWindow);
        if (!now.isBefore(expiration)) return 0;
        return Duration.between(now, expiration).toDays();
    }

    @Override
    public String toString() {
        return "EntitlementRecord{licenseId=" + licenseId + ", identity=" + identity
                + ", features=" + features + ", anchor=" + anchorTimestamp + "}";
    }

    public static final class Builder {
        private String licenseId;
        private String identity;
        private Collection<String> features;
        private Instant issuedAt;
        private Instant expiresAt;
        private Instant anchorTimestamp;
        private String signature;
        private String hwid;
        private String buildHash;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder licenseId(String licenseId) { this.licenseId = licenseId; return this; }
        public Builder identity(String identity) { this.identity = identity; return this; }
        public Builder features(Collection<String> features) { this.features = features; return this; }
        public Builder issuedAt(Instant issuedAt) { this.issuedAt = issuedAt; return this; }
        public Builder expiresAt(Instant expiresAt) { this.expiresAt = expiresAt; return this; }
        public Builder anchorTimestamp(Instant anchorTimestamp) { this.anchorTimestamp = anchorTimestamp; return this; }
        public Builder signature(String signature) { this.signature = signature; return this; }
        public Builder hwid(String hwid) { this.hwid = hwid; return this; }
        public Builder buildHash(String buildHash) { this.buildHash = buildHash; return this; }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            if (metadata != null) this.metadata.putAll(metadata);
            return this;
        }

        public Builder putMetadata(String key, String value) {
            this.metadata.put(Objects.requireNonNull(key), value);
            return this;
        }

        public EntitlementRecord build() { return new EntitlementRecord(this); }
    }
}
