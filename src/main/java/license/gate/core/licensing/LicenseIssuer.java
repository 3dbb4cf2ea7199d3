package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/** Lado emisor: arma y firma licencias. issued_at = ancla; expires_at = ancla + ventana (informativo). */
public class LicenseIssuer {

    private final SignatureCodec codec;
    private final Duration validityWindow;

    public LicenseIssuer(SignatureCodec codec, Duration validityWindow) {
        this.codec = codec;
        this.validityWindow = validityWindow;
    }

    public EntitlementRecord issue(String identity, Collection<String> features, Instant anchor) {
        return issue(identity, features, anchor, null, Map.of());
    }

    public EntitlementRecord issue(String identity, Collection<String> features, Instant anchor,
                                   String hwid, Map<String, String> metadata) {
        return issue(identity, features, anchor, hwid, null, metadata);
    }

    /** hwid y buildHash opcionales; ambos, junto con metadata, quedan cubiertos por la firma. */
    public EntitlementRecord issue(String identity, Collection<String> features, Instant anchor,
                                   String hwid, String buildHash, Map<String, String> metadata) {
        return EntitlementRecord.builder()
                .licenseId(UUID.randomUUID().toString())
                .identity(identity)
                .features(features)
                .issuedAt(anchor)
                .expiresAt(anchor.plus(validityWindow))
                .anchorTimestamp(anchor)
                .hwid(hwid)
                .buildHash(buildHash)
                .metadata(metadata)
                .signature(codec.sign(identity, anchor, features, hwid, buildHash, metadata))
                .build();
    }

    /** Igual que {@link #issue} pero ya serializada a JSON. */
    public byte[] issueFile(String identity, Collection<String> features, Instant anchor) {
        return LicenseCodec.encodeEntitlement(issue(identity, features, anchor));
    }
}
