package license.gate.core.licensing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import license.gate.core.domain.EntitlementRecord;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Firma HMAC-SHA256 sobre (identity, anchor, features, hwid, buildHash, metadata) con el secreto
 * compartido del emisor. expires_at queda fuera: es informativo.
 * Determinista: mismas entradas, misma firma.
 */
public class SignatureCodec {

    private static final String ALGORITHM = "HmacSHA256";

    /** Serializa los claims de forma estable para firmarlos/verificarlos. */
    private static final ObjectMapper CANON = new ObjectMapper()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final byte[] secret;

    public SignatureCodec(byte[] secret) {
        if (secret == null || secret.length == 0) throw new IllegalArgumentException("Secreto de firma vacío");
        this.secret = Arrays.copyOf(secret, secret.length);
    }

    /**
     * Claims firmados. Las features van ordenadas para que el orden de la licencia no importe.
     * hwid, buildHash y metadata se omiten cuando no vienen (licencia no atada).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class SignedClaims {
        public String identity;
        public String anchor;
        public List<String> features;
        public String hwid;
        public String buildHash;
        public Map<String, String> metadata;
    }

    /** Licencia sin atar a equipo ni a build, sin metadata. */
    public String sign(String identity, Instant anchor, Collection<String> features) {
        return sign(identity, anchor, features, null, null, null);
    }

    public String sign(String identity, Instant anchor, Collection<String> features,
                       String hwid, String buildHash, Map<String, String> metadata) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            byte[] message = canonicalBytes(identity, anchor, features, hwid, buildHash, metadata);
            return Base64.getEncoder().encodeToString(mac.doFinal(message));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC no disponible", e);
        }
    }

    /** Recalcula la firma y compara byte a byte en tiempo constante. Cualquier diferencia falla. */
    public boolean verify(EntitlementRecord record) {
        if (record == null || record.signature() == null || record.identity() == null
                || record.anchorTimestamp() == null || record.features() == null) {
            return false;
        }
        String expected = sign(record.identity(), record.anchorTimestamp(), record.features(),
                record.hwid(), record.buildHash(), record.metadata());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                record.signature().getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] canonicalBytes(String identity, Instant anchor, Collection<String> features,
                                         String hwid, String buildHash, Map<String, String> metadata) {
        SignedClaims claims = new SignedClaims();
        claims.identity = identity;
        claims.anchor = anchor.toString();
        claims.features = new ArrayList<>(new TreeSet<>(features));
        claims.hwid = blankToNull(hwid);
        claims.buildHash = blankToNull(buildHash);
        claims.metadata = metadata == null || metadata.isEmpty() ? null : new TreeMap<>(metadata);
        try {
            // JSON minificado y con claves ordenadas => forma estable
            return CANON.writeValueAsBytes(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo canonicalizar la licencia", e);
        }
    }

    /** Vacío y ausente firman igual: ambos significan "sin atar". */
    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
