package license.gate.core.licensing;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import license.gate.core.domain.EntitlementRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

import static license.gate.core.licensing.LicenseModels.EntitlementFile;
import static license.gate.core.licensing.LicenseModels.RulePayload;

/**
 * JSON de licencias y del payload de reglas. Estricto: campos desconocidos, claves duplicadas
 * o basura al final hacen fallar la lectura.
 */
public final class LicenseCodec {

    private static final ObjectMapper OM = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private LicenseCodec() {}

    /** Bytes -> registro. Los campos obligatorios ausentes quedan en null para la capa estructural. */
    public static EntitlementRecord decodeEntitlement(byte[] bytes) throws EntitlementException {
        if (bytes == null || bytes.length == 0) throw malformed("Licencia vacía.", null);

        EntitlementFile file;
        try {
            file = OM.readValue(bytes, EntitlementFile.class);
        } catch (IOException e) {
            throw malformed("Licencia ilegible.", e);
        }
        if (file == null) throw malformed("Licencia vacía.", null);

        EntitlementRecord.Builder b = EntitlementRecord.builder()
                .licenseId(file.licenseId)
                .identity(file.identity)
                .issuedAt(file.issuedAt)
                .expiresAt(file.expiresAt)
                .anchorTimestamp(file.anchorTimestamp)
                .signature(file.signature)
                .hwid(file.hwid)
                .buildHash(file.buildHash)
                .metadata(file.metadata);

        if (file.features != null) {
            Set<String> seen = new HashSet<>();
            for (String f : file.features) {
                if (f == null || f.isBlank()) throw malformed("Feature vacía en la licencia.", null);
                if (!seen.add(f)) throw malformed("Feature repetida en la licencia: " + f, null);
            }
            b.features(file.features);
        }
        return b.build();
    }

    public static byte[] encodeEntitlement(EntitlementRecord record) {
        EntitlementFile file = new EntitlementFile();
        file.licenseId = record.licenseId();
        file.identity = record.identity();
        file.features = record.features() == null ? null : new ArrayList<>(record.features());
        file.issuedAt = record.issuedAt();
        file.expiresAt = record.expiresAt();
        file.anchorTimestamp = record.anchorTimestamp();
        file.metadata = record.metadata().isEmpty() ? null : record.metadata();
        file.hwid = record.hwid();
        file.buildHash = record.buildHash();
        file.signature = record.signature();
        try {
            return OM.writerWithDefaultPrettyPrinter().writeValueAsBytes(file);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar la licencia", e);
        }
    }

    public static RulePayload decodeRules(byte[] plaintext) throws IOException {
        RulePayload payload = OM.readValue(plaintext, RulePayload.class);
        if (payload == null) throw new IOException("Payload de reglas vacío");
        return payload;
    }

    public static byte[] encodeRules(RulePayload payload) {
        try {
            return OM.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el payload", e);
        }
    }

    private static EntitlementException malformed(String message, Throwable cause) {
        return new EntitlementException(ErrorKind.MALFORMED_RECORD, message, cause);
    }
}
