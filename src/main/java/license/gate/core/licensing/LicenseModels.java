package license.gate.core.licensing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Formas JSON en disco/en el binario. Campos en snake_case. */
public class LicenseModels {

    /** Archivo de licencia tal como lo emite el proveedor. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class EntitlementFile {
        public String licenseId;            // UUID, solo trazabilidad
        public String identity;             // "cust-1"
        public List<String> features;       // ["module_extraction", ...]
        public Instant issuedAt;
        public Instant expiresAt;           // informativo
        public Instant anchorTimestamp;     // base de la expiración real
        public Map<String, String> metadata;
        public String hwid;                 // opcional: deviceId al que queda atada
        public String buildHash;            // opcional: "sha256:..." del artefacto distribuido
        public String signature;            // HMAC-SHA256 Base64
    }

    /** Contenido del payload cifrado, una vez descifrado. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RulePayload {
        public List<String> modulePatterns;
        public List<String> stepPatterns;
        public List<String> flowPatterns;
        public List<String> taxonomyPatterns;
        public Map<String, String> llmPrompts;
        public Map<String, Double> confidenceThresholds;
    }
}
