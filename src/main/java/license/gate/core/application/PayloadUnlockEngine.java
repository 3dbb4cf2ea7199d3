package license.gate.core.application;

import license.gate.core.domain.RuleSet;
import license.gate.core.infrastructure.PayloadSource;
import license.gate.core.licensing.EntitlementException;
import license.gate.core.licensing.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static license.gate.core.licensing.LicenseCodec.decodeRules;
import static license.gate.core.licensing.LicenseModels.RulePayload;

/**
 * Deriva la clave a partir de la identidad verificada y descifra el payload embebido (AES-256-GCM).
 * La clave y el texto plano se ponen a cero al terminar cada llamada.
 */
public class PayloadUnlockEngine {
    private static final Logger LOG = LoggerFactory.getLogger(PayloadUnlockEngine.class);

    /** Longitud del nonce GCM en bytes. */
    static final int NONCE_LENGTH = 12;
    /** Tag GCM en bits. */
    static final int TAG_BITS = 128;

    private static final String KDF = "HmacSHA256";
    private static final byte[] KEY_LABEL = "lgc-session-key-v1|".getBytes(StandardCharsets.UTF_8);

    private final byte[] unlockSecret;
    private final PayloadSource payloadSource;

    public PayloadUnlockEngine(byte[] unlockSecret, PayloadSource payloadSource) {
        this.unlockSecret = Arrays.copyOf(unlockSecret, unlockSecret.length);
        this.payloadSource = payloadSource;
    }

    /** Clave AES de 32 bytes: HMAC-SHA256(secreto, etiqueta || identity). El llamador la pone a cero. */
    public byte[] deriveKey(String identity) {
        return deriveKey(unlockSecret, identity);
    }

    static byte[] deriveKey(byte[] secret, String identity) {
        try {
            Mac mac = Mac.getInstance(KDF);
            mac.init(new SecretKeySpec(secret, KDF));
            mac.update(KEY_LABEL);
            return mac.doFinal(identity.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC no disponible", e);
        }
    }

    /** Busca el blob de la identidad, deriva la clave, descifra y descarta la clave. */
    public RuleSet unlock(String identity) throws EntitlementException {
        byte[] blob = payloadSource.blobFor(identity)
                .orElseThrow(() -> new EntitlementException(ErrorKind.DECRYPTION_FAILED,
                        "No hay payload cifrado para esta instalación"));
        byte[] key = deriveKey(identity);
        try {
            return decrypt(blob, key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * {@code blob = nonce(12) || ciphertext+tag}. Cualquier alteración -> DECRYPTION_FAILED;
     * nunca devuelve un RuleSet parcial.
     */
    public RuleSet decrypt(byte[] blob, byte[] key) throws EntitlementException {
        if (blob == null || blob.length < NONCE_LENGTH + TAG_BITS / 8) {
            throw new EntitlementException(ErrorKind.DECRYPTION_FAILED, "Payload cifrado truncado");
        }
        byte[] plaintext = null;
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_BITS, blob, 0, NONCE_LENGTH));
            plaintext = cipher.doFinal(blob, NONCE_LENGTH, blob.length - NONCE_LENGTH);
            return toRuleSet(decodeRules(plaintext));
        } catch (AEADBadTagException e) {
            LOG.debug("Tag GCM inválido");
            throw new EntitlementException(ErrorKind.DECRYPTION_FAILED, "Descifrado fallido", e);
        } catch (GeneralSecurityException e) {
            throw new EntitlementException(ErrorKind.DECRYPTION_FAILED, "Descifrado fallido", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new EntitlementException(ErrorKind.DECRYPTION_FAILED, "Payload descifrado con forma inválida", e);
        } finally {
            if (plaintext != null) Arrays.fill(plaintext, (byte) 0);
        }
    }

    static RuleSet toRuleSet(RulePayload p) throws IOException {
        if (p.modulePatterns == null || p.stepPatterns == null || p.llmPrompts == null
                || p.confidenceThresholds == null) {
            throw new IOException("Faltan campos obligatorios en el payload");
        }
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put(RuleSet.MODULE, p.modulePatterns);
        patterns.put(RuleSet.STEP, p.stepPatterns);
        patterns.put(RuleSet.FLOW, p.flowPatterns == null ? List.of() : p.flowPatterns);
        patterns.put(RuleSet.TAXONOMY, p.taxonomyPatterns == null ? List.of() : p.taxonomyPatterns);
        for (List<String> list : patterns.values()) {
            if (list.contains(null)) throw new IOException("Patrón nulo en el payload");
        }
        return new RuleSet(patterns, p.llmPrompts, p.confidenceThresholds);
    }
}
