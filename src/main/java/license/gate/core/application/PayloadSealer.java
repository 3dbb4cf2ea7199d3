package license.gate.core.application;

import license.gate.core.licensing.LicenseCodec;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import static license.gate.core.licensing.LicenseModels.RulePayload;

/** Lado emisor: cifra el payload de reglas para una identidad. Salida {@code nonce || ciphertext+tag}. */
public class PayloadSealer {

    private final byte[] unlockSecret;
    private final SecureRandom random = new SecureRandom();

    public PayloadSealer(byte[] unlockSecret) {
        this.unlockSecret = Arrays.copyOf(unlockSecret, unlockSecret.length);
    }

    public byte[] seal(String identity, RulePayload payload) {
        byte[] plaintext = LicenseCodec.encodeRules(payload);
        try {
            return seal(identity, plaintext);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    public byte[] seal(String identity, byte[] plaintext) {
        byte[] key = PayloadUnlockEngine.deriveKey(unlockSecret, identity);
        byte[] nonce = new byte[PayloadUnlockEngine.NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(PayloadUnlockEngine.TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext);
            byte[] out = new byte[nonce.length + ciphertext.length];
            System.arraycopy(nonce, 0, out, 0, nonce.length);
            System.arraycopy(ciphertext, 0, out, nonce.length, ciphertext.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM no disponible", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }
}
