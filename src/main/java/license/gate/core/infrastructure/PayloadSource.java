package license.gate.core.infrastructure;

import java.util.Optional;

/** Entrega el blob cifrado {@code nonce(12) || ciphertext} destinado a una identidad. */
public interface PayloadSource {
    Optional<byte[]> blobFor(String identity);
}
