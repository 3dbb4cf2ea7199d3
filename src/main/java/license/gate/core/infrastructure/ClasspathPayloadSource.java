package license.gate.core.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Payload embebido en el jar. Busca primero {@code <dir>/<identity>.bin} y si no existe
 * usa el recurso por defecto. Cada recurso se lee una sola vez.
 */
public class ClasspathPayloadSource implements PayloadSource {
    private static final Logger LOG = LoggerFactory.getLogger(ClasspathPayloadSource.class);

    private final String defaultResource;
    private final String directory;
    private final Map<String, Optional<byte[]>> cache = new ConcurrentHashMap<>();

    /** @param defaultResource ruta absoluta, p.ej. {@code /payload/encrypted_payload.bin} */
    public ClasspathPayloadSource(String defaultResource) {
        this.defaultResource = defaultResource;
        int slash = defaultResource.lastIndexOf('/');
        this.directory = slash <= 0 ? "" : defaultResource.substring(0, slash);
    }

    @Override
    public Optional<byte[]> blobFor(String identity) {
        Optional<byte[]> blob = cache.computeIfAbsent(directory + "/" + sanitize(identity) + ".bin", this::read);
        if (blob.isEmpty()) blob = cache.computeIfAbsent(defaultResource, this::read);
        return blob.map(byte[]::clone);
    }

    private Optional<byte[]> read(String path) {
        try (InputStream in = ClasspathPayloadSource.class.getResourceAsStream(path)) {
            if (in == null) return Optional.empty();
            return Optional.of(in.readAllBytes());
        } catch (IOException e) {
            LOG.warn("No se pudo leer el payload embebido {}", path, e);
            return Optional.empty();
        }
    }

    /** Solo caracteres seguros para nombre de recurso. */
    static String sanitize(String identity) {
        return identity == null ? "" : identity.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
