package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cadena ordenada de capas; corta en la primera que falla. Todas deben pasar.
 * Si una capa lanza una excepción se cuenta como fallo de esa capa.
 */
public class ValidationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ValidationPipeline.class);

    private final List<ValidationLayer> layers;
    private final SignatureCodec signatureCodec;
    private final Duration validityWindow;

    public ValidationPipeline(Duration validityWindow,
                              SignatureCodec signatureCodec,
                              ClockIntegrityChecker clockChecker,
                              EnvironmentAttestation environment) {
        this.validityWindow = validityWindow;
        this.signatureCodec = signatureCodec;
        this.layers = List.of(
                new ValidationLayers.Structural(),
                new ValidationLayers.AuthoritativeExpiration(validityWindow),
                new ValidationLayers.AnchorSanity(),
                new ValidationLayers.ClockIntegrity(clockChecker),
                new ValidationLayers.Signature(signatureCodec),
                new ValidationLayers.Environment(environment));
    }

    public ValidationReport run(EntitlementRecord record, Instant now) {
        for (ValidationLayer layer : layers) {
            boolean ok;
            try {
                ok = layer.passes(record, now);
            } catch (RuntimeException e) {
                LOG.warn("La capa {} lanzó una excepción; se rechaza", layer.name(), e);
                ok = false;
            }
            if (!ok) return ValidationReport.failed(layer.name(), layer.failureKind());
        }
        return ValidationReport.valid();
    }

    /** Como {@link #run} pero lanza con el tipo concreto de la capa que falló. */
    public void enforce(EntitlementRecord record, Instant now) throws EntitlementException {
        ValidationReport report = run(record, now);
        if (!report.isValid()) {
            throw new EntitlementException(report.failureKind(),
                    "Licencia rechazada en la capa " + report.failedLayer());
        }
    }

    public List<ValidationLayer> layers() { return layers; }

    public SignatureCodec signatureCodec() { return signatureCodec; }

    public Duration validityWindow() { return validityWindow; }
}
