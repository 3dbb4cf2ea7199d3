package license.gate.core.licensing;

/** Resultado de una corrida del pipeline. La capa que falló es solo para el operador. */
public final class ValidationReport {

    private static final ValidationReport VALID = new ValidationReport(null, null);

    private final String failedLayer;
    private final ErrorKind failureKind;

    private ValidationReport(String failedLayer, ErrorKind failureKind) {
        this.failedLayer = failedLayer;
        this.failureKind = failureKind;
    }

    public static ValidationReport valid() { return VALID; }

    public static ValidationReport failed(String layer, ErrorKind kind) {
        return new ValidationReport(layer, kind);
    }

    public boolean isValid() { return failureKind == null; }

    /** null si es válido. */
    public String failedLayer() { return failedLayer; }

    /** null si es válido. */
    public ErrorKind failureKind() { return failureKind; }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid(" + failedLayer + ", " + failureKind + ")";
    }
}
