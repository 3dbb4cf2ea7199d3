package license.gate.core.domain;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Vista de solo lectura que se entrega al módulo de extracción.
 * Deja de funcionar (IllegalStateException) en cuanto la sesión dueña se cierra.
 */
public final class RuleSetView {

    private final RuleSet ruleSet;
    private final String identity;
    private final String watermark;

    public RuleSetView(RuleSet ruleSet, String identity, String watermark) {
        this.ruleSet = ruleSet;
        this.identity = identity;
        this.watermark = watermark;
    }

    public String identity() { return identity; }

    /** Marca por cliente para estampar en los resultados de extracción. */
    public String watermark() {
        ensureOpen();
        return watermark;
    }

    public boolean isOpen() { return !ruleSet.isDiscarded(); }

    public List<String> patterns(String category) {
        ensureOpen();
        return ruleSet.patterns(category);
    }

    public Set<String> categories() {
        ensureOpen();
        return ruleSet.allPatterns().keySet();
    }

    /** Plantilla del prompt; tipo desconocido -> IllegalArgumentException. */
    public String prompt(String promptType) {
        ensureOpen();
        String text = ruleSet.prompts().get(promptType);
        if (text == null) throw new IllegalArgumentException("Tipo de prompt desconocido: " + promptType);
        return text;
    }

    public Set<String> promptTypes() {
        ensureOpen();
        return ruleSet.prompts().keySet();
    }

    public OptionalDouble confidenceThreshold(String category) {
        ensureOpen();
        Double score = ruleSet.confidenceThresholds().get(category);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public Map<String, Double> confidenceThresholds() {
        ensureOpen();
        return ruleSet.confidenceThresholds();
    }

    private void ensureOpen() {
        if (ruleSet.isDiscarded()) throw new IllegalStateException("La sesión de " + identity + " ya no está activa");
    }
}
