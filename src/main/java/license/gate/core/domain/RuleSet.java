package license.gate.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración descifrada: patrones por categoría, prompts y umbrales de confianza.
 * Vive solo mientras viva la sesión que la posee; {@link #discard()} suelta todo el contenido.
 */
public final class RuleSet {

    // Categorías que trae el payload
    public static final String MODULE = "module";
    public static final String STEP = "step";
    public static final String FLOW = "flow";
    public static final String TAXONOMY = "taxonomy";

    private volatile Map<String, List<String>> patterns;
    private volatile Map<String, String> prompts;
    private volatile Map<String, Double> confidenceThresholds;
    private volatile boolean discarded;

    public RuleSet(Map<String, List<String>> patterns,
                   Map<String, String> prompts,
                   Map<String, Double> confidenceThresholds) {
        Map<String, List<String>> p = new LinkedHashMap<>();
        patterns.forEach((category, list) ->
                p.put(category, Collections.unmodifiableList(new ArrayList<>(list))));

        Map<String, Double> t = new LinkedHashMap<>();
        confidenceThresholds.forEach((category, score) -> {
            if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("Umbral fuera de [0,1] para '" + category + "': " + score);
            }
            t.put(category, score);
        });

        this.patterns = Collections.unmodifiableMap(p);
        this.prompts = Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
        this.confidenceThresholds = Collections.unmodifiableMap(t);
    }

    /** Patrones en el orden del payload (el orden desempata); lista vacía si la categoría no existe. */
    public List<String> patterns(String category) {
        return patterns.getOrDefault(category, List.of());
    }

    public Map<String, List<String>> allPatterns() { return patterns; }

    public Map<String, String> prompts() { return prompts; }

    public Map<String, Double> confidenceThresholds() { return confidenceThresholds; }

    public boolean isDiscarded() { return discarded; }

    /** Suelta las referencias al contenido descifrado. Idempotente. */
    public void discard() {
        discarded = true;
        patterns = Map.of();
        prompts = Map.of();
        confidenceThresholds = Map.of();
    }
}
