package license.gate.core.application;

import java.util.ArrayList;
import java.util.List;

/**
 * "¿Puede X usar Y ahora?". Nunca lanza: sin activación, vencida o sin cupo responden igual (false / vacío).
 */
public class FeatureGate {

    private final SessionStore store;

    public FeatureGate(SessionStore store) {
        this.store = store;
    }

    /** Sesión viva + feature incluida + contador bajo el tope. Cada llamada suma un acceso. */
    public boolean checkAccess(String identity, String feature) {
        if (identity == null || feature == null) return false;
        Session session = store.sessionFor(identity);
        if (session == null) return false;
        Liveness state = store.inspect(session, true);
        return state == Liveness.LIVE && session.record().hasFeature(feature);
    }

    /** Features de la licencia mientras la sesión esté viva; si no, lista vacía. */
    public List<String> listFeatures(String identity) {
        Session session = store.sessionFor(identity);
        if (session == null) return List.of();
        if (store.inspect(session, false) != Liveness.LIVE) return List.of();
        return new ArrayList<>(session.record().features());
    }
}
