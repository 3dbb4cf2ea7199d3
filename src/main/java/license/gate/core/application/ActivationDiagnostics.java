package license.gate.core.application;

import license.gate.core.licensing.ErrorKind;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Canal de diagnóstico del operador: últimos fallos de activación con la capa y el tipo concreto.
 * Nunca se expone al que consulta features.
 */
public class ActivationDiagnostics {

    public static final String UNKNOWN_IDENTITY = "<unknown>";

    public static final class Failure {
        public final Instant at;
        public final String identity;
        public final ErrorKind kind;
        public final String layer;   // null si no vino del pipeline (p.ej. descifrado)
        public Failure(Instant at, String identity, ErrorKind kind, String layer) {
            this.at = at; this.identity = identity; this.kind = kind; this.layer = layer;
        }
        @Override public String toString() { return at + " " + identity + " " + kind + (layer == null ? "" : " @" + layer); }
    }

    private final int capacity;
    private final Deque<Failure> failures = new ArrayDeque<>();

    public ActivationDiagnostics() {
        this(100);
    }

    public ActivationDiagnostics(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity debe ser > 0");
        this.capacity = capacity;
    }

    public synchronized void record(Instant at, String identity, ErrorKind kind, String layer) {
        if (failures.size() == capacity) failures.removeFirst();
        failures.addLast(new Failure(at, identity == null || identity.isBlank() ? UNKNOWN_IDENTITY : identity, kind, layer));
    }

    /** Del más viejo al más nuevo. */
    public synchronized List<Failure> recentFailures() {
        return new ArrayList<>(failures);
    }

    public synchronized Optional<Failure> lastFailure(String identity) {
        Iterator<Failure> it = failures.descendingIterator();
        while (it.hasNext()) {
            Failure f = it.next();
            if (f.identity.equals(identity)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public synchronized void clear() {
        failures.clear();
    }
}
