package license.gate.core.application;

import java.util.Objects;
import java.util.UUID;

/** Referencia opaca a una activación concreta. Una reactivación deja obsoleto el handle anterior. */
public final class SessionHandle {

    private final String identity;
    private final UUID sessionId;

    SessionHandle(String identity, UUID sessionId) {
        this.identity = identity;
        this.sessionId = sessionId;
    }

    public String identity() { return identity; }

    UUID sessionId() { return sessionId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionHandle)) return false;
        SessionHandle other = (SessionHandle) o;
        return identity.equals(other.identity) && sessionId.equals(other.sessionId);
    }

    @Override
    public int hashCode() { return Objects.hash(identity, sessionId); }

    @Override
    public String toString() { return "SessionHandle{" + identity + "}"; }
}
