package license.gate.core.licensing;

import license.gate.core.domain.EntitlementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * Atestación por defecto:
 * - si la licencia trae {@code hwid}, debe coincidir con el deviceId local;
 * - si trae {@code build_hash}, debe coincidir con el hash del artefacto en ejecución
 *   (sin hash local conocido, se rechaza);
 * - opcionalmente rechaza una JVM arrancada con un agente JDWP (depurador).
 */
public class DeviceEnvironmentAttestation implements EnvironmentAttestation {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceEnvironmentAttestation.class);

    private final String localDeviceId;
    private final String localBuildHash;
    private final boolean rejectDebugger;
    private final List<String> jvmArguments;

    public DeviceEnvironmentAttestation(boolean rejectDebugger) {
        this(null, rejectDebugger);
    }

    public DeviceEnvironmentAttestation(String localBuildHash, boolean rejectDebugger) {
        this(FingerprintService.localDeviceId(), localBuildHash, rejectDebugger,
                ManagementFactory.getRuntimeMXBean().getInputArguments());
    }

    public DeviceEnvironmentAttestation(String localDeviceId, boolean rejectDebugger, List<String> jvmArguments) {
        this(localDeviceId, null, rejectDebugger, jvmArguments);
    }

    public DeviceEnvironmentAttestation(String localDeviceId, String localBuildHash,
                                        boolean rejectDebugger, List<String> jvmArguments) {
        this.localDeviceId = localDeviceId;
        this.localBuildHash = localBuildHash;
        this.rejectDebugger = rejectDebugger;
        this.jvmArguments = List.copyOf(jvmArguments);
    }

    @Override
    public boolean permits(EntitlementRecord record) {
        String hwid = record.hwid();
        if (hwid != null && !hwid.isBlank() && !hwid.trim().equalsIgnoreCase(localDeviceId)) {
            LOG.warn("La licencia de {} no corresponde a este equipo", record.identity());
            return false;
        }
        String buildHash = record.buildHash();
        if (buildHash != null && !buildHash.isBlank()
                && (localBuildHash == null || !buildHash.trim().equalsIgnoreCase(localBuildHash.trim()))) {
            LOG.warn("La licencia de {} es para otro build", record.identity());
            return false;
        }
        if (rejectDebugger && debuggerAttached()) {
            LOG.warn("JVM con agente de depuración; se rechaza la licencia de {}", record.identity());
            return false;
        }
        return true;
    }

    boolean debuggerAttached() {
        for (String arg : jvmArguments) {
            if (arg.startsWith("-agentlib:jdwp") || arg.startsWith("-Xrunjdwp")) return true;
        }
        return false;
    }

    public String localDeviceId() { return localDeviceId; }
}
