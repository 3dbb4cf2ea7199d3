package license.gate.core.licensing;

import com.sun.jna.Platform;
import com.sun.jna.platform.win32.Advapi32Util;
import com.sun.jna.platform.win32.WinReg;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;

/** Obtiene señales estables del equipo y calcula un deviceId. */
public class FingerprintService {

    // Fijo por producto: cambiarlo invalida todas las licencias atadas a equipo
    private static final String SALT = "LGC-5D1E7A3F-const-salt";

    public static final class Components {
        public final String machineId;  // MachineGuid (Windows) o /etc/machine-id
        public final String hostName;
        public final String os;         // os.name + os.arch
        public Components(String machineId, String hostName, String os) {
            this.machineId = n(machineId); this.hostName = n(hostName); this.os = n(os);
        }
        private static String n(String s) { return s == null ? "" : s.trim().toUpperCase(Locale.ROOT); }
        public List<String> list() { return List.of(machineId, hostName, os); }
    }

    public static Components collect() {
        return new Components(machineId(), hostName(),
                System.getProperty("os.name", "") + " " + System.getProperty("os.arch", ""));
    }

    /** DeviceId = SHA256( SALT | comp1|comp2|comp3 ) en HEX. */
    public static String computeDeviceId(Components c) {
        String payload = String.join("|", c.list());
        return sha256Hex(SALT + "|" + payload);
    }

    public static String localDeviceId() {
        return computeDeviceId(collect());
    }

    private static String machineId() {
        if (Platform.isWindows()) {
            try {
                return Advapi32Util.registryGetStringValue(
                        WinReg.HKEY_LOCAL_MACHINE, "SOFTWARE\\Microsoft\\Cryptography", "MachineGuid");
            } catch (RuntimeException e) {
                return "";
            }
        }
        for (String candidate : List.of("/etc/machine-id", "/var/lib/dbus/machine-id")) {
            try {
                Path p = Path.of(candidate);
                if (Files.isReadable(p)) return Files.readString(p, StandardCharsets.UTF_8).trim();
            } catch (Exception e) {
                // siguiente candidato
            }
        }
        return "";
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "";
        }
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(d.length * 2);
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible", e);
        }
    }
}
