package dev;

import license.gate.core.application.CoreSettings;
import license.gate.core.application.PayloadSealer;
import license.gate.core.domain.EntitlementRecord;
import license.gate.core.licensing.LicenseCodec;
import license.gate.core.licensing.LicenseIssuer;
import license.gate.core.licensing.SignatureCodec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static license.gate.core.licensing.LicenseModels.RulePayload;

/**
 * Emite una licencia firmada y el payload cifrado para un cliente.
 * Uso: {@code IssueTool <identity> <dirSalida> [feature...]}. Usa los secretos de CoreSettings.fromEnvironment();
 * si hay build hash aprovisionado, la licencia queda atada a ese build.
 */
public class IssueTool {

    static final List<String> DEFAULT_FEATURES =
            List.of("module_extraction", "step_extraction", "flow_extraction", "llm_integration");

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Uso: IssueTool <identity> <dirSalida> [feature...]");
            System.exit(2);
        }
        String identity = args[0];
        Path outDir = Path.of(args[1]);
        List<String> features = args.length > 2 ? Arrays.asList(args).subList(2, args.length) : DEFAULT_FEATURES;

        CoreSettings settings = CoreSettings.fromEnvironment();
        var issuer = new LicenseIssuer(new SignatureCodec(settings.signingSecret()), settings.validityWindow());
        var sealer = new PayloadSealer(settings.unlockSecret());

        Files.createDirectories(outDir);
        Path license = outDir.resolve("license.json");
        Path payload = outDir.resolve(identity.replaceAll("[^A-Za-z0-9._-]", "_") + ".bin");
        EntitlementRecord record = issuer.issue(identity, features, Instant.now(), null, settings.buildHash(), Map.of());
        Files.write(license, LicenseCodec.encodeEntitlement(record));
        Files.write(payload, sealer.seal(identity, defaultRules()));

        System.out.println("OK licencia -> " + license);
        System.out.println("OK payload  -> " + payload);
    }

    /** Reglas de extracción de referencia. */
    static RulePayload defaultRules() {
        RulePayload r = new RulePayload();
        r.modulePatterns = List.of(
                "Chapter \\d+:\\s*([^.!?]+)",
                "Section \\d+\\.\\d+:\\s*([^.!?]+)",
                "Module \\d+:\\s*([^.!?]+)",
                "^([A-Z][^.!?]+(?:Maintenance|Procedure|Process|System))");
        r.stepPatterns = List.of(
                "Conduct scheduled inspections[^.!?]*[.!?]",
                "Identify and resolve[^.!?]*[.!?]",
                "Document and report[^.!?]*[.!?]",
                "Adhere strictly to[^.!?]*[.!?]",
                "Perform \\w+ maintenance[^.!?]*[.!?]",
                "Check \\w+ system[^.!?]*[.!?]",
                "Verify \\w+ operation[^.!?]*[.!?]",
                "Replace \\w+ component[^.!?]*[.!?]");
        r.flowPatterns = List.of(
                "if\\s+([^.!?]+)\\s+then[^.!?]*[.!?]",
                "when\\s+([^.!?]+)\\s+perform[^.!?]*[.!?]",
                "in case of\\s+([^.!?]+)[^.!?]*[.!?]");
        r.taxonomyPatterns = List.of(
                "(\\w+):\\s*([^.!?]+)",
                "(\\w+)\\s+maintenance:\\s*([^.!?]+)",
                "Type\\s+(\\w+):\\s*([^.!?]+)");

        r.llmPrompts = new LinkedHashMap<>();
        r.llmPrompts.put("module_extraction", """
                Extract logical modules from the following technical documentation.
                Look for chapter headings, section titles, and organizational structures.
                Text: {text}
                Return only the module titles and their summaries.""");
        r.llmPrompts.put("step_extraction", """
                Identify procedural steps in the following technical documentation.
                Look for action verbs, numbered procedures, and maintenance tasks.
                Text: {text}
                Return only the procedural steps with their categories.""");
        r.llmPrompts.put("flow_extraction", """
                Extract decision flows and conditional logic from the following technical documentation.
                Look for if-then statements, decision points, and branching logic.
                Text: {text}
                Return only the decision flows with their conditions and outcomes.""");
        r.llmPrompts.put("complexity_analysis", """
                Analyze the complexity of the following technical procedure.
                Consider factors like number of steps, required expertise, time requirements, and safety considerations.
                Text: {text}
                Return a complexity score from 1-10 with justification.""");

        r.confidenceThresholds = new LinkedHashMap<>();
        r.confidenceThresholds.put("module", 0.85);
        r.confidenceThresholds.put("step", 0.90);
        r.confidenceThresholds.put("flow", 0.80);
        r.confidenceThresholds.put("taxonomy", 0.95);
        return r;
    }
}
