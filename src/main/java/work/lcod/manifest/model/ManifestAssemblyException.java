package work.lcod.manifest.model;

import java.util.List;
import work.lcod.manifest.grammar.ResolutionFailure;
import work.lcod.manifest.schema.Violation;

/**
 * Raised by {@link AssemblyResult#orElseThrow()} with every violation and resolution failure of the document.
 */
public final class ManifestAssemblyException extends RuntimeException {
    private final List<Violation> violations;
    private final List<ResolutionFailure> failures;

    public ManifestAssemblyException(List<Violation> violations, List<ResolutionFailure> failures) {
        super(buildMessage(violations, failures));
        this.violations = List.copyOf(violations);
        this.failures = List.copyOf(failures);
    }

    public List<Violation> violations() {
        return violations;
    }

    public List<ResolutionFailure> failures() {
        return failures;
    }

    private static String buildMessage(List<Violation> violations, List<ResolutionFailure> failures) {
        var message = new StringBuilder("Issues while validating snapcraft.yaml:");
        violations.forEach(v -> message.append(System.lineSeparator()).append("- ").append(v.describe()));
        failures.forEach(f -> message.append(System.lineSeparator()).append("- ").append(f.describe()));
        return message.toString();
    }
}
