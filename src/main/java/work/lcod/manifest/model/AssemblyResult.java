package work.lcod.manifest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import work.lcod.manifest.grammar.ResolutionFailure;
import work.lcod.manifest.schema.Violation;

/**
 * Either the assembled {@link Manifest} or the complete list of problems that prevented it.
 */
public record AssemblyResult(Manifest manifest, List<Violation> violations, List<ResolutionFailure> failures) {
    public AssemblyResult {
        violations = sorted(violations);
        failures = sorted(failures);
        if (manifest != null && (!violations.isEmpty() || !failures.isEmpty())) {
            throw new IllegalArgumentException("A successful assembly carries no problems");
        }
        if (manifest == null && violations.isEmpty() && failures.isEmpty()) {
            throw new IllegalArgumentException("A failed assembly needs at least one problem");
        }
    }

    public static AssemblyResult success(Manifest manifest) {
        return new AssemblyResult(manifest, List.of(), List.of());
    }

    public static AssemblyResult invalid(List<Violation> violations) {
        return new AssemblyResult(null, violations, List.of());
    }

    public static AssemblyResult unresolved(List<ResolutionFailure> failures) {
        return new AssemblyResult(null, List.of(), failures);
    }

    public boolean isSuccess() {
        return manifest != null;
    }

    public Optional<Manifest> manifestIfValid() {
        return Optional.ofNullable(manifest);
    }

    public Manifest orElseThrow() {
        if (manifest == null) {
            throw new ManifestAssemblyException(violations, failures);
        }
        return manifest;
    }

    /**
     * One line per problem, violations first, each list in path order.
     */
    public List<String> problems() {
        var lines = new ArrayList<String>();
        violations.forEach(v -> lines.add(v.describe()));
        failures.forEach(f -> lines.add(f.describe()));
        return lines;
    }

    private static <T extends Comparable<? super T>> List<T> sorted(List<T> values) {
        var copy = new ArrayList<>(values);
        Collections.sort(copy);
        return List.copyOf(copy);
    }
}
