package work.lcod.manifest.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link SchemaValidator#validate(Object)}; valid means no violations.
 */
public record ValidationResult(List<Violation> violations) {
    public ValidationResult {
        var sorted = new ArrayList<>(violations);
        Collections.sort(sorted);
        violations = List.copyOf(sorted);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult of(Collection<Violation> violations) {
        return new ValidationResult(List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<Violation> forPath(String path) {
        return violations.stream().filter(v -> v.path().equals(path)).toList();
    }

    public List<Violation> forRule(String ruleId) {
        return violations.stream().filter(v -> v.ruleId().equals(ruleId)).toList();
    }
}
