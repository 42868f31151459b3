package work.lcod.manifest.schema;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single breach of a structural or cross-field rule.
 */
public record Violation(String path, String ruleId, String message) implements Comparable<Violation> {
    private static final Comparator<Violation> ORDER = Comparator
        .comparing(Violation::path)
        .thenComparing(Violation::ruleId)
        .thenComparing(Violation::message);

    public Violation {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(message, "message");
    }

    public String describe() {
        return FieldPath.display(path) + ": " + message;
    }

    @Override
    public int compareTo(Violation other) {
        return ORDER.compare(this, other);
    }
}
