package work.lcod.manifest.grammar;

import java.util.List;
import java.util.Optional;

/**
 * Result of resolving one grammar field: either the flat value list or the failure that prevented it.
 */
public record Resolution(List<String> values, ResolutionFailure failure) {
    public Resolution {
        values = values == null ? List.of() : List.copyOf(values);
        if (failure != null && !values.isEmpty()) {
            throw new IllegalArgumentException("A failed resolution carries no values");
        }
    }

    public static Resolution success(List<String> values) {
        return new Resolution(values, null);
    }

    public static Resolution failed(ResolutionFailure failure) {
        return new Resolution(List.of(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<ResolutionFailure> failureIfAny() {
        return Optional.ofNullable(failure);
    }

    /**
     * Single value of a grammar-string field; empty when the grammar resolved to nothing.
     */
    public Optional<String> singleValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
