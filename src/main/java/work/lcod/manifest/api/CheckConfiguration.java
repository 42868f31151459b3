package work.lcod.manifest.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.manifest.selector.SelectorContext;

/**
 * Immutable configuration of one {@link ManifestChecker} run.
 *
 * <p>{@code parallelism} of 1 checks on the calling thread; larger values spread the apps, hooks and parts of each
 * manifest over a fixed pool of that size.
 */
public record CheckConfiguration(
    List<Path> manifests,
    SelectorContext selectorContext,
    int parallelism,
    LogLevel logLevel
) {
    public CheckConfiguration {
        Objects.requireNonNull(manifests, "manifests");
        Objects.requireNonNull(selectorContext, "selectorContext");
        Objects.requireNonNull(logLevel, "logLevel");
        manifests = List.copyOf(manifests);
        if (manifests.isEmpty()) {
            throw new IllegalArgumentException("At least one manifest is required.");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Path> manifests = new ArrayList<>();
        private Optional<SelectorContext> selectorContext = Optional.empty();
        private int parallelism = 1;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder manifest(Path manifest) {
            this.manifests.add(manifest);
            return this;
        }

        public Builder manifests(List<Path> manifests) {
            this.manifests.addAll(manifests);
            return this;
        }

        public Builder selectorContext(SelectorContext selectorContext) {
            this.selectorContext = Optional.ofNullable(selectorContext);
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CheckConfiguration build() {
            return new CheckConfiguration(
                manifests,
                selectorContext.orElseGet(SelectorContext::forHost),
                parallelism,
                logLevel
            );
        }
    }
}
