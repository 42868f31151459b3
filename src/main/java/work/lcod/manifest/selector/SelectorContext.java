package work.lcod.manifest.selector;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation environment for {@code on}/{@code to} grammar selectors.
 *
 * <p>Plain selector tokens are compared with the build or target architecture. Tokens written as
 * {@code key=value} are compared with the environment map instead.
 */
public record SelectorContext(String buildArch, String targetArch, Map<String, String> environment) {
    public SelectorContext {
        Objects.requireNonNull(buildArch, "buildArch");
        Objects.requireNonNull(targetArch, "targetArch");
        environment = environment == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    public static SelectorContext of(String buildArch, String targetArch) {
        return new SelectorContext(buildArch, targetArch, Map.of());
    }

    /**
     * Context for a native build on the current JVM host.
     */
    public static SelectorContext forHost() {
        var arch = Architectures.host();
        return new SelectorContext(arch, arch, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matchesBuild(Collection<String> selectors) {
        return matches(selectors, buildArch);
    }

    public boolean matchesTarget(Collection<String> selectors) {
        return matches(selectors, targetArch);
    }

    private boolean matches(Collection<String> selectors, String arch) {
        for (var selector : selectors) {
            int eq = selector.indexOf('=');
            if (eq > 0) {
                var value = environment.get(selector.substring(0, eq));
                if (value != null && value.equals(selector.substring(eq + 1))) {
                    return true;
                }
            } else if (selector.equals(arch)) {
                return true;
            }
        }
        return false;
    }

    public String describe() {
        if (environment.isEmpty()) {
            return "build-on " + buildArch + ", run-on " + targetArch;
        }
        return "build-on " + buildArch + ", run-on " + targetArch + ", environment " + environment;
    }

    public static final class Builder {
        private String buildArch;
        private String targetArch;
        private final Map<String, String> environment = new LinkedHashMap<>();

        public Builder buildArch(String buildArch) {
            this.buildArch = buildArch;
            return this;
        }

        public Builder targetArch(String targetArch) {
            this.targetArch = targetArch;
            return this;
        }

        public Builder putEnvironment(String key, String value) {
            environment.put(key, value);
            return this;
        }

        public Builder environment(Map<String, String> values) {
            if (values != null) {
                environment.putAll(values);
            }
            return this;
        }

        /**
         * Missing build architecture falls back to the host; missing target falls back to the build architecture.
         */
        public SelectorContext build() {
            var build = buildArch == null || buildArch.isBlank()
                ? Architectures.host()
                : Architectures.normalize(buildArch);
            var target = targetArch == null || targetArch.isBlank()
                ? build
                : Architectures.normalize(targetArch);
            return new SelectorContext(build, target, environment);
        }
    }
}
