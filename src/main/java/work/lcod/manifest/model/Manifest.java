package work.lcod.manifest.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, grammar-resolved manifest handed to the build orchestrator. Defaults are already applied.
 * {@code properties} holds the top-level declaration without {@code apps}, {@code hooks} and {@code parts}.
 */
public record Manifest(
    String name,
    Optional<String> version,
    Optional<String> versionScript,
    Optional<String> title,
    Optional<String> summary,
    Optional<String> description,
    Optional<String> icon,
    String type,
    Optional<String> base,
    Optional<String> buildBase,
    String confinement,
    String grade,
    Optional<String> license,
    Optional<String> adoptInfo,
    List<String> assumes,
    List<Object> architectures,
    Map<String, String> environment,
    Map<String, Object> plugs,
    Map<String, Object> slots,
    Map<String, Object> layout,
    Map<String, Object> passthrough,
    Map<String, App> apps,
    Map<String, Hook> hooks,
    Map<String, Part> parts,
    Map<String, Object> properties
) {
    public Manifest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(confinement, "confinement");
        Objects.requireNonNull(grade, "grade");
        assumes = List.copyOf(assumes);
        architectures = Values.freeze(architectures);
        environment = Values.freeze(environment);
        plugs = Values.freeze(plugs);
        slots = Values.freeze(slots);
        layout = Values.freeze(layout);
        passthrough = Values.freeze(passthrough);
        apps = Values.freeze(apps);
        hooks = Values.freeze(hooks);
        parts = Values.freeze(parts);
        properties = Values.freeze(properties);
    }

    public Optional<App> app(String appName) {
        return Optional.ofNullable(apps.get(appName));
    }

    public Optional<Part> part(String partName) {
        return Optional.ofNullable(parts.get(partName));
    }

    public boolean isPassthroughEnabled() {
        return !passthrough.isEmpty()
            || apps.values().stream().anyMatch(app -> !app.passthrough().isEmpty())
            || hooks.values().stream().anyMatch(hook -> !hook.passthrough().isEmpty());
    }
}
