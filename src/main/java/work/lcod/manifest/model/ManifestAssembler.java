package work.lcod.manifest.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.grammar.GrammarResolver;
import work.lcod.manifest.grammar.Resolution;
import work.lcod.manifest.grammar.ResolutionFailure;
import work.lcod.manifest.schema.FieldPath;
import work.lcod.manifest.schema.SchemaValidator;
import work.lcod.manifest.schema.SnapcraftSchema;
import work.lcod.manifest.selector.SelectorContext;
import work.lcod.manifest.shared.DurationParser;

/**
 * Validates a decoded manifest and resolves the grammar of every part for one selector context.
 *
 * <p>Grammar is only resolved for structurally valid documents. Violations and resolution failures are
 * collected in full rather than stopping at the first one.
 */
public final class ManifestAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(ManifestAssembler.class);
    private static final Executor DIRECT = Runnable::run;
    private static final List<String> TIMEOUT_FIELDS = List.of(
        "restart-delay",
        "start-timeout",
        "stop-timeout",
        "watchdog-timeout"
    );
    private static final String COMMAND_CHAIN = "command-chain";

    private final SchemaValidator validator;
    private final Executor executor;

    public ManifestAssembler() {
        this(DIRECT);
    }

    public ManifestAssembler(Executor executor) {
        this.executor = executor == null ? DIRECT : executor;
        this.validator = new SchemaValidator(this.executor);
    }

    /**
     * @throws work.lcod.manifest.schema.DocumentShapeException when the document is not a mapping
     */
    public AssemblyResult assemble(Object document, SelectorContext context) {
        Objects.requireNonNull(context, "context");
        var validation = validator.validate(document);
        if (!validation.isValid()) {
            LOG.debug("Skipping grammar resolution: {} violation(s)", validation.violations().size());
            return AssemblyResult.invalid(validation.violations());
        }
        var root = SchemaValidator.requireMapping(document);

        var tasks = new ArrayList<CompletableFuture<ResolvedPart>>();
        Values.object(root.get("parts")).forEach((name, raw) ->
            tasks.add(CompletableFuture.supplyAsync(() -> resolvePart(name, Values.object(raw), context), executor)));
        var parts = new LinkedHashMap<String, Part>();
        var failures = new ArrayList<ResolutionFailure>();
        for (var task : tasks) {
            var resolved = task.join();
            failures.addAll(resolved.failures());
            if (resolved.part() != null) {
                parts.put(resolved.part().name(), resolved.part());
            }
        }
        if (!failures.isEmpty()) {
            LOG.debug("Grammar resolution failed for {}: {} failure(s)", context.describe(), failures.size());
            return AssemblyResult.unresolved(failures);
        }
        return AssemblyResult.success(buildManifest(root, parts));
    }

    private Manifest buildManifest(Map<String, Object> root, Map<String, Part> parts) {
        var apps = new LinkedHashMap<String, App>();
        Values.object(root.get("apps")).forEach((name, raw) -> apps.put(name, buildApp(name, Values.object(raw))));
        var hooks = new LinkedHashMap<String, Hook>();
        Values.object(root.get("hooks")).forEach((name, raw) -> {
            var hook = Values.object(raw);
            hooks.put(name, new Hook(name, Values.strings(hook.get("plugs")), Values.object(hook.get("passthrough"))));
        });

        var assumes = new ArrayList<>(Values.strings(root.get("assumes")));
        if (apps.values().stream().anyMatch(app -> !app.commandChain().isEmpty()) && !assumes.contains(COMMAND_CHAIN)) {
            assumes.add(COMMAND_CHAIN);
        }

        var defaults = SnapcraftSchema.ROOT.defaults();
        var properties = new LinkedHashMap<>(root);
        properties.remove("apps");
        properties.remove("hooks");
        properties.remove("parts");

        return new Manifest(
            (String) root.get("name"),
            Values.string(root, "version"),
            Values.string(root, "version-script"),
            Values.string(root, "title"),
            Values.string(root, "summary"),
            Values.string(root, "description"),
            Values.string(root, "icon"),
            Values.string(root, "type", (String) defaults.get("type")),
            Values.string(root, "base"),
            Values.string(root, "build-base"),
            withDefault(root, "confinement", (String) defaults.get("confinement")),
            withDefault(root, "grade", (String) defaults.get("grade")),
            Values.string(root, "license"),
            Values.string(root, "adopt-info"),
            assumes,
            root.get("architectures") instanceof List<?> list ? new ArrayList<Object>(list) : List.of(),
            Values.stringValues(root.get("environment")),
            Values.object(root.get("plugs")),
            Values.object(root.get("slots")),
            Values.object(root.get("layout")),
            Values.object(root.get("passthrough")),
            apps,
            hooks,
            parts,
            properties
        );
    }

    private static String withDefault(Map<String, Object> root, String key, String fallback) {
        var declared = Values.string(root, key);
        if (declared.isPresent()) {
            return declared.get();
        }
        LOG.warn("'{}' property not specified: defaulting to '{}'", key, fallback);
        return fallback;
    }

    private static App buildApp(String name, Map<String, Object> raw) {
        var commandChain = Values.strings(raw.get(COMMAND_CHAIN));
        String adapter = Values.string(raw, "adapter")
            .orElse(raw.containsKey(COMMAND_CHAIN) ? "full" : (String) SnapcraftSchema.APP.defaults().get("adapter"));

        var timeouts = new LinkedHashMap<String, Duration>();
        for (var field : TIMEOUT_FIELDS) {
            Values.string(raw, field).flatMap(DurationParser::parse).ifPresent(duration -> timeouts.put(field, duration));
        }

        var sockets = new LinkedHashMap<String, Socket>();
        Values.object(raw.get("sockets")).forEach((socketName, socketRaw) -> {
            var socket = Values.object(socketRaw);
            var mode = socket.get("socket-mode") instanceof Number number ? Optional.of(number.intValue()) : Optional.<Integer>empty();
            sockets.put(socketName, new Socket(socketName, String.valueOf(socket.get("listen-stream")), mode));
        });

        return new App(
            name,
            (String) raw.get("command"),
            Values.string(raw, "daemon"),
            adapter,
            commandChain,
            Values.strings(raw.get("plugs")),
            Values.strings(raw.get("slots")),
            Values.strings(raw.get("before")),
            Values.strings(raw.get("after")),
            timeouts,
            sockets,
            Values.stringValues(raw.get("environment")),
            Values.object(raw.get("passthrough")),
            raw
        );
    }

    private static ResolvedPart resolvePart(String name, Map<String, Object> raw, SelectorContext context) {
        var path = FieldPath.child("parts", name);
        var failures = new ArrayList<ResolutionFailure>();
        var strings = new LinkedHashMap<String, Optional<String>>();
        for (var field : SnapcraftSchema.GRAMMAR_STRING_FIELDS) {
            var resolution = GrammarResolver.resolveString(raw.get(field), context, FieldPath.child(path, field));
            resolution.failureIfAny().ifPresent(failures::add);
            strings.put(field, resolution.singleValue());
        }
        var lists = new LinkedHashMap<String, List<String>>();
        for (var field : SnapcraftSchema.GRAMMAR_ARRAY_FIELDS) {
            Resolution resolution = GrammarResolver.resolveList(raw.get(field), context, FieldPath.child(path, field));
            resolution.failureIfAny().ifPresent(failures::add);
            lists.put(field, resolution.values());
        }
        if (!failures.isEmpty()) {
            return new ResolvedPart(null, failures);
        }

        var defaults = SnapcraftSchema.PART.defaults();
        var properties = new LinkedHashMap<>(raw);
        SnapcraftSchema.GRAMMAR_STRING_FIELDS.forEach(properties::remove);
        SnapcraftSchema.GRAMMAR_ARRAY_FIELDS.forEach(properties::remove);
        var part = new Part(
            name,
            (String) raw.get("plugin"),
            strings.get("source"),
            Values.string(raw, "source-type"),
            strings.get("source-branch"),
            strings.get("source-tag"),
            strings.get("source-commit"),
            strings.get("source-subdir"),
            strings.get("source-checksum"),
            raw.get("source-depth") instanceof Number depth ? Optional.of(depth.intValue()) : Optional.empty(),
            lists.get("stage-packages"),
            lists.get("build-packages"),
            lists.get("stage-snaps"),
            lists.get("build-snaps"),
            Values.strings(raw.get("after")),
            Values.strings(raw.get("build-attributes")),
            Boolean.TRUE.equals(raw.get("disable-parallel")),
            Values.string(raw, "override-pull", (String) defaults.get("override-pull")),
            Values.string(raw, "override-build", (String) defaults.get("override-build")),
            Values.string(raw, "override-stage", (String) defaults.get("override-stage")),
            Values.string(raw, "override-prime", (String) defaults.get("override-prime")),
            properties
        );
        return new ResolvedPart(part, List.of());
    }

    private record ResolvedPart(Part part, List<ResolutionFailure> failures) {}
}
