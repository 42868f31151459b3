package work.lcod.manifest.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.shared.DurationParser;

/**
 * Checks a decoded manifest tree against an {@link ObjectSchema} and collects every violation.
 *
 * <p>Entries of the root-level keyed mappings ({@code apps}, {@code hooks}, {@code parts}) are independent and are
 * checked as separate tasks on the configured executor. The result is sorted, so it does not depend on scheduling.
 */
public final class SchemaValidator {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaValidator.class);
    private static final Executor DIRECT = Runnable::run;

    private final ObjectSchema schema;
    private final Executor executor;

    public SchemaValidator() {
        this(SnapcraftSchema.ROOT, DIRECT);
    }

    public SchemaValidator(Executor executor) {
        this(SnapcraftSchema.ROOT, executor);
    }

    public SchemaValidator(ObjectSchema schema, Executor executor) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.executor = executor == null ? DIRECT : executor;
    }

    /**
     * @throws DocumentShapeException when {@code document} is not a string-keyed mapping
     */
    public ValidationResult validate(Object document) {
        var root = requireMapping(document);
        var violations = new ArrayList<Violation>();
        checkObject(root, schema, FieldPath.ROOT, violations, true);
        var result = ValidationResult.of(violations);
        LOG.debug("Validated manifest {}: {} violation(s)", root.get("name"), result.violations().size());
        return result;
    }

    public static Map<String, Object> requireMapping(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            var found = document == null
                ? "nothing"
                : ValueType.find(document).map(ValueType::label).orElse(document.getClass().getSimpleName());
            throw new DocumentShapeException("A manifest must be a mapping at the top level, found " + found);
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new DocumentShapeException("Top-level keys must be strings, found " + entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    private void checkObject(Map<String, Object> object, ObjectSchema schema, String path, List<Violation> sink, boolean fanOut) {
        for (var rule : schema.objectRules()) {
            if (rule.kind() == ConstraintRule.Kind.REQUIRED) {
                checkRequired(object, (ConstraintRule.RequiredRule) rule, path, sink);
            }
        }
        for (var entry : object.entrySet()) {
            var key = entry.getKey();
            var childPath = FieldPath.child(path, key);
            if (schema.declares(key)) {
                checkValue(entry.getValue(), schema.rulesFor(key), childPath, sink, fanOut);
            } else if (schema.closed()) {
                sink.add(new Violation(
                    childPath,
                    "additional-property",
                    "additional properties are not allowed (" + MessageTemplate.quote(key) + " was unexpected)"
                ));
            }
        }
        for (var rule : schema.objectRules()) {
            switch (rule.kind()) {
                case DEPENDENCY -> checkDependency(object, (ConstraintRule.DependencyRule) rule, path, sink);
                case ALTERNATIVES -> checkAlternatives(object, schema, (ConstraintRule.AlternativesRule) rule, path, sink);
                case REFERENCE -> checkReference(object, (ConstraintRule.ReferenceRule) rule, path, sink);
                case PASSTHROUGH -> checkPassthrough(object, rule, path, sink);
                default -> {
                    // required rules ran first, value rules never sit at object level
                }
            }
        }
    }

    private void checkValue(Object value, List<ConstraintRule> rules, String path, List<Violation> sink, boolean fanOut) {
        for (var rule : rules) {
            switch (rule.kind()) {
                case TYPE -> {
                    var types = ((ConstraintRule.TypeRule) rule).types();
                    if (types.stream().noneMatch(type -> type.accepts(value))) {
                        sink.add(new Violation(path, rule.id(), MessageTemplate.quote(value) + " is not of type "
                            + types.stream().map(ValueType::label).sorted().map(MessageTemplate::quote)
                                .collect(Collectors.joining(" or "))));
                        return;
                    }
                }
                case PATTERN -> {
                    var patternRule = (ConstraintRule.PatternRule) rule;
                    if (value instanceof String str && !patternRule.pattern().matcher(str).matches()) {
                        sink.add(new Violation(path, rule.id(), MessageTemplate.render(patternRule.failure(), Map.of("value", str))));
                    }
                }
                case DURATION -> checkDuration(value, (ConstraintRule.DurationRule) rule, path, sink);
                case ENUM -> {
                    var allowed = ((ConstraintRule.EnumRule) rule).values();
                    if (value instanceof String str && !allowed.contains(str)) {
                        sink.add(new Violation(path, rule.id(), MessageTemplate.quote(str) + " is not one of " + MessageTemplate.quote(allowed)));
                    }
                }
                case LENGTH -> checkLength(value, (ConstraintRule.LengthRule) rule, path, sink);
                case RANGE -> {
                    var range = (ConstraintRule.RangeRule) rule;
                    if (ValueType.find(value).orElse(null) == ValueType.INTEGER) {
                        long number = ((Number) value).longValue();
                        if (number < range.min() || number > range.max()) {
                            sink.add(new Violation(path, rule.id(),
                                value + " is not between " + range.min() + " and " + range.max()));
                        }
                    }
                }
                case UNIQUE_ITEMS -> {
                    if (value instanceof List<?> list && new HashSet<>(list).size() != list.size()) {
                        sink.add(new Violation(path, rule.id(), MessageTemplate.quote(list) + " has non-unique elements"));
                    }
                }
                case MIN_ENTRIES -> {
                    int min = ((ConstraintRule.MinEntriesRule) rule).min();
                    int size = value instanceof List<?> list ? list.size() : value instanceof Map<?, ?> map ? map.size() : min;
                    if (size < min) {
                        sink.add(new Violation(path, rule.id(),
                            MessageTemplate.quote(lastSegment(path)) + " must contain at least " + min + " entr" + (min == 1 ? "y" : "ies")));
                    }
                }
                case ITEMS -> {
                    if (value instanceof List<?> list) {
                        var itemRules = ((ConstraintRule.ItemsRule) rule).rules();
                        for (int i = 0; i < list.size(); i++) {
                            checkValue(list.get(i), itemRules, FieldPath.index(path, i), sink, false);
                        }
                    }
                }
                case NESTED -> {
                    if (value instanceof Map<?, ?> map) {
                        checkObject(stringKeys(map), ((ConstraintRule.NestedRule) rule).schema(), path, sink, false);
                    }
                }
                case ENTRIES -> {
                    if (value instanceof Map<?, ?> map) {
                        checkEntries(stringKeys(map), (ConstraintRule.EntriesRule) rule, path, sink, fanOut);
                    }
                }
                default -> {
                    // object-level rules are evaluated by checkObject
                }
            }
        }
    }

    private void checkEntries(Map<String, Object> map, ConstraintRule.EntriesRule rule, String path, List<Violation> sink, boolean fanOut) {
        var tasks = new ArrayList<CompletableFuture<List<Violation>>>();
        for (var entry : map.entrySet()) {
            var key = entry.getKey();
            var childPath = FieldPath.child(path, key);
            if (rule.keyPattern() != null && !rule.keyPattern().matcher(key).matches()) {
                sink.add(new Violation(childPath, rule.id(), MessageTemplate.render(rule.keyFailure(), Map.of("key", key))));
                continue;
            }
            if (fanOut) {
                tasks.add(CompletableFuture.supplyAsync(() -> {
                    var local = new ArrayList<Violation>();
                    checkValue(entry.getValue(), rule.valueRules(), childPath, local, false);
                    return local;
                }, executor));
            } else {
                checkValue(entry.getValue(), rule.valueRules(), childPath, sink, false);
            }
        }
        for (var task : tasks) {
            try {
                sink.addAll(task.join());
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw ex;
            }
        }
    }

    private static void checkDuration(Object value, ConstraintRule.DurationRule rule, String path, List<Violation> sink) {
        if (!(value instanceof String str)) {
            return;
        }
        if (!rule.syntax().matcher(str).matches()) {
            sink.add(new Violation(path, rule.id(), MessageTemplate.render(rule.failure(), Map.of("value", str))));
            return;
        }
        try {
            DurationParser.parse(str);
        } catch (IllegalArgumentException ex) {
            sink.add(new Violation(path, rule.id(), MessageTemplate.quote(str) + " is too large for a duration"));
        }
    }

    private static void checkLength(Object value, ConstraintRule.LengthRule rule, String path, List<Violation> sink) {
        if (!(value instanceof String str)) {
            return;
        }
        int length = str.codePointCount(0, str.length());
        if (length < rule.min()) {
            var message = rule.min() == 1
                ? MessageTemplate.quote(str) + " is too short (it must not be empty)"
                : MessageTemplate.quote(str) + " is too short (minimum length is " + rule.min() + ")";
            sink.add(new Violation(path, rule.id(), message));
        } else if (rule.max() >= 0 && length > rule.max()) {
            sink.add(new Violation(path, rule.id(), MessageTemplate.quote(str) + " is too long (maximum length is " + rule.max() + ")"));
        }
    }

    private static void checkRequired(Map<String, Object> object, ConstraintRule.RequiredRule rule, String path, List<Violation> sink) {
        for (var field : rule.fields()) {
            if (!object.containsKey(field)) {
                sink.add(new Violation(FieldPath.child(path, field), rule.id(), MessageTemplate.quote(field) + " is a required property"));
            }
        }
    }

    private static void checkDependency(Map<String, Object> object, ConstraintRule.DependencyRule rule, String path, List<Violation> sink) {
        if (!object.containsKey(rule.trigger())) {
            return;
        }
        for (var required : rule.requires()) {
            if (!object.containsKey(required)) {
                sink.add(new Violation(
                    FieldPath.child(path, rule.trigger()),
                    rule.id(),
                    MessageTemplate.quote(required) + " is a dependency of " + MessageTemplate.quote(rule.trigger())
                ));
            }
        }
    }

    private static void checkAlternatives(
        Map<String, Object> object,
        ObjectSchema schema,
        ConstraintRule.AlternativesRule rule,
        String path,
        List<Violation> sink
    ) {
        long satisfied = rule.alternatives().stream()
            .filter(group -> group.stream().allMatch(condition -> condition.holds(object, schema.defaults())))
            .count();
        boolean ok = rule.exclusive() ? satisfied == 1 : satisfied >= 1;
        if (ok) {
            return;
        }
        var variables = new LinkedHashMap<String, Object>(schema.defaults());
        variables.putAll(object);
        var anchor = rule.anchor().isEmpty() ? path : FieldPath.child(path, rule.anchor());
        sink.add(new Violation(anchor, rule.id(), MessageTemplate.render(rule.failure(), variables)));
    }

    private static void checkReference(Map<String, Object> object, ConstraintRule.ReferenceRule rule, String path, List<Violation> sink) {
        if (object.get(rule.field()) instanceof String reference
            && object.get(rule.target()) instanceof Map<?, ?> target
            && !target.containsKey(reference)) {
            sink.add(new Violation(
                FieldPath.child(path, rule.field()),
                rule.id(),
                MessageTemplate.render(rule.failure(), Map.of("value", reference))
            ));
        }
    }

    private static void checkPassthrough(Map<String, Object> object, ConstraintRule rule, String path, List<Violation> sink) {
        if (!(object.get("passthrough") instanceof Map<?, ?> passthrough)) {
            return;
        }
        var duplicates = new TreeSet<String>();
        for (var key : passthrough.keySet()) {
            var name = String.valueOf(key);
            if (!"passthrough".equals(name) && object.containsKey(name)) {
                duplicates.add(name);
            }
        }
        if (!duplicates.isEmpty()) {
            sink.add(new Violation(
                FieldPath.child(path, "passthrough"),
                rule.id(),
                "the following keys are specified both in 'passthrough' and directly: "
                    + duplicates.stream().map(MessageTemplate::quote).collect(Collectors.joining(", "))
            ));
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    private static String lastSegment(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
