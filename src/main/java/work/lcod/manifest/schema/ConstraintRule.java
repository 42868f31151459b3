package work.lcod.manifest.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative constraint. Value rules apply to the field they are attached to; object rules apply to the
 * mapping that owns them. {@link SchemaValidator} switches on {@link #kind()}.
 */
public interface ConstraintRule {
    Kind kind();

    String id();

    enum Kind {
        TYPE,
        PATTERN,
        DURATION,
        ENUM,
        LENGTH,
        RANGE,
        UNIQUE_ITEMS,
        MIN_ENTRIES,
        ITEMS,
        NESTED,
        ENTRIES,
        REQUIRED,
        DEPENDENCY,
        ALTERNATIVES,
        REFERENCE,
        PASSTHROUGH
    }

    /** Value must be one of the listed types; other value rules are skipped when it is not. */
    record TypeRule(Set<ValueType> types) implements ConstraintRule {
        public TypeRule {
            types = Set.copyOf(types);
        }

        @Override
        public Kind kind() {
            return Kind.TYPE;
        }

        @Override
        public String id() {
            return "type";
        }
    }

    /** String values must match; {@code failure} may reference {@code {value}}. */
    record PatternRule(Pattern pattern, String failure) implements ConstraintRule {
        public PatternRule {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public Kind kind() {
            return Kind.PATTERN;
        }

        @Override
        public String id() {
            return "pattern";
        }
    }
    /**
     * String values must match {@code syntax} and fit in a {@link java.time.Duration}; {@code failure} may
     * reference {@code {value}}.
     */
    record DurationRule(Pattern syntax, String failure) implements ConstraintRule {
        public DurationRule {
            Objects.requireNonNull(syntax, "syntax");
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public Kind kind() {
            return Kind.DURATION;
        }

        @Override
        public String id() {
            return "duration";
        }
    }


    record EnumRule(List<String> values) implements ConstraintRule {
        public EnumRule {
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.ENUM;
        }

        @Override
        public String id() {
            return "enum";
        }
    }

    /** String length bounds; {@code max} below zero means unbounded. */
    record LengthRule(int min, int max) implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.LENGTH;
        }

        @Override
        public String id() {
            return "length";
        }
    }

    /** Inclusive bounds for integer values. */
    record RangeRule(long min, long max) implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.RANGE;
        }

        @Override
        public String id() {
            return "range";
        }
    }

    record UniqueItemsRule() implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.UNIQUE_ITEMS;
        }

        @Override
        public String id() {
            return "unique-items";
        }
    }

    /** Arrays or mappings must hold at least {@code min} entries. */
    record MinEntriesRule(int min) implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.MIN_ENTRIES;
        }

        @Override
        public String id() {
            return "min-entries";
        }
    }

    /** Applies {@code rules} to every element of an array. */
    record ItemsRule(List<ConstraintRule> rules) implements ConstraintRule {
        public ItemsRule {
            rules = List.copyOf(rules);
        }

        @Override
        public Kind kind() {
            return Kind.ITEMS;
        }

        @Override
        public String id() {
            return "items";
        }
    }

    /** Validates a mapping value against a nested schema. */
    record NestedRule(ObjectSchema schema) implements ConstraintRule {
        public NestedRule {
            Objects.requireNonNull(schema, "schema");
        }

        @Override
        public Kind kind() {
            return Kind.NESTED;
        }

        @Override
        public String id() {
            return "nested";
        }
    }

    /**
     * Mapping keyed by a single pattern (closed when {@code keyPattern} is set): every key must match and every
     * value is checked against {@code valueRules}.
     */
    record EntriesRule(Pattern keyPattern, String keyFailure, List<ConstraintRule> valueRules) implements ConstraintRule {
        public EntriesRule {
            valueRules = List.copyOf(valueRules);
        }

        @Override
        public Kind kind() {
            return Kind.ENTRIES;
        }

        @Override
        public String id() {
            return "key-pattern";
        }
    }

    /** Object rule: listed fields must be present. */
    record RequiredRule(List<String> fields) implements ConstraintRule {
        public RequiredRule {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.REQUIRED;
        }

        @Override
        public String id() {
            return "required";
        }
    }

    /** Object rule: when {@code trigger} is present every field of {@code requires} must be present too. */
    record DependencyRule(String trigger, List<String> requires) implements ConstraintRule {
        public DependencyRule {
            Objects.requireNonNull(trigger, "trigger");
            requires = List.copyOf(requires);
        }

        @Override
        public Kind kind() {
            return Kind.DEPENDENCY;
        }

        @Override
        public String id() {
            return "dependency";
        }
    }

    /**
     * Object rule over groups of {@link Condition}s: at least one alternative (exactly one when
     * {@code exclusive}) must hold. A breach yields one violation at {@code anchor}.
     */
    record AlternativesRule(
        String id,
        String anchor,
        List<List<Condition>> alternatives,
        boolean exclusive,
        String failure
    ) implements ConstraintRule {
        public AlternativesRule {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(anchor, "anchor");
            alternatives = alternatives.stream().map(List::copyOf).toList();
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public Kind kind() {
            return Kind.ALTERNATIVES;
        }
    }

    /** Object rule: the string in {@code field} must be a key of the mapping in {@code target}. */
    record ReferenceRule(String id, String field, String target, String failure) implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }
    }

    /** Object rule: keys under {@code passthrough} must not repeat keys of the owning mapping. */
    record PassthroughRule() implements ConstraintRule {
        @Override
        public Kind kind() {
            return Kind.PASSTHROUGH;
        }

        @Override
        public String id() {
            return "passthrough-duplicate";
        }
    }

    /**
     * Field test used by {@link AlternativesRule}. {@code IN} compares with {@code values}, falling back to the
     * schema default when the field is absent.
     */
    record Condition(String field, Presence presence, Set<String> values) {
        public Condition {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(presence, "presence");
            values = values == null ? Set.of() : Set.copyOf(values);
        }

        public static Condition present(String field) {
            return new Condition(field, Presence.PRESENT, null);
        }

        public static Condition absent(String field) {
            return new Condition(field, Presence.ABSENT, null);
        }

        public static Condition in(String field, String... values) {
            return new Condition(field, Presence.IN, Set.of(values));
        }

        public boolean holds(Map<String, Object> object, Map<String, Object> defaults) {
            return switch (presence) {
                case PRESENT -> object.containsKey(field);
                case ABSENT -> !object.containsKey(field);
                case IN -> {
                    var value = object.containsKey(field) ? object.get(field) : defaults.get(field);
                    yield value instanceof String str && values.contains(str);
                }
            };
        }
    }

    enum Presence {
        PRESENT,
        ABSENT,
        IN
    }
}
