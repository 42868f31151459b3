package work.lcod.manifest.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule table for one mapping: per-property value rules, object-level rules and declared defaults.
 */
public record ObjectSchema(
    Map<String, List<ConstraintRule>> properties,
    List<ConstraintRule> objectRules,
    Map<String, Object> defaults,
    boolean closed
) {
    public ObjectSchema {
        var copy = new LinkedHashMap<String, List<ConstraintRule>>();
        properties.forEach((key, rules) -> copy.put(key, List.copyOf(rules)));
        properties = Collections.unmodifiableMap(copy);
        objectRules = List.copyOf(objectRules);
        defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public static Builder closedMapping() {
        return new Builder(true);
    }

    public static Builder openMapping() {
        return new Builder(false);
    }

    public List<ConstraintRule> rulesFor(String property) {
        return properties.getOrDefault(property, List.of());
    }

    public boolean declares(String property) {
        return properties.containsKey(property);
    }

    public static final class Builder {
        private final boolean closed;
        private final Map<String, List<ConstraintRule>> properties = new LinkedHashMap<>();
        private final List<ConstraintRule> objectRules = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();

        private Builder(boolean closed) {
            this.closed = closed;
        }

        public Builder property(String name, ConstraintRule... rules) {
            properties.put(name, Arrays.asList(rules));
            return this;
        }

        public Builder properties(List<String> names, ConstraintRule... rules) {
            for (var name : names) {
                property(name, rules);
            }
            return this;
        }

        public Builder withDefault(String name, Object value) {
            defaults.put(name, value);
            return this;
        }

        public Builder required(String... fields) {
            objectRules.add(new ConstraintRule.RequiredRule(List.of(fields)));
            return this;
        }

        public Builder dependency(String trigger, String... requires) {
            objectRules.add(new ConstraintRule.DependencyRule(trigger, List.of(requires)));
            return this;
        }

        public Builder rule(ConstraintRule rule) {
            objectRules.add(rule);
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(properties, objectRules, defaults, closed);
        }
    }
}
