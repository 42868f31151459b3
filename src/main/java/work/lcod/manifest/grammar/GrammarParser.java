package work.lcod.manifest.grammar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns a decoded manifest value (strings, lists and mappings) into a {@link GrammarNode} tree.
 *
 * <p>Mappings inside a list are statements: {@code on <selectors>}, {@code to <selectors>},
 * {@code on <selectors> to <selectors>}, {@code try}, {@code else} and {@code else fail}. Sibling
 * {@code on} keys of one mapping form a single clause whose branches are tried in order.
 */
public final class GrammarParser {
    static final String ELSE_FAIL = "else fail";
    private static final Pattern SELECTOR = Pattern.compile("[^,\\s]+");
    private static final Pattern COMPOUND = Pattern.compile("^on\\s+(\\S+)\\s+to\\s+(\\S+)$");

    private GrammarParser() {}

    /**
     * Parses the top-level value of a grammar field. A plain string is always a scalar here.
     */
    public static GrammarNode parse(Object raw) {
        if (raw instanceof String str) {
            return new GrammarNode.Scalar(str);
        }
        if (raw instanceof List<?> list) {
            return new GrammarNode.Sequence(parseItems(list));
        }
        throw typeMismatch("a string or a list", raw);
    }

    private static List<GrammarNode> parseItems(List<?> list) {
        var items = new ArrayList<GrammarNode>();
        for (var item : list) {
            if (item instanceof String str) {
                items.add(ELSE_FAIL.equals(str.trim()) ? GrammarNode.ELSE_FAIL : new GrammarNode.Scalar(str));
            } else if (item instanceof Map<?, ?> map) {
                items.addAll(parseStatements(map));
            } else if (item instanceof List<?> nested) {
                items.add(new GrammarNode.Sequence(parseItems(nested)));
            } else {
                throw typeMismatch("a string or a grammar clause", item);
            }
        }
        return items;
    }

    private static List<GrammarNode> parseStatements(Map<?, ?> map) {
        var statements = new ArrayList<GrammarNode>();
        List<GrammarNode.Branch> onBranches = null;
        List<GrammarNode.Branch> toBranches = null;
        Set<List<Set<String>>> seenOn = new HashSet<>();
        Set<List<Set<String>>> seenTo = new HashSet<>();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String rawKey)) {
                throw new GrammarSyntaxException(ResolutionFailure.SYNTAX, "grammar keys must be strings, found " + entry.getKey());
            }
            var key = rawKey.trim();
            var value = entry.getValue();
            if (key.startsWith("on ") || key.startsWith("on\t")) {
                var branch = parseOnKey(key, value);
                requireUnique(seenOn, branch.selectors(), compoundTargets(branch), key);
                if (onBranches == null) {
                    onBranches = new ArrayList<>();
                    statements.add(new PendingClause(GrammarNode.Kind.ON, onBranches));
                }
                onBranches.add(branch);
            } else if (key.startsWith("to ") || key.startsWith("to\t")) {
                var selectors = parseSelectors(key.substring(2), key);
                requireUnique(seenTo, selectors, List.of(), key);
                if (toBranches == null) {
                    toBranches = new ArrayList<>();
                    statements.add(new PendingClause(GrammarNode.Kind.TO, toBranches));
                }
                toBranches.add(new GrammarNode.Branch(selectors, parseBody(value)));
            } else if ("try".equals(key)) {
                statements.add(new GrammarNode.TryClause(parseBody(value)));
            } else if ("else".equals(key)) {
                statements.add(new GrammarNode.ElseClause(parseBody(value)));
            } else if (ELSE_FAIL.equals(key)) {
                statements.add(GrammarNode.ELSE_FAIL);
            } else {
                throw new GrammarSyntaxException(ResolutionFailure.SYNTAX, "unknown grammar clause '" + key + "'");
            }
        }
        var resolved = new ArrayList<GrammarNode>(statements.size());
        for (var statement : statements) {
            resolved.add(statement instanceof PendingClause pending ? pending.toNode() : statement);
        }
        return resolved;
    }

    private static GrammarNode.Branch parseOnKey(String key, Object value) {
        var compound = COMPOUND.matcher(key);
        if (compound.matches()) {
            var onSelectors = parseSelectors(compound.group(1), key);
            var toSelectors = parseSelectors(compound.group(2), key);
            var inner = new GrammarNode.ToClause(List.of(new GrammarNode.Branch(toSelectors, parseBody(value))));
            return new GrammarNode.Branch(onSelectors, inner);
        }
        return new GrammarNode.Branch(parseSelectors(key.substring(2), key), parseBody(value));
    }

    private static List<String> parseSelectors(String raw, String key) {
        var trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new GrammarSyntaxException(ResolutionFailure.SYNTAX, "'" + key + "' does not name any selector");
        }
        var selectors = new ArrayList<String>();
        for (var token : trimmed.split(",", -1)) {
            var selector = token.trim();
            if (!SELECTOR.matcher(selector).matches()) {
                throw new GrammarSyntaxException(ResolutionFailure.SYNTAX, "'" + key + "' contains an invalid selector '" + selector + "'");
            }
            selectors.add(selector);
        }
        return selectors;
    }

    private static List<String> compoundTargets(GrammarNode.Branch branch) {
        return branch.body() instanceof GrammarNode.ToClause inner ? inner.branches().get(0).selectors() : List.of();
    }

    // "on a to b" and "on a to c" are distinct keys; only the same (on, to) pair counts as a repeat
    private static void requireUnique(Set<List<Set<String>>> seen, List<String> selectors, List<String> targets, String key) {
        if (!seen.add(List.of(new TreeSet<>(selectors), new TreeSet<>(targets)))) {
            throw new GrammarSyntaxException(ResolutionFailure.SYNTAX, "'" + key + "' repeats a selector set already used in this clause");
        }
    }

    private static GrammarNode parseBody(Object value) {
        if (value instanceof String str) {
            return ELSE_FAIL.equals(str.trim()) ? GrammarNode.ELSE_FAIL : new GrammarNode.Scalar(str);
        }
        if (value instanceof List<?> list) {
            return new GrammarNode.Sequence(parseItems(list));
        }
        if (value instanceof Map<?, ?> map) {
            return new GrammarNode.Sequence(parseStatements(map));
        }
        throw typeMismatch("a string, a list or a grammar clause", value);
    }

    private static GrammarSyntaxException typeMismatch(String expected, Object actual) {
        var found = actual == null ? "null" : describeType(actual) + " " + actual;
        return new GrammarSyntaxException(ResolutionFailure.TYPE, "expected " + expected + ", found " + found);
    }

    private static String describeType(Object value) {
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Map<?, ?>) {
            return "mapping";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Placeholder that lets sibling {@code on}/{@code to} keys accumulate branches while keeping statement order.
     */
    private record PendingClause(GrammarNode.Kind kind, List<GrammarNode.Branch> branches) implements GrammarNode {
        GrammarNode toNode() {
            return kind == GrammarNode.Kind.ON ? new GrammarNode.OnClause(branches) : new GrammarNode.ToClause(branches);
        }
    }
}
