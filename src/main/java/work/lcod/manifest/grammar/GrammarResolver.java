package work.lcod.manifest.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import work.lcod.manifest.selector.SelectorContext;

/**
 * Collapses a grammar tree to a flat list of strings for one {@link SelectorContext}.
 *
 * <p>Clauses inside a sequence may be followed by {@code else} and {@code else fail} items; together they form
 * a chain of alternatives. An {@code on}/{@code to} clause whose selectors do not match yields nothing and hands
 * over to the next alternative. A {@code try} clause hands over when its body fails or yields nothing. Only an
 * {@code else fail} that is actually reached, or a malformed node, fails the resolution.
 */
public final class GrammarResolver {
    private GrammarResolver() {}

    public static Resolution resolve(GrammarNode node, SelectorContext context) {
        return resolve(node, context, "");
    }

    public static Resolution resolve(GrammarNode node, SelectorContext context, String path) {
        var outcome = evaluate(node, new Scope(context, path));
        return outcome.failure() != null
            ? Resolution.failed(outcome.failure())
            : Resolution.success(outcome.values());
    }

    /**
     * Parses and resolves a grammar-array field value.
     */
    public static Resolution resolveList(Object raw, SelectorContext context, String path) {
        if (raw == null) {
            return Resolution.success(List.of());
        }
        try {
            return resolve(GrammarParser.parse(raw), context, path);
        } catch (GrammarSyntaxException ex) {
            return Resolution.failed(new ResolutionFailure(path, ex.code(), ex.getMessage(), context));
        }
    }

    /**
     * Parses and resolves a grammar-string field value, which must collapse to at most one string.
     */
    public static Resolution resolveString(Object raw, SelectorContext context, String path) {
        var resolution = resolveList(raw, context, path);
        if (resolution.isSuccess() && resolution.values().size() > 1) {
            return Resolution.failed(new ResolutionFailure(
                path,
                ResolutionFailure.MULTIPLE_VALUES,
                "expected a single value, resolved to " + resolution.values(),
                context
            ));
        }
        return resolution;
    }

    private static Outcome evaluate(GrammarNode node, Scope scope) {
        return switch (node.kind()) {
            case SCALAR -> Outcome.matched(List.of(((GrammarNode.Scalar) node).value()));
            case SEQUENCE -> evaluateSequence(((GrammarNode.Sequence) node).items(), scope);
            case ON -> evaluateBranches(((GrammarNode.OnClause) node).branches(), scope.context()::matchesBuild, scope);
            case TO -> evaluateBranches(((GrammarNode.ToClause) node).branches(), scope.context()::matchesTarget, scope);
            case TRY -> evaluateTry((GrammarNode.TryClause) node, scope);
            case ELSE -> Outcome.failed(scope.fail(
                ResolutionFailure.SYNTAX,
                "'else' must follow an 'on', 'to' or 'try' clause"
            ));
            case ELSE_FAIL -> Outcome.failed(scope.fail(
                ResolutionFailure.ELSE_FAIL,
                "'else fail' reached: no clause matched"
            ));
        };
    }

    private static Outcome evaluateSequence(List<GrammarNode> items, Scope scope) {
        var values = new ArrayList<String>();
        int index = 0;
        while (index < items.size()) {
            var item = items.get(index);
            Outcome outcome;
            if (isConditional(item)) {
                int next = index + 1;
                while (next < items.size() && isAlternative(items.get(next))) {
                    next++;
                }
                outcome = evaluateChain(item, items.subList(index + 1, next), scope);
                index = next;
            } else {
                outcome = evaluate(item, scope);
                index++;
            }
            if (outcome.failure() != null) {
                return outcome;
            }
            values.addAll(outcome.values());
        }
        return Outcome.matched(values);
    }

    private static Outcome evaluateChain(GrammarNode head, List<GrammarNode> alternatives, Scope scope) {
        var outcome = evaluate(head, scope);
        if (outcome.failure() != null || outcome.matched()) {
            return outcome;
        }
        for (int i = 0; i < alternatives.size(); i++) {
            var alternative = alternatives.get(i);
            if (alternative.kind() == GrammarNode.Kind.ELSE_FAIL) {
                return evaluate(alternative, scope);
            }
            var fallback = evaluate(((GrammarNode.ElseClause) alternative).body(), scope);
            if (fallback.failure() == null) {
                return Outcome.matched(fallback.values());
            }
            if (i == alternatives.size() - 1) {
                return fallback;
            }
        }
        return Outcome.unmatched();
    }

    private static Outcome evaluateBranches(
        List<GrammarNode.Branch> branches,
        Predicate<Collection<String>> matcher,
        Scope scope
    ) {
        for (var branch : branches) {
            if (!matcher.test(branch.selectors())) {
                continue;
            }
            var body = branch.body();
            var outcome = evaluate(body, scope);
            if (outcome.failure() != null) {
                return outcome;
            }
            if (isConditional(body) && !outcome.matched()) {
                // compound "on X to Y" whose target did not match: later siblings may still apply
                continue;
            }
            return Outcome.matched(outcome.values());
        }
        return Outcome.unmatched();
    }

    private static Outcome evaluateTry(GrammarNode.TryClause clause, Scope scope) {
        var outcome = evaluate(clause.body(), scope);
        if (outcome.failure() != null || outcome.values().isEmpty()) {
            return Outcome.unmatched();
        }
        return Outcome.matched(outcome.values());
    }

    private static boolean isConditional(GrammarNode node) {
        var kind = node.kind();
        return kind == GrammarNode.Kind.ON || kind == GrammarNode.Kind.TO || kind == GrammarNode.Kind.TRY;
    }

    private static boolean isAlternative(GrammarNode node) {
        var kind = node.kind();
        return kind == GrammarNode.Kind.ELSE || kind == GrammarNode.Kind.ELSE_FAIL;
    }

    private record Scope(SelectorContext context, String path) {
        ResolutionFailure fail(String code, String message) {
            return new ResolutionFailure(path, code, message, context);
        }
    }

    private record Outcome(boolean matched, List<String> values, ResolutionFailure failure) {
        static Outcome matched(List<String> values) {
            return new Outcome(true, values, null);
        }

        static Outcome unmatched() {
            return new Outcome(false, List.of(), null);
        }

        static Outcome failed(ResolutionFailure failure) {
            return new Outcome(false, List.of(), failure);
        }
    }
}
