package work.lcod.manifest.grammar;

import java.util.List;
import java.util.Objects;

/**
 * One node of a conditional grammar tree. {@link #kind()} is the closed tag the resolver switches on.
 */
public interface GrammarNode {
    Kind kind();

    enum Kind {
        SCALAR,
        SEQUENCE,
        ON,
        TO,
        TRY,
        ELSE,
        ELSE_FAIL
    }

    GrammarNode ELSE_FAIL = new ElseFail();

    record Scalar(String value) implements GrammarNode {
        public Scalar {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.SCALAR;
        }
    }

    record Sequence(List<GrammarNode> items) implements GrammarNode {
        public Sequence {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }
    }

    /**
     * A selector set (logical OR of exact tokens) guarding a body.
     */
    record Branch(List<String> selectors, GrammarNode body) {
        public Branch {
            selectors = List.copyOf(selectors);
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * Matches against the build architecture; branches are tried in declaration order.
     */
    record OnClause(List<Branch> branches) implements GrammarNode {
        public OnClause {
            branches = List.copyOf(branches);
        }

        @Override
        public Kind kind() {
            return Kind.ON;
        }
    }

    /**
     * Matches against the target architecture.
     */
    record ToClause(List<Branch> branches) implements GrammarNode {
        public ToClause {
            branches = List.copyOf(branches);
        }

        @Override
        public Kind kind() {
            return Kind.TO;
        }
    }

    record TryClause(GrammarNode body) implements GrammarNode {
        public TryClause {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.TRY;
        }
    }

    record ElseClause(GrammarNode body) implements GrammarNode {
        public ElseClause {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.ELSE;
        }
    }

    record ElseFail() implements GrammarNode {
        @Override
        public Kind kind() {
            return Kind.ELSE_FAIL;
        }
    }
}
