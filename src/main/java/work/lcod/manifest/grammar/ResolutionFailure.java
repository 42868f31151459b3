package work.lcod.manifest.grammar;

import java.util.Objects;
import work.lcod.manifest.selector.SelectorContext;

/**
 * A grammar field that could not be collapsed to a value for the given selector context.
 */
public record ResolutionFailure(String path, String code, String message, SelectorContext context)
    implements Comparable<ResolutionFailure> {

    public static final String ELSE_FAIL = "else-fail";
    public static final String SYNTAX = "grammar-syntax";
    public static final String TYPE = "grammar-type";
    public static final String MULTIPLE_VALUES = "grammar-multiple-values";

    public ResolutionFailure {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
    }

    public String describe() {
        return path + ": " + message + " (" + context.describe() + ")";
    }

    @Override
    public int compareTo(ResolutionFailure other) {
        int byPath = path.compareTo(other.path);
        if (byPath != 0) {
            return byPath;
        }
        int byCode = code.compareTo(other.code);
        return byCode != 0 ? byCode : message.compareTo(other.message);
    }
}
