package work.lcod.manifest.grammar;

/**
 * Raised by {@link GrammarParser} when a raw value cannot be read as grammar.
 */
public final class GrammarSyntaxException extends RuntimeException {
    private final String code;

    public GrammarSyntaxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
