package work.lcod.manifest.schema;

/**
 * The input is not a manifest at all (not a mapping, or keyed by non-strings); raised before any field is checked.
 */
public final class DocumentShapeException extends RuntimeException {
    public DocumentShapeException(String message) {
        super(message);
    }
}
