package work.lcod.manifest.schema;

/**
 * Dotted/indexed field paths such as {@code parts.mypart.source-type} or {@code apps.web.command-chain[1]}.
 */
public final class FieldPath {
    public static final String ROOT = "";

    private FieldPath() {}

    public static String child(String parent, String key) {
        return parent == null || parent.isEmpty() ? key : parent + "." + key;
    }

    public static String index(String parent, int index) {
        return parent + "[" + index + "]";
    }

    public static String display(String path) {
        return path == null || path.isEmpty() ? "(root)" : path;
    }
}
