package work.lcod.manifest.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Reads manifest text (YAML, and therefore JSON) into the plain tree the validator works on:
 * {@link java.util.Map} with string keys, {@link java.util.List}, strings, numbers, booleans and null.
 */
public final class ManifestLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ManifestLoader() {}

    public static Object loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (NoSuchFileException ex) {
            throw new IllegalArgumentException("Manifest not found: " + path, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read manifest: " + path, ex);
        }
    }

    public static Object parse(String text) {
        try {
            return toTree(YAML_MAPPER.readTree(text));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse manifest: " + ex.getMessage(), ex);
        }
    }

    public static Object parse(InputStream in) throws IOException {
        return toTree(YAML_MAPPER.readTree(in));
    }

    private static Object toTree(JsonNode root) {
        if (root == null || root.isMissingNode()) {
            return null;
        }
        return convertNode(root);
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
