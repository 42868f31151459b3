package work.lcod.manifest.selector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads selector defaults from a TOML file:
 *
 * <pre>
 * build-on = "amd64"
 * run-on = "arm64"
 *
 * [environment]
 * channel = "edge"
 * </pre>
 */
public final class SelectorConfigLoader {
    private SelectorConfigLoader() {}

    public static SelectorContext.Builder load(Path path) {
        return apply(SelectorContext.builder(), parse(path));
    }

    public static SelectorContext.Builder loadInto(SelectorContext.Builder builder, Path path) {
        return apply(builder, parse(path));
    }

    private static SelectorContext.Builder apply(SelectorContext.Builder builder, TomlParseResult config) {
        var buildOn = config.getString("build-on");
        if (buildOn != null) {
            builder.buildArch(buildOn);
        }
        var runOn = config.getString("run-on");
        if (runOn != null) {
            builder.targetArch(runOn);
        }
        builder.environment(readEnvironment(config.getTable("environment")));
        return builder;
    }

    private static TomlParseResult parse(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Selector config not found: " + path);
        }
        try {
            var result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                var details = result.errors().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining("; "));
                throw new IllegalArgumentException("Invalid selector config " + path + ": " + details);
            }
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read selector config: " + path, ex);
        }
    }

    private static Map<String, String> readEnvironment(TomlTable table) {
        Map<String, String> values = new LinkedHashMap<>();
        if (table == null || table.isEmpty()) {
            return values;
        }
        for (String key : table.keySet()) {
            var value = table.get(List.of(key));
            if (value instanceof TomlTable) {
                throw new IllegalArgumentException("environment." + key + " must be a scalar value");
            }
            if (value != null) {
                values.put(key, String.valueOf(value));
            }
        }
        return values;
    }
}
