package work.lcod.manifest.schema;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders {@code validation-failure} templates. {@code {name}} placeholders are replaced by the quoted variable;
 * unknown placeholders are left untouched.
 */
public final class MessageTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z][a-z0-9-]*)}");

    private MessageTemplate() {}

    public static String render(String template, Map<String, ?> variables) {
        var matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            var replacement = variables.containsKey(name) ? quote(variables.get(name)) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String quote(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String str) {
            return "'" + str + "'";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(MessageTemplate::quote).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .map(e -> quote(String.valueOf(e.getKey())) + ": " + quote(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
        }
        return String.valueOf(value);
    }
}
