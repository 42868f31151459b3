package work.lcod.manifest.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JSON-style value types of a decoded manifest tree.
 */
public enum ValueType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    NULL;

    public static ValueType of(Object value) {
        return find(value).orElseThrow(() ->
            new IllegalArgumentException("Unsupported manifest value: " + value.getClass().getName()));
    }

    /**
     * Type of a decoded value, empty for objects that no manifest decoder produces.
     */
    public static Optional<ValueType> find(Object value) {
        if (value == null) {
            return Optional.of(NULL);
        }
        if (value instanceof String) {
            return Optional.of(STRING);
        }
        if (value instanceof Boolean) {
            return Optional.of(BOOLEAN);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return Optional.of(INTEGER);
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal.stripTrailingZeros().scale() <= 0 ? INTEGER : NUMBER);
        }
        if (value instanceof Number) {
            return Optional.of(NUMBER);
        }
        if (value instanceof List<?>) {
            return Optional.of(ARRAY);
        }
        if (value instanceof Map<?, ?>) {
            return Optional.of(OBJECT);
        }
        return Optional.empty();
    }

    /**
     * Whether {@code value} is acceptable where this type is declared; integers are numbers too.
     */
    public boolean accepts(Object value) {
        var actual = find(value).orElse(null);
        return actual == this || (this == NUMBER && actual == INTEGER);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
