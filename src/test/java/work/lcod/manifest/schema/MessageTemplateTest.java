package work.lcod.manifest.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageTemplateTest {
    @Test
    void quotesSubstitutedValues() {
        assertEquals("'x' is not valid", MessageTemplate.render("{value} is not valid", Map.of("value", "x")));
        assertEquals("[1, 'a'] and {missing}", MessageTemplate.render("{value} and {missing}", Map.of("value", List.of(1, "a"))));
    }

    @Test
    void replacementTextIsLiteral() {
        assertEquals("'$1 \\n' rejected", MessageTemplate.render("{value} rejected", Map.of("value", "$1 \\n")));
    }

    @Test
    void wholeDecimalsCountAsIntegers() {
        assertEquals(ValueType.INTEGER, ValueType.of(new BigDecimal("3.0")));
        assertEquals(ValueType.NUMBER, ValueType.of(2.5));
        assertEquals(true, ValueType.NUMBER.accepts(7));
        assertEquals(false, ValueType.INTEGER.accepts(7.5));
    }
}
