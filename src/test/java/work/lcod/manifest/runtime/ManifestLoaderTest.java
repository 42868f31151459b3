package work.lcod.manifest.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.manifest.support.ManifestTestSupport.fixture;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ManifestLoaderTest {
    @Test
    void loadsYamlIntoPlainCollections() {
        var document = assertInstanceOf(Map.class, ManifestLoader.loadFromLocalFile(fixture("valid.yaml")));

        assertEquals("hello-world", document.get("name"));
        assertEquals("1.0", document.get("version"));
        var parts = assertInstanceOf(Map.class, document.get("parts"));
        var hello = assertInstanceOf(Map.class, parts.get("hello"));
        var stagePackages = assertInstanceOf(List.class, hello.get("stage-packages"));
        assertEquals("libc6", stagePackages.get(0));
        assertEquals(Map.of("on amd64", List.of("libfoo-amd64")), stagePackages.get(1));
        assertEquals(1, hello.get("source-depth"));
    }

    @Test
    void keepsDeclarationOrder() {
        var document = (Map<?, ?>) ManifestLoader.parse("b: 1\na: 2\nc: 3\n");
        assertEquals(List.of("b", "a", "c"), List.copyOf(document.keySet()));
    }

    @Test
    void acceptsJson() {
        var document = (Map<?, ?>) ManifestLoader.parse("{\"name\": \"x\", \"flag\": true, \"none\": null}");
        assertEquals(true, document.get("flag"));
        assertNull(document.get("none"));
    }

    @Test
    void topLevelSequenceStaysASequence() {
        assertInstanceOf(List.class, ManifestLoader.loadFromLocalFile(fixture("not-a-mapping.yaml")));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(IllegalArgumentException.class, () -> ManifestLoader.loadFromLocalFile(fixture("absent.yaml")));
    }

    @Test
    void malformedYamlIsReported() {
        assertThrows(IllegalStateException.class, () -> ManifestLoader.parse("name: [unterminated"));
    }
}
