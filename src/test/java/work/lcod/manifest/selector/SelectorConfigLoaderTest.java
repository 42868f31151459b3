package work.lcod.manifest.selector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.manifest.support.ManifestTestSupport.selectorFixture;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SelectorConfigLoaderTest {
    @Test
    void readsArchitecturesAndEnvironment() {
        var context = SelectorConfigLoader.load(selectorFixture("cross.toml")).build();

        assertEquals("arm64", context.buildArch());
        assertEquals("armhf", context.targetArch());
        assertEquals(Map.of("channel", "edge", "release", "20"), context.environment());
    }

    @Test
    void explicitSettingsOverrideTheFile() {
        var builder = SelectorConfigLoader.load(selectorFixture("cross.toml"));
        builder.targetArch("s390x").putEnvironment("channel", "stable");

        var context = builder.build();
        assertEquals("arm64", context.buildArch());
        assertEquals("s390x", context.targetArch());
        assertEquals("stable", context.environment().get("channel"));
    }

    @Test
    void loadIntoKeepsEarlierSettings() {
        var builder = SelectorContext.builder().putEnvironment("flavour", "minimal");
        var context = SelectorConfigLoader.loadInto(builder, selectorFixture("cross.toml")).build();

        assertEquals("minimal", context.environment().get("flavour"));
        assertEquals("edge", context.environment().get("channel"));
    }

    @Test
    void reportsMissingAndMalformedFiles() {
        assertThrows(IllegalArgumentException.class, () -> SelectorConfigLoader.load(selectorFixture("missing.toml")));
        var thrown = assertThrows(IllegalArgumentException.class, () -> SelectorConfigLoader.load(selectorFixture("broken.toml")));
        assertTrue(thrown.getMessage().startsWith("Invalid selector config"));
    }
}
