package work.lcod.manifest.selector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SelectorContextTest {
    @Test
    void targetDefaultsToBuildArchitecture() {
        var context = SelectorContext.builder().buildArch("x86_64").build();
        assertEquals("amd64", context.buildArch());
        assertEquals("amd64", context.targetArch());
    }

    @Test
    void buildDefaultsToHost() {
        var context = SelectorContext.builder().targetArch("armhf").build();
        assertEquals(Architectures.host(), context.buildArch());
        assertEquals("armhf", context.targetArch());
    }

    @Test
    void normalizesPlatformNames() {
        assertEquals("arm64", Architectures.normalize("aarch64"));
        assertEquals("ppc64el", Architectures.normalize("PPC64LE"));
        assertEquals("riscv64", Architectures.normalize(" riscv64 "));
        assertEquals("amd64", Architectures.normalize("amd64"));
        assertThrows(IllegalArgumentException.class, () -> Architectures.normalize(""));
    }

    @Test
    void matchesArchitectureAndEnvironmentSelectors() {
        var context = new SelectorContext("amd64", "arm64", Map.of("channel", "edge"));

        assertTrue(context.matchesBuild(List.of("i386", "amd64")));
        assertFalse(context.matchesBuild(List.of("arm64")));
        assertTrue(context.matchesTarget(List.of("arm64")));
        assertTrue(context.matchesBuild(List.of("channel=edge")));
        assertFalse(context.matchesBuild(List.of("channel=stable")));
        assertFalse(context.matchesBuild(List.of("release=20")));
    }

    @Test
    void describesItself() {
        assertEquals("build-on amd64, run-on armhf", SelectorContext.of("amd64", "armhf").describe());
    }
}
