package work.lcod.manifest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.manifest.support.ManifestTestSupport.fixture;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.selector.SelectorContext;

class ManifestCheckerTest {
    private static final SelectorContext AMD64 = SelectorContext.of("amd64", "amd64");

    @Test
    void validManifestReportsResolvedParts() {
        var config = CheckConfiguration.builder()
            .manifest(fixture("valid.yaml"))
            .selectorContext(AMD64)
            .logLevel(LogLevel.INFO)
            .build();

        var result = new ManifestChecker().check(config);
        assertEquals(CheckResult.Status.VALID, result.status());
        assertEquals(0, result.status().exitCode());
        var report = result.reports().get(0);
        assertEquals(true, report.get("valid"));
        var manifest = (Map<?, ?>) report.get("manifest");
        assertEquals("hello-world", manifest.get("name"));
        var parts = (Map<?, ?>) manifest.get("parts");
        var hello = (Map<?, ?>) parts.get("hello");
        assertEquals(List.of("libc6", "libfoo-amd64"), hello.get("stage-packages"));
        assertEquals("amd64", result.metadata().get("buildOn"));
    }

    @Test
    void anyInvalidManifestFailsTheRun() {
        var config = CheckConfiguration.builder()
            .manifests(List.of(fixture("valid.yaml"), fixture("invalid.yaml"), fixture("absent.yaml")))
            .selectorContext(AMD64)
            .parallelism(2)
            .build();

        var result = new ManifestChecker().check(config);
        assertEquals(CheckResult.Status.INVALID, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals(3, result.reports().size());

        var invalid = result.reports().get(1);
        assertEquals(false, invalid.get("valid"));
        assertEquals(4, ((List<?>) invalid.get("violations")).size());
        var first = (Map<?, ?>) ((List<?>) invalid.get("violations")).get(0);
        assertEquals("adopt-info", first.get("rule"));

        var missing = result.reports().get(2);
        assertEquals(false, missing.get("valid"));
        assertTrue(String.valueOf(missing.get("error")).startsWith("Manifest not found"));
    }

    @Test
    void resolutionFailuresAreReported() {
        var config = CheckConfiguration.builder()
            .manifest(fixture("else-fail.yaml"))
            .selectorContext(SelectorContext.of("arm64", "arm64"))
            .build();

        var report = new ManifestChecker().check(config).reports().get(0);
        var failures = (List<?>) report.get("failures");
        assertEquals(1, failures.size());
        assertEquals("else-fail", ((Map<?, ?>) failures.get(0)).get("code"));
    }

    @Test
    void checkToJsonAddsSerializedPayload() {
        var config = CheckConfiguration.builder()
            .manifest(fixture("invalid.yaml"))
            .selectorContext(AMD64)
            .build();

        var result = new ManifestChecker().checkToJson(config);
        var payload = String.valueOf(result.metadata().get("payload"));
        assertTrue(payload.contains("\"status\" : \"invalid\""));
        assertTrue(payload.contains("parts.plugins"));
        assertFalse(result.isValid());
    }

    @Test
    void configurationRequiresManifestsAndPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> CheckConfiguration.builder().build());
        assertThrows(IllegalArgumentException.class, () ->
            CheckConfiguration.builder().manifest(fixture("valid.yaml")).parallelism(0).build());
    }

    @Test
    void logLevelParsing() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals("off", LogLevel.OFF.simpleLoggerName());
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("fatal"));
    }
}
