package work.lcod.manifest.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.manifest.support.ManifestTestSupport.minimalManifest;
import static work.lcod.manifest.support.ManifestTestSupport.section;
import static work.lcod.manifest.support.ManifestTestSupport.yaml;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {
    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void minimalManifestIsValid() {
        assertEquals(ValidationResult.ok(), validator.validate(minimalManifest()));
    }

    @Test
    void missingPartsIsReportedAtParts() {
        var manifest = minimalManifest();
        manifest.remove("parts");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        var violation = result.violations().get(0);
        assertEquals("parts", violation.path());
        assertEquals("required", violation.ruleId());
        assertEquals("'parts' is a required property", violation.message());
    }

    @Test
    void emptyPartsIsRejected() {
        var manifest = minimalManifest();
        manifest.put("parts", new LinkedHashMap<String, Object>());

        var result = validator.validate(manifest);
        assertEquals(List.of("min-entries"), result.forPath("parts").stream().map(Violation::ruleId).toList());
    }

    @Test
    void baseSnapDeclaringBaseGetsExactlyOneBaseTypeViolation() {
        var manifest = minimalManifest();
        manifest.put("type", "base");
        manifest.put("base", "core18");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("base", result.violations().get(0).path());
        assertEquals("base-type", result.violations().get(0).ruleId());
        assertTrue(result.violations().get(0).message().contains("'base'"));
    }

    @Test
    void appSnapMustDeclareBase() {
        var manifest = minimalManifest();
        manifest.remove("base");
        assertEquals(1, validator.validate(manifest).forRule("base-type").size());

        manifest.put("type", "kernel");
        assertTrue(validator.validate(manifest).isValid());
    }

    @Test
    void bareBaseRequiresBuildBase() {
        var manifest = minimalManifest();
        manifest.put("base", "bare");
        manifest.put("build-base", "core20");
        assertTrue(validator.validate(manifest).isValid());

        manifest.remove("build-base");
        // "bare" is then an ordinary base name
        assertTrue(validator.validate(manifest).isValid());

        manifest.put("build-base", "core22");
        manifest.put("base", "core20");
        assertEquals(1, validator.validate(manifest).forRule("base-type").size());
    }

    @Test
    void bareBaseDoesNotExcuseBaseSnapTypes() {
        for (var type : List.of("base", "kernel", "snapd")) {
            var manifest = minimalManifest();
            manifest.put("type", type);
            manifest.put("base", "bare");
            manifest.put("build-base", "core20");

            var result = validator.validate(manifest);
            assertEquals(1, result.violations().size(), type);
            assertEquals("base", result.violations().get(0).path());
            assertEquals("base-type", result.violations().get(0).ruleId());
        }
    }

    @Test
    void gadgetMayUseBareBaseWithBuildBase() {
        var manifest = minimalManifest();
        manifest.put("type", "gadget");
        manifest.put("base", "bare");
        manifest.put("build-base", "core20");
        assertTrue(validator.validate(manifest).isValid());
    }

    @Test
    void adoptInfoReplacesSummaryDescriptionAndVersion() {
        var manifest = minimalManifest();
        manifest.remove("summary");
        manifest.remove("version");

        var missing = validator.validate(manifest);
        assertEquals(1, missing.forRule("adopt-info").size());
        assertEquals(FieldPath.ROOT, missing.forRule("adopt-info").get(0).path());

        manifest.put("adopt-info", "main");
        assertTrue(validator.validate(manifest).isValid());
    }

    @Test
    void adoptInfoMustNameAnExistingPart() {
        var manifest = minimalManifest();
        manifest.put("adopt-info", "ghost");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("adopt-info", result.violations().get(0).path());
        assertEquals("adopt-info-part", result.violations().get(0).ruleId());
    }

    @Test
    void partNamedPluginsIsRejected() {
        var manifest = minimalManifest();
        var parts = section(manifest, "parts");
        parts.put("plugins", Map.of("plugin", "nil"));

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("parts.plugins", result.violations().get(0).path());
        assertEquals("key-pattern", result.violations().get(0).ruleId());
    }

    @Test
    void invalidKeySkipsValueChecks() {
        var manifest = minimalManifest();
        section(manifest, "apps").put("-bad", Map.of("unknown", true));

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("apps.-bad", result.violations().get(0).path());
    }

    @Test
    void hookNamesAreRestricted() {
        var manifest = minimalManifest();
        section(manifest, "hooks", "Bad_Hook");
        section(manifest, "hooks", "configure");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        var violation = result.violations().get(0);
        assertEquals("hooks.Bad_Hook", violation.path());
        assertEquals("key-pattern", violation.ruleId());
        assertTrue(violation.message().startsWith("'Bad_Hook' is not a valid hook name"));
    }

    @Test
    void socketWithoutListenStreamIsReported() {
        var manifest = minimalManifest();
        var app = section(manifest, "apps", "web");
        app.put("command", "bin/web");
        app.put("daemon", "simple");
        section(app, "sockets", "http").put("socket-mode", 420);

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("apps.web.sockets.http.listen-stream", result.violations().get(0).path());
        assertEquals("required", result.violations().get(0).ruleId());
    }

    @Test
    void socketPortMustBeInRange() {
        var manifest = minimalManifest();
        var app = section(manifest, "apps", "web");
        app.put("command", "bin/web");
        app.put("daemon", "simple");
        section(app, "sockets", "http").put("listen-stream", 70000);

        var result = validator.validate(manifest);
        assertEquals(List.of("range"), result.violations().stream().map(Violation::ruleId).toList());
    }

    @Test
    void serviceSettingsDependOnDaemon() {
        var manifest = minimalManifest();
        var app = section(manifest, "apps", "worker");
        app.put("command", "bin/worker");
        app.put("stop-mode", "sigterm");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        var violation = result.violations().get(0);
        assertEquals("apps.worker.stop-mode", violation.path());
        assertEquals("dependency", violation.ruleId());
        assertEquals("'daemon' is a dependency of 'stop-mode'", violation.message());

        app.put("daemon", "simple");
        assertTrue(validator.validate(manifest).isValid());
    }

    @Test
    void licenseAgreementNeedsLicense() {
        var manifest = minimalManifest();
        manifest.put("license-agreement", "explicit");

        var result = validator.validate(manifest);
        assertEquals("license-agreement", result.violations().get(0).path());
        assertEquals("'license' is a dependency of 'license-agreement'", result.violations().get(0).message());
    }

    @Test
    void unknownKeysInClosedMappingsAreReported() {
        var manifest = minimalManifest();
        manifest.put("colour", "blue");
        section(manifest, "apps", "app").put("command", "bin/app");
        section(manifest, "apps", "app").put("comand", "typo");

        var result = validator.validate(manifest);
        assertEquals(List.of("apps.app.comand", "colour"),
            result.forRule("additional-property").stream().map(Violation::path).toList());
    }

    @Test
    void partsAcceptPluginSpecificProperties() {
        var manifest = minimalManifest();
        section(manifest, "parts", "main").put("go-importpath", "example.com/tool");
        assertTrue(validator.validate(manifest).isValid());
    }

    @Test
    void wrongTypeReportsOnlyTheTypeViolation() {
        var manifest = minimalManifest();
        manifest.put("version", 1.5);

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("type", result.violations().get(0).ruleId());
        assertEquals("1.5 is not of type 'string'", result.violations().get(0).message());
    }

    @Test
    void valuesOutsideTheDecodedTreeAreTypeViolations() {
        var manifest = minimalManifest();
        var id = UUID.fromString("00000000-0000-0000-0000-000000000001");
        manifest.put("version", id);

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("version", result.violations().get(0).path());
        assertEquals("type", result.violations().get(0).ruleId());
        assertEquals(id + " is not of type 'string'", result.violations().get(0).message());
    }

    @Test
    void commandCharactersAreRestricted() {
        var manifest = minimalManifest();
        section(manifest, "apps", "app").put("command", "/bin/app");
        section(manifest, "apps", "app").put("command-chain", List.of("bin/ok", "bin/not ok"));

        var result = validator.validate(manifest);
        assertEquals(List.of("apps.app.command", "apps.app.command-chain[1]"),
            result.forRule("pattern").stream().map(Violation::path).toList());
    }

    @Test
    void durationsUseServiceUnits() {
        var manifest = minimalManifest();
        var app = section(manifest, "apps", "svc");
        app.put("command", "bin/svc");
        app.put("daemon", "simple");
        app.put("stop-timeout", "10ms");
        app.put("start-timeout", "1h");

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("apps.svc.start-timeout", result.violations().get(0).path());
    }

    @Test
    void durationsMustFitTheDurationRange() {
        var manifest = minimalManifest();
        var app = section(manifest, "apps", "svc");
        app.put("command", "bin/svc");
        app.put("daemon", "simple");
        app.put("restart-delay", "153722867m");
        app.put("stop-timeout", "99999999999m");
        app.put("watchdog-timeout", "99999999999999999999999s");

        var result = validator.validate(manifest);
        assertEquals(List.of("apps.svc.stop-timeout", "apps.svc.watchdog-timeout"),
            result.forRule("duration").stream().map(Violation::path).toList());
        assertEquals(2, result.violations().size());
        assertEquals("'99999999999m' is too large for a duration", result.forPath("apps.svc.stop-timeout").get(0).message());
    }

    @Test
    void passthroughMustNotDuplicateDeclaredKeys() {
        var manifest = minimalManifest();
        manifest.put("passthrough", Map.of("summary", "again", "new-field", 1));
        var hook = section(manifest, "hooks", "configure");
        hook.put("plugs", List.of("network"));
        hook.put("passthrough", Map.of("plugs", List.of()));

        var result = validator.validate(manifest);
        var duplicates = result.forRule("passthrough-duplicate");
        assertEquals(List.of("hooks.configure.passthrough", "passthrough"), duplicates.stream().map(Violation::path).toList());
        assertTrue(duplicates.get(1).message().endsWith("'summary'"));
    }

    @Test
    void architecturesAcceptNamesAndBuildOnMappings() {
        var manifest = minimalManifest();
        manifest.put("architectures", List.of(
            "amd64",
            Map.of("build-on", List.of("arm64"), "run-on", "armhf"),
            Map.of("run-on", "i386")
        ));

        var result = validator.validate(manifest);
        assertEquals(1, result.violations().size());
        assertEquals("architectures[2].build-on", result.violations().get(0).path());
    }

    @Test
    void collectsEveryViolationInPathOrder() {
        var manifest = yaml("""
            name: Bad_Name
            version: "-1"
            summary: ok
            description: ok
            base: core20
            grade: beta
            apps:
              svc:
                command: bin/svc
                restart-delay: 5s
            parts:
              plugins:
                plugin: nil
            """);

        var result = validator.validate(manifest);
        assertEquals(
            List.of("apps.svc.restart-delay", "grade", "name", "parts.plugins", "version"),
            result.violations().stream().map(Violation::path).toList()
        );
    }

    @Test
    void nonMappingDocumentIsAShapeError() {
        assertThrows(DocumentShapeException.class, () -> validator.validate(List.of("a")));
        assertThrows(DocumentShapeException.class, () -> validator.validate("name: x"));
        assertThrows(DocumentShapeException.class, () -> validator.validate(null));
        assertThrows(DocumentShapeException.class, () -> validator.validate(Map.of(1, "x")));
    }

    @Test
    void parallelValidationMatchesSequentialValidation() {
        var manifest = minimalManifest();
        for (int i = 0; i < 12; i++) {
            var app = section(manifest, "apps", "app" + i);
            app.put("command", i % 3 == 0 ? "/abs" : "bin/app" + i);
            if (i % 2 == 0) {
                app.put("stop-mode", "sigterm");
            }
            section(manifest, "parts", "part" + i).put("plugin", i % 4 == 0 ? "" : "nil");
        }

        var sequential = validator.validate(manifest);
        var pool = Executors.newFixedThreadPool(4);
        try {
            var parallel = new SchemaValidator(pool).validate(manifest);
            assertFalse(sequential.isValid());
            assertEquals(sequential, parallel);
        } finally {
            pool.shutdownNow();
        }
    }
}
