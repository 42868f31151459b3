package work.lcod.manifest.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.grammar.ResolutionFailure;
import work.lcod.manifest.model.AssemblyResult;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestAssembler;
import work.lcod.manifest.runtime.ManifestLoader;
import work.lcod.manifest.schema.Violation;

/**
 * Public entry point for embedding the manifest checks: load each file, validate it and resolve its grammar.
 */
public final class ManifestChecker {
    private static final Logger LOG = LoggerFactory.getLogger(ManifestChecker.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public CheckResult check(CheckConfiguration configuration) {
        var started = Instant.now();
        ExecutorService pool = configuration.parallelism() > 1
            ? Executors.newFixedThreadPool(configuration.parallelism())
            : null;
        try {
            var assembler = pool == null ? new ManifestAssembler() : new ManifestAssembler(pool);
            var reports = new ArrayList<Map<String, Object>>();
            for (var path : configuration.manifests()) {
                reports.add(checkOne(assembler, path, configuration));
            }
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("buildOn", configuration.selectorContext().buildArch());
            metadata.put("runOn", configuration.selectorContext().targetArch());
            metadata.put("environment", configuration.selectorContext().environment());
            metadata.put("parallelism", configuration.parallelism());
            metadata.put("logLevel", configuration.logLevel().name());
            return CheckResult.of(reports, metadata, started);
        } catch (RuntimeException ex) {
            if (Boolean.getBoolean("lcod.debug")) {
                ex.printStackTrace();
            }
            return CheckResult.error(ex.getMessage(), Map.of("manifests", configuration.manifests().toString()), started);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    public CheckResult checkToJson(CheckConfiguration configuration) {
        var result = check(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            var meta = new LinkedHashMap<>(result.metadata());
            meta.put("payload", json);
            return new CheckResult(result.status(), result.reports(), meta, result.startedAt(), result.finishedAt());
        } catch (JsonProcessingException ex) {
            return CheckResult.error("Unable to serialize result payload: " + ex.getMessage(), Map.of(), result.startedAt());
        }
    }

    private Map<String, Object> checkOne(ManifestAssembler assembler, Path path, CheckConfiguration configuration) {
        var report = new LinkedHashMap<String, Object>();
        report.put("file", path.toString());
        AssemblyResult result;
        try {
            var document = ManifestLoader.loadFromLocalFile(path);
            result = assembler.assemble(document, configuration.selectorContext());
        } catch (RuntimeException ex) {
            LOG.debug("Could not check {}", path, ex);
            report.put("valid", false);
            report.put("error", ex.getMessage());
            return report;
        }
        report.put("valid", result.isSuccess());
        if (result.isSuccess()) {
            report.put("manifest", summarize(result.manifest()));
        } else {
            report.put("violations", result.violations().stream().map(ManifestChecker::violation).toList());
            report.put("failures", result.failures().stream().map(ManifestChecker::failure).toList());
            report.put("problems", result.problems());
        }
        LOG.info("{}: {}", path, result.isSuccess() ? "valid" : result.problems().size() + " problem(s)");
        return report;
    }

    private static Map<String, Object> summarize(Manifest manifest) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("name", manifest.name());
        manifest.version().ifPresent(version -> summary.put("version", version));
        summary.put("type", manifest.type());
        manifest.base().ifPresent(base -> summary.put("base", base));
        summary.put("confinement", manifest.confinement());
        summary.put("grade", manifest.grade());
        summary.put("assumes", manifest.assumes());
        summary.put("apps", new ArrayList<>(manifest.apps().keySet()));
        summary.put("hooks", new ArrayList<>(manifest.hooks().keySet()));
        var parts = new LinkedHashMap<String, Object>();
        manifest.parts().forEach((name, part) -> {
            var resolved = new LinkedHashMap<String, Object>();
            resolved.put("plugin", part.plugin());
            part.source().ifPresent(source -> resolved.put("source", source));
            resolved.put("build-packages", part.buildPackages());
            resolved.put("stage-packages", part.stagePackages());
            resolved.put("build-snaps", part.buildSnaps());
            resolved.put("stage-snaps", part.stageSnaps());
            parts.put(name, resolved);
        });
        summary.put("parts", parts);
        return summary;
    }

    private static Map<String, Object> violation(Violation violation) {
        var out = new LinkedHashMap<String, Object>();
        out.put("path", violation.path());
        out.put("rule", violation.ruleId());
        out.put("message", violation.message());
        return out;
    }

    private static Map<String, Object> failure(ResolutionFailure failure) {
        var out = new LinkedHashMap<String, Object>();
        out.put("path", failure.path());
        out.put("code", failure.code());
        out.put("message", failure.message());
        return out;
    }
}
