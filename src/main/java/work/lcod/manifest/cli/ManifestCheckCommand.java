package work.lcod.manifest.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.manifest.api.CheckConfiguration;
import work.lcod.manifest.api.CheckResult;
import work.lcod.manifest.api.LogLevel;
import work.lcod.manifest.api.ManifestChecker;
import work.lcod.manifest.selector.SelectorConfigLoader;
import work.lcod.manifest.selector.SelectorContext;

@CommandLine.Command(
    name = "lcod-manifest",
    description = "Validate snap build manifests and resolve their grammar for one build/run architecture.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ManifestCheckCommand implements Callable<Integer> {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--file"},
        required = true,
        description = "Manifest file (snapcraft.yaml); may be repeated.",
        arity = "1..*"
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--build-on",
        description = "Build architecture (default: config file, then host).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String buildOn;

    @CommandLine.Option(
        names = "--run-on",
        description = "Target architecture (default: config file, then build architecture).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String runOn;

    @CommandLine.Option(
        names = {"-e", "--env"},
        paramLabel = "KEY=VALUE",
        description = "Selector environment entry matched by 'key=value' selectors."
    )
    private Map<String, String> environment = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--config",
        description = "TOML file with build-on, run-on and an [environment] table.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = "warn"
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--parallel",
        description = "Number of threads checking apps, hooks and parts.",
        defaultValue = "1"
    )
    private int parallelism;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full report as JSON."
    )
    private boolean json;

    @Override
    public Integer call() {
        if (files == null || files.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --file value is required.");
        }
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        // Must be set before the first logger is created.
        System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerName());

        CheckConfiguration configuration = CheckConfiguration.builder()
            .manifests(files)
            .selectorContext(resolveSelectorContext())
            .parallelism(parallelism)
            .logLevel(logLevel)
            .build();

        CheckResult result = new ManifestChecker().check(configuration);
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else {
            printSummary(result);
        }
        out.flush();
        return result.status().exitCode();
    }

    private SelectorContext resolveSelectorContext() {
        SelectorContext.Builder builder = config != null ? SelectorConfigLoader.load(config) : SelectorContext.builder();
        if (buildOn != null && !buildOn.isBlank()) {
            builder.buildArch(buildOn);
        }
        if (runOn != null && !runOn.isBlank()) {
            builder.targetArch(runOn);
        }
        builder.environment(environment);
        return builder.build();
    }

    private void printSummary(CheckResult result) {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (result.status() == CheckResult.Status.ERROR) {
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
            return;
        }
        for (var report : result.reports()) {
            var file = report.get("file");
            if (Boolean.TRUE.equals(report.get("valid"))) {
                out.println(file + ": valid");
                continue;
            }
            out.println(file + ": invalid");
            if (report.get("error") != null) {
                out.println("- " + report.get("error"));
            }
            if (report.get("problems") instanceof List<?> problems) {
                problems.forEach(problem -> out.println("- " + problem));
            }
        }
    }
}
