package work.lcod.manifest.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A part with every grammar field collapsed for the active selector context.
 */
public record Part(
    String name,
    String plugin,
    Optional<String> source,
    Optional<String> sourceType,
    Optional<String> sourceBranch,
    Optional<String> sourceTag,
    Optional<String> sourceCommit,
    Optional<String> sourceSubdir,
    Optional<String> sourceChecksum,
    Optional<Integer> sourceDepth,
    List<String> stagePackages,
    List<String> buildPackages,
    List<String> stageSnaps,
    List<String> buildSnaps,
    List<String> after,
    List<String> buildAttributes,
    boolean disableParallel,
    String overridePull,
    String overrideBuild,
    String overrideStage,
    String overridePrime,
    Map<String, Object> properties
) {
    public Part {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(plugin, "plugin");
        stagePackages = List.copyOf(stagePackages);
        buildPackages = List.copyOf(buildPackages);
        stageSnaps = List.copyOf(stageSnaps);
        buildSnaps = List.copyOf(buildSnaps);
        after = List.copyOf(after);
        buildAttributes = List.copyOf(buildAttributes);
        properties = Values.freeze(properties);
    }

    public boolean hasBuildAttribute(String attribute) {
        return buildAttributes.contains(attribute);
    }
}
