package work.lcod.manifest.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Hook(String name, List<String> plugs, Map<String, Object> passthrough) {
    public Hook {
        Objects.requireNonNull(name, "name");
        plugs = List.copyOf(plugs);
        passthrough = Values.freeze(passthrough);
    }
}
