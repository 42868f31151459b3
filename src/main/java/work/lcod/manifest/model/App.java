package work.lcod.manifest.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A validated app entry. {@code properties} keeps the complete declaration for the build orchestrator,
 * including the settings that have no typed accessor here.
 */
public record App(
    String name,
    String command,
    Optional<String> daemon,
    String adapter,
    List<String> commandChain,
    List<String> plugs,
    List<String> slots,
    List<String> before,
    List<String> after,
    Map<String, Duration> timeouts,
    Map<String, Socket> sockets,
    Map<String, String> environment,
    Map<String, Object> passthrough,
    Map<String, Object> properties
) {
    public App {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(daemon, "daemon");
        Objects.requireNonNull(adapter, "adapter");
        commandChain = List.copyOf(commandChain);
        plugs = List.copyOf(plugs);
        slots = List.copyOf(slots);
        before = List.copyOf(before);
        after = List.copyOf(after);
        timeouts = Values.freeze(timeouts);
        sockets = Values.freeze(sockets);
        environment = Values.freeze(environment);
        passthrough = Values.freeze(passthrough);
        properties = Values.freeze(properties);
    }

    public boolean isDaemon() {
        return daemon.isPresent();
    }

    public Optional<Duration> timeout(String field) {
        return Optional.ofNullable(timeouts.get(field));
    }
}
