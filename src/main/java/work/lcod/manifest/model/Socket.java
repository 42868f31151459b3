package work.lcod.manifest.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A socket activation entry of an app. {@code listenStream} is either a port number or a socket path.
 */
public record Socket(String name, String listenStream, Optional<Integer> socketMode) {
    public Socket {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(listenStream, "listenStream");
        Objects.requireNonNull(socketMode, "socketMode");
    }

    public OptionalInt port() {
        try {
            return OptionalInt.of(Integer.parseInt(listenStream));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
