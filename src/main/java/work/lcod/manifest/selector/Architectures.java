package work.lcod.manifest.selector;

import java.util.Locale;
import java.util.Map;

/**
 * Maps platform names reported by the JVM or uname onto Debian architecture names used by selectors.
 */
public final class Architectures {
    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("x86_64", "amd64"),
        Map.entry("x64", "amd64"),
        Map.entry("aarch64", "arm64"),
        Map.entry("armv7l", "armhf"),
        Map.entry("arm", "armhf"),
        Map.entry("x86", "i386"),
        Map.entry("i686", "i386"),
        Map.entry("ppc64le", "ppc64el"),
        Map.entry("riscv64", "riscv64"),
        Map.entry("s390x", "s390x")
    );

    private Architectures() {}

    public static String host() {
        return normalize(System.getProperty("os.arch", "amd64"));
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Architecture must not be blank");
        }
        var trimmed = raw.trim();
        return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
