package work.lcod.manifest.schema;

import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.manifest.schema.ConstraintRule.AlternativesRule;
import work.lcod.manifest.schema.ConstraintRule.Condition;
import work.lcod.manifest.schema.ConstraintRule.DurationRule;
import work.lcod.manifest.schema.ConstraintRule.EntriesRule;
import work.lcod.manifest.schema.ConstraintRule.EnumRule;
import work.lcod.manifest.schema.ConstraintRule.ItemsRule;
import work.lcod.manifest.schema.ConstraintRule.LengthRule;
import work.lcod.manifest.schema.ConstraintRule.MinEntriesRule;
import work.lcod.manifest.schema.ConstraintRule.NestedRule;
import work.lcod.manifest.schema.ConstraintRule.PassthroughRule;
import work.lcod.manifest.schema.ConstraintRule.PatternRule;
import work.lcod.manifest.schema.ConstraintRule.RangeRule;
import work.lcod.manifest.schema.ConstraintRule.ReferenceRule;
import work.lcod.manifest.schema.ConstraintRule.TypeRule;
import work.lcod.manifest.schema.ConstraintRule.UniqueItemsRule;

/**
 * The snapcraft.yaml rule table.
 */
public final class SnapcraftSchema {
    public static final String APP_NAME = "^[a-zA-Z0-9](?:-?[a-zA-Z0-9])*$";
    public static final String HOOK_NAME = "^[a-z](?:-?[a-z0-9])*$";
    public static final String PART_NAME = "^(?!plugins$)[a-z0-9][a-z0-9+-]*$";
    public static final String SOCKET_NAME = "^[a-z][a-z0-9_-]*$";

    public static final List<String> GRAMMAR_STRING_FIELDS = List.of(
        "source",
        "source-branch",
        "source-checksum",
        "source-commit",
        "source-subdir",
        "source-tag"
    );
    public static final List<String> GRAMMAR_ARRAY_FIELDS = List.of(
        "build-packages",
        "build-snaps",
        "stage-packages",
        "stage-snaps"
    );
    public static final List<String> DAEMON_ONLY_FIELDS = List.of(
        "after",
        "before",
        "bus-name",
        "post-stop-command",
        "refresh-mode",
        "reload-command",
        "restart-condition",
        "restart-delay",
        "start-timeout",
        "stop-command",
        "stop-mode",
        "stop-timeout",
        "timer",
        "watchdog-timeout"
    );

    private static final String COMMAND_FAILURE = "{value} is not a valid command string. Command strings may "
        + "only contain ASCII alphanumeric characters, spaces and the following special characters: "
        + "/ . _ # : $ - (and must not start with a slash)";
    private static final String COMMAND_CHAIN_FAILURE = "{value} is not a valid command-chain entry. Command chain "
        + "entries must be strings, and can only use ASCII alphanumeric characters and the following special "
        + "characters: / . _ # : $ -";
    private static final String DURATION_FAILURE = "{value} is not a valid duration. Durations are a number "
        + "optionally followed by the units ns, us, ms, s or m";

    public static final ObjectSchema SOCKET = ObjectSchema.closedMapping()
        .property("listen-stream", types(ValueType.INTEGER, ValueType.STRING), new RangeRule(1, 65535), new LengthRule(1, -1))
        .property("socket-mode", types(ValueType.INTEGER))
        .required("listen-stream")
        .build();

    public static final ObjectSchema APP = app();

    private static ObjectSchema app() {
        var builder = ObjectSchema.closedMapping()
            .property("command", types(ValueType.STRING), new LengthRule(1, -1),
                pattern("^[A-Za-z0-9. _#:$-][A-Za-z0-9/. _#:$-]*$", COMMAND_FAILURE))
            .property("common-id", types(ValueType.STRING))
            .property("desktop", types(ValueType.STRING))
            .property("autostart", types(ValueType.STRING),
                pattern("^[A-Za-z0-9. _#:$-]+\\.desktop$", "{value} is not a valid desktop file name (e.g. myapp.desktop)"))
            .property("daemon", types(ValueType.STRING), enumOf("simple", "forking", "oneshot", "notify", "dbus"))
            .property("bus-name", types(ValueType.STRING),
                pattern("^[A-Za-z0-9/. _#:$-]*$", "{value} is not a valid bus name"))
            .property("stop-mode", types(ValueType.STRING), enumOf(
                "sigterm", "sigterm-all", "sighup", "sighup-all", "sigusr1", "sigusr1-all", "sigusr2", "sigusr2-all"))
            .property("refresh-mode", types(ValueType.STRING), enumOf("endure", "restart"))
            .property("restart-condition", types(ValueType.STRING), enumOf(
                "on-success", "on-failure", "on-abnormal", "on-abort", "on-watchdog", "always", "never"))
            .properties(List.of("restart-delay", "start-timeout", "stop-timeout", "watchdog-timeout"),
                types(ValueType.STRING), new DurationRule(Pattern.compile("^[0-9]+(ns|us|ms|s|m)?$"), DURATION_FAILURE))
            .properties(List.of("stop-command", "post-stop-command", "reload-command"),
                types(ValueType.STRING), new LengthRule(1, -1),
                pattern("^[A-Za-z0-9. _#:$-][A-Za-z0-9/. _#:$-]*$", COMMAND_FAILURE))
            .properties(List.of("before", "after", "plugs", "slots", "extensions"), stringList())
            .property("timer", types(ValueType.STRING), new LengthRule(1, -1))
            .property("install-mode", types(ValueType.STRING), enumOf("enable", "disable"))
            .property("environment", environment())
            .property("command-chain", types(ValueType.ARRAY), new ItemsRule(List.of(
                types(ValueType.STRING), pattern("^[A-Za-z0-9/._#:$-]*$", COMMAND_CHAIN_FAILURE))))
            .property("adapter", types(ValueType.STRING), enumOf("none", "full", "legacy"))
            .property("sockets", types(ValueType.OBJECT), entries(SOCKET_NAME,
                "{key} is not a valid socket name. Socket names consist of lower-case alphanumeric characters, "
                    + "underscores and hyphens, and must start with a letter.",
                SOCKET))
            .property("passthrough", types(ValueType.OBJECT))
            .withDefault("adapter", "legacy")
            .required("command")
            .rule(new PassthroughRule());
        // service-only settings need "daemon"
        for (var field : DAEMON_ONLY_FIELDS) {
            builder.dependency(field, "daemon");
        }
        return builder.build();
    }

    public static final ObjectSchema HOOK = ObjectSchema.closedMapping()
        .property("plugs", stringList())
        .property("passthrough", types(ValueType.OBJECT))
        .rule(new PassthroughRule())
        .build();

    public static final ObjectSchema PART = ObjectSchema.openMapping()
        .property("plugin", types(ValueType.STRING), new LengthRule(1, -1))
        .properties(GRAMMAR_STRING_FIELDS, types(ValueType.STRING, ValueType.ARRAY))
        .property("source-depth", types(ValueType.INTEGER), new RangeRule(0, Integer.MAX_VALUE))
        .property("source-type", types(ValueType.STRING), enumOf(
            "bzr", "git", "hg", "mercurial", "subversion", "svn", "tar", "zip", "deb", "rpm", "7z", "local", "snap", ""))
        .property("disable-parallel", types(ValueType.BOOLEAN))
        .property("after", stringList())
        .properties(GRAMMAR_ARRAY_FIELDS, types(ValueType.ARRAY), new UniqueItemsRule())
        .property("build-attributes", types(ValueType.ARRAY), new UniqueItemsRule(), new ItemsRule(List.of(
            types(ValueType.STRING), enumOf("no-patchelf", "no-install", "debug", "keep-execstack"))))
        .property("organize", types(ValueType.OBJECT), new EntriesRule(null, null, List.of(types(ValueType.STRING))))
        .property("filesets", types(ValueType.OBJECT), new EntriesRule(null, null, List.of(stringList())))
        .properties(List.of("stage", "prime", "parse-info"), stringList())
        .property("build-environment", types(ValueType.ARRAY), new ItemsRule(List.of(
            types(ValueType.OBJECT), new EntriesRule(null, null, List.of(types(ValueType.STRING))))))
        .properties(List.of("override-pull", "override-build", "override-stage", "override-prime"), types(ValueType.STRING))
        .withDefault("override-pull", "snapcraftctl pull")
        .withDefault("override-build", "snapcraftctl build")
        .withDefault("override-stage", "snapcraftctl stage")
        .withDefault("override-prime", "snapcraftctl prime")
        .withDefault("disable-parallel", false)
        .required("plugin")
        .build();

    private static final ObjectSchema ARCHITECTURE = ObjectSchema.closedMapping()
        .property("build-on", types(ValueType.STRING, ValueType.ARRAY), new ItemsRule(List.of(types(ValueType.STRING))))
        .property("run-on", types(ValueType.STRING, ValueType.ARRAY), new ItemsRule(List.of(types(ValueType.STRING))))
        .required("build-on")
        .build();

    public static final ObjectSchema ROOT = ObjectSchema.closedMapping()
        .property("name", types(ValueType.STRING), new LengthRule(1, 40), pattern(
            "^(?:[a-z0-9]|(?<=[a-z0-9])-)*[a-z](?:[a-z0-9]|-(?=[a-z0-9]))*$",
            "{value} is not a valid snap name. Snap names can only use ASCII lowercase letters, numbers, and "
                + "hyphens, and must have at least one letter."))
        .property("title", types(ValueType.STRING), new LengthRule(0, 40))
        .property("version", types(ValueType.STRING), new LengthRule(1, 32), pattern(
            "^[a-zA-Z0-9](?:[a-zA-Z0-9:.+~-]{0,30}[a-zA-Z0-9+~])?$",
            "{value} is not a valid snap version string. Snap versions consist of upper- and lower-case "
                + "alphanumeric characters, as well as periods, colons, plus signs, tildes, and hyphens. They cannot "
                + "begin with a period, colon, plus sign, tilde, or hyphen. They cannot end with a period, colon, "
                + "or hyphen."))
        .property("version-script", types(ValueType.STRING))
        .property("summary", types(ValueType.STRING), new LengthRule(0, 78))
        .property("description", types(ValueType.STRING))
        .property("icon", types(ValueType.STRING))
        .properties(List.of("license", "license-agreement", "license-version", "adopt-info", "base", "build-base"),
            types(ValueType.STRING))
        .property("type", types(ValueType.STRING), enumOf("app", "base", "gadget", "kernel", "snapd"))
        .property("confinement", types(ValueType.STRING), enumOf("classic", "devmode", "strict"))
        .property("grade", types(ValueType.STRING), enumOf("stable", "devel"))
        .property("assumes", stringList())
        .property("architectures", types(ValueType.ARRAY), new UniqueItemsRule(), new ItemsRule(List.of(
            types(ValueType.STRING, ValueType.OBJECT), new NestedRule(ARCHITECTURE))))
        .property("environment", environment())
        .properties(List.of("plugs", "slots", "layout", "passthrough"), types(ValueType.OBJECT))
        .property("epoch")
        .property("apps", types(ValueType.OBJECT), entries(APP_NAME,
            "{key} is not a valid app name. App names consist of upper- and lower-case alphanumeric characters "
                + "and hyphens. They cannot start or end with a hyphen.",
            APP))
        .property("hooks", types(ValueType.OBJECT), entries(HOOK_NAME,
            "{key} is not a valid hook name. Hook names consist of lower-case alphanumeric characters and "
                + "hyphens. They cannot start or end with a hyphen.",
            HOOK))
        .property("parts", types(ValueType.OBJECT), new MinEntriesRule(1), entries(PART_NAME,
            "{key} is not a valid part name. Part names consist of lower-case alphanumeric characters, hyphens "
                + "and plus signs. As a special case, 'plugins' is not a valid part name.",
            PART))
        .withDefault("type", "app")
        .withDefault("confinement", "strict")
        .withDefault("grade", "stable")
        .required("name", "parts")
        .dependency("license-agreement", "license")
        .dependency("license-version", "license")
        .rule(new AlternativesRule(
            "base-type",
            "base",
            List.of(
                List.of(Condition.in("type", "base", "kernel", "snapd"), Condition.absent("base")),
                List.of(Condition.in("type", "app", "gadget"), Condition.present("base"), Condition.absent("build-base")),
                List.of(Condition.in("type", "app", "gadget"), Condition.in("base", "bare"), Condition.present("build-base"))
            ),
            true,
            "invalid 'base' for snap type {type}: snaps of type 'base', 'kernel' or 'snapd' must not declare "
                + "'base'; other snaps must declare 'base' without 'build-base', or use base 'bare' together "
                + "with 'build-base'"))
        .rule(new AlternativesRule(
            "adopt-info",
            FieldPath.ROOT,
            List.of(
                List.of(Condition.present("summary"), Condition.present("description"), Condition.present("version")),
                List.of(Condition.present("adopt-info"))
            ),
            false,
            "'summary', 'description' and 'version' must all be declared unless 'adopt-info' names the part "
                + "providing them"))
        .rule(new ReferenceRule(
            "adopt-info-part",
            "adopt-info",
            "parts",
            "'adopt-info' refers to a part named {value}, but it is not defined under 'parts'"))
        .rule(new PassthroughRule())
        .build();

    private SnapcraftSchema() {}

    private static TypeRule types(ValueType first, ValueType... rest) {
        return new TypeRule(EnumSet.of(first, rest));
    }

    private static PatternRule pattern(String regex, String failure) {
        return new PatternRule(Pattern.compile(regex), failure);
    }

    private static EnumRule enumOf(String... values) {
        return new EnumRule(List.of(values));
    }

    private static ItemsRule stringItems() {
        return new ItemsRule(List.of(types(ValueType.STRING)));
    }

    private static ConstraintRule[] stringList() {
        return new ConstraintRule[] {types(ValueType.ARRAY), new UniqueItemsRule(), stringItems()};
    }

    private static ConstraintRule[] environment() {
        return new ConstraintRule[] {
            types(ValueType.OBJECT),
            new EntriesRule(null, null, List.of(types(ValueType.STRING, ValueType.NUMBER)))
        };
    }

    private static EntriesRule entries(String keyPattern, String keyFailure, ObjectSchema entrySchema) {
        return new EntriesRule(Pattern.compile(keyPattern), keyFailure, List.of(types(ValueType.OBJECT), new NestedRule(entrySchema)));
    }
}
