package work.kdotool.cli;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import picocli.CommandLine;
import work.kdotool.api.KdotoolRunner;
import work.kdotool.api.RunConfiguration;
import work.kdotool.api.RunResult;
import work.kdotool.config.ConfigLoader;
import work.kdotool.config.KdotoolConfig;
import work.kdotool.script.TargetEnvironment;

@CommandLine.Command(
    name = "kdotool",
    description = "Run xdotool-style window commands inside KWin.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    footerHeading = "%nCommands:%n",
    footer = {
        "  search <term>                 windows whose fields all match <term> (regex, case-insensitive)",
        "  getactivewindow               the focused window",
        "  getwindowname [window]",
        "  getwindowclassname [window]",
        "  getwindowgeometry [window]",
        "  getwindowpid [window]",
        "  windowminimize [window]",
        "  windowraise [window]",
        "  windowclose [window]",
        "  windowkill [window]",
        "  windowactivate [window]",
        "",
        "Window can be specified as:",
        "  %%1         the first window in the stack (default)",
        "  %%2         the second window in the stack",
        "  %%@         all windows in the stack",
        "  <id>       the window with the given ID"
    }
)
final class KdotoolCommand implements Callable<Integer> {
    static final String SESSION_VERSION_ENV = "KDE_SESSION_VERSION";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--debug"},
        description = "Enable debug output in the generated script."
    )
    private boolean debug;

    @CommandLine.Option(
        names = {"-n", "--dry-run"},
        description = "Don't actually run the script. Just print it to stdout."
    )
    private boolean dryRun;

    @CommandLine.Parameters(
        paramLabel = "COMMAND",
        arity = "0..*",
        description = "Commands and their arguments, executed in order."
    )
    private List<String> commands = new ArrayList<>();

    private final Map<String, String> env;
    private final Function<KdotoolConfig, KdotoolRunner> runnerFactory;

    KdotoolCommand() {
        this(System.getenv(), KdotoolRunner::forSession);
    }

    KdotoolCommand(Map<String, String> env, Function<KdotoolConfig, KdotoolRunner> runnerFactory) {
        this.env = Objects.requireNonNull(env, "env");
        this.runnerFactory = Objects.requireNonNull(runnerFactory, "runnerFactory");
    }

    @Override
    public Integer call() {
        CommandLine commandLine = spec.commandLine();
        if (commands == null || commands.isEmpty()) {
            commandLine.usage(commandLine.getOut());
            return 0;
        }

        KdotoolConfig settings = ConfigLoader.load(env);
        TargetEnvironment target = settings.target()
            .orElseGet(() -> TargetEnvironment.fromSessionVersion(env.get(SESSION_VERSION_ENV)));
        RunConfiguration configuration = RunConfiguration.builder()
            .commands(commands)
            .debug(debug || settings.debug())
            .dryRun(dryRun)
            .target(target)
            .settings(settings)
            .build();

        RunResult result = runnerFactory.apply(settings).run(configuration);
        PrintWriter out = commandLine.getOut();
        PrintWriter err = commandLine.getErr();
        switch (result.status()) {
            case PLANNED -> result.script().ifPresent(script -> out.print(script.text()));
            case FAILURE -> err.println(ShortErrorHandler.errorLine(commandLine, result.message()));
            case SUCCESS -> {
                result.results().forEach(out::println);
                result.errors().forEach(err::println);
            }
            default -> throw new IllegalStateException("Unhandled status " + result.status());
        }
        out.flush();
        err.flush();
        return result.status().exitCode();
    }
}
