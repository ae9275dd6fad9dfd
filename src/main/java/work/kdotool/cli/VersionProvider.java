package work.kdotool.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.kdotool.script.TargetEnvironment;

/**
 * Version from the jar manifest, plus the KWin API the current session would be targeted with.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        TargetEnvironment target = TargetEnvironment.fromSessionVersion(System.getenv(KdotoolCommand.SESSION_VERSION_ENV));
        return new String[] {
            "kdotool " + (version == null ? "development" : version),
            "target: " + target.name().toLowerCase(Locale.ROOT) + " (" + target.windowListCall() + ")",
            "java: " + Runtime.version()
        };
    }
}
