package work.kdotool.host;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uniquely named temporary file holding a generated script. Its file name doubles as the
 * marker of the run, since the OS guarantees no other live process holds the same name.
 */
public final class ScriptFile implements AutoCloseable {
    public static final String PREFIX = "kdotool-";
    public static final String SUFFIX = ".js";

    private static final Logger LOG = LoggerFactory.getLogger(ScriptFile.class);

    private final Path path;

    private ScriptFile(Path path) {
        this.path = path;
    }

    public static ScriptFile create() throws ScriptHostException {
        try {
            return new ScriptFile(Files.createTempFile(PREFIX, SUFFIX));
        } catch (IOException ex) {
            throw new ScriptHostException("Cannot create script file: " + ex.getMessage(), ex);
        }
    }

    public static ScriptFile create(Path directory) throws ScriptHostException {
        Objects.requireNonNull(directory, "directory");
        try {
            return new ScriptFile(Files.createTempFile(directory, PREFIX, SUFFIX));
        } catch (IOException ex) {
            throw new ScriptHostException("Cannot create script file in " + directory + ": " + ex.getMessage(), ex);
        }
    }

    public Path path() {
        return path;
    }

    public String marker() {
        return path.getFileName().toString();
    }

    public void write(String contents) throws ScriptHostException {
        try {
            Files.writeString(path, contents, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ScriptHostException("Cannot write script file " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOG.warn("Cannot delete script file {}: {}", path, ex.getMessage());
        }
    }
}
