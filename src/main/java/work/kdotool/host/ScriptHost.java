package work.kdotool.host;

import java.nio.file.Path;

/**
 * Window manager side of a run: loads a script file and executes it.
 */
public interface ScriptHost {
    /**
     * @return host-assigned id of the loaded script
     */
    int load(Path script) throws ScriptHostException;

    void run(int scriptId) throws ScriptHostException;

    void stop(int scriptId) throws ScriptHostException;
}
