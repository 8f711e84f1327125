package fr.imt.stackpilot.stackpilot.business.port;

import java.nio.file.Path;
import java.util.function.Consumer;

public interface ContainerPort {

    /**
     * Brings the compose project in {@code projectDir} up, streaming every output line to {@code output}.
     *
     * @return the exit code of the bring-up command
     * @throws fr.imt.stackpilot.stackpilot.exception.ContainerExecutionException on timeout
     */
    int bringUp(Path projectDir, String composeProject, Consumer<String> output);

    /**
     * @throws fr.imt.stackpilot.stackpilot.exception.PruneException when the daemon refuses
     */
    void pruneImages();

    String tailLogs(String containerId, int lines);

    boolean isRunning(String composeProject);
}
