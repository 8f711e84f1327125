package fr.imt.stackpilot.stackpilot.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.PruneResponse;
import com.github.dockerjava.api.model.PruneType;
import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import fr.imt.stackpilot.stackpilot.business.port.ContainerPort;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.ContainerExecutionException;
import fr.imt.stackpilot.stackpilot.exception.ContainerFailureKind;
import fr.imt.stackpilot.stackpilot.exception.DockerOperationException;
import fr.imt.stackpilot.stackpilot.exception.PruneException;
import fr.imt.stackpilot.stackpilot.infrastructure.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link ContainerPort} using the {@code docker compose} command line for bring-up and the Docker
 * API for everything else. Stacks are identified by their compose project label.
 */
@Slf4j
@Component
public class DockerComposeAdapter implements ContainerPort {

    static final String COMPOSE_PROJECT_LABEL = "com.docker.compose.project";
    private static final List<String> COMPOSE_FILE_NAMES = List.of(
            "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml");
    private static final long LOG_TAIL_TIMEOUT_SECONDS = 30;

    private final DockerClient dockerClient;
    private final ProcessRunner processRunner;
    private final Duration composeTimeout;

    public DockerComposeAdapter(DockerClient dockerClient, ProcessRunner processRunner,
                                StackpilotProperties properties) {
        this.dockerClient = dockerClient;
        this.processRunner = processRunner;
        this.composeTimeout = properties.getDeploy().getComposeTimeout();
    }

    @Override
    public int bringUp(Path projectDir, String composeProject, Consumer<String> output) {
        String composeFile = composeFileIn(projectDir);
        List<String> command = List.of("docker", "compose", "-f", composeFile, "up", "-d");
        log.info("Running docker compose up for {} in {}", composeProject, projectDir);

        ProcessResult result;
        try {
            result = processRunner.run(command, projectDir, Map.of("COMPOSE_PROJECT_NAME", composeProject),
                    composeTimeout, output);
        } catch (IOException e) {
            throw new ContainerExecutionException(ContainerFailureKind.NONZERO_EXIT,
                    "Cannot run docker compose: " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            throw new ContainerExecutionException(ContainerFailureKind.TIMEOUT,
                    "docker compose up timed out after " + composeTimeout.toSeconds() + "s");
        }
        return result.exitCode();
    }

    @Override
    public void pruneImages() {
        try {
            PruneResponse response = dockerClient.pruneCmd(PruneType.IMAGES)
                    .withDangling(true)
                    .exec();
            log.info("Pruned dangling images, reclaimed {} bytes", response.getSpaceReclaimed());
        } catch (RuntimeException e) {
            throw new PruneException("Image prune failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String tailLogs(String containerId, int lines) {
        StringBuilder output = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withTail(lines)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    })
                    .awaitCompletion(LOG_TAIL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (NotFoundException e) {
            throw new DockerOperationException("Container not found: " + containerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Log tail interrupted for container {}", containerId);
        } catch (RuntimeException e) {
            throw new DockerOperationException("logs " + containerId, e);
        }
        return output.toString();
    }

    @Override
    public boolean isRunning(String composeProject) {
        try {
            List<Container> containers = dockerClient.listContainersCmd()
                    .withLabelFilter(Map.of(COMPOSE_PROJECT_LABEL, composeProject))
                    .withStatusFilter(List.of("running"))
                    .exec();
            return !containers.isEmpty();
        } catch (RuntimeException e) {
            throw new DockerOperationException("list containers of " + composeProject, e);
        }
    }

    private String composeFileIn(Path projectDir) {
        return COMPOSE_FILE_NAMES.stream()
                .filter(name -> Files.isRegularFile(projectDir.resolve(name)))
                .findFirst()
                .orElse(COMPOSE_FILE_NAMES.get(0));
    }
}
