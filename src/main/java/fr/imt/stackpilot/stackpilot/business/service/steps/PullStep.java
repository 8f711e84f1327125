package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.GitPort;
import fr.imt.stackpilot.stackpilot.business.utils.NameSanitizer;
import fr.imt.stackpilot.stackpilot.exception.GitFailureKind;
import fr.imt.stackpilot.stackpilot.exception.GitOperationException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Clones the repository into its working directory, or brings an existing checkout to the remote tip.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PullStep implements DeploymentStep {

    private final GitPort gitPort;

    @Override
    public DeploymentStepType getType() {
        return DeploymentStepType.PULL;
    }

    @Override
    public void execute(DeploymentContext context) {
        GitRepository repository = context.getRepository();
        Path localPath = repository.localWorkingPath();
        String hash;

        if (isCheckedOut(localPath)) {
            context.log(getType(), "Pulling branch " + repository.getBranch() + " in " + localPath);
            hash = gitPort.pull(localPath, repository.getBranch(), repository.getGitUrl(), repository.getToken());
        } else {
            context.log(getType(), String.format("Cloning %s (branch: %s) into %s",
                    NameSanitizer.maskCredentials(repository.getGitUrl()), repository.getBranch(), localPath));
            hash = gitPort.clone(repository.getGitUrl(), repository.getBranch(), localPath, repository.getToken());
        }

        log.info("Repository {} checked out at {}", repository.getId(), hash);
        context.log(getType(), "Working tree at " + hash);
        context.setDeployedCommitHash(hash);
    }

    private boolean isCheckedOut(Path localPath) {
        if (!Files.isDirectory(localPath)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(localPath)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            throw new GitOperationException(GitFailureKind.CORRUPTED,
                    "Cannot read working directory " + localPath, e);
        }
    }
}
