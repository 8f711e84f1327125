package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.ContainerPort;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentRepositoryPort;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentStatusPublisherPort;
import fr.imt.stackpilot.stackpilot.business.port.GitPort;
import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.business.service.steps.DeploymentContext;
import fr.imt.stackpilot.stackpilot.business.service.steps.DeploymentStep;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.DockerOperationException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.StackpilotException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Drives one deployment from PENDING to a terminal state.
 * <p>
 * Flow: change check, pull, decrypt, compose up, healthcheck, optional prune, notify. The first
 * failing step marks the deployment FAILED and no later step runs. The repository's last deployed
 * commit only moves forward when the whole chain succeeded.
 */
@Slf4j
@Service
public class DeploymentStateMachine implements DeploymentExecutor {

    static final String INTERNAL_ERROR_CODE = "INTERNAL_ERR";

    private final GitRepositoryPort gitRepositoryPort;
    private final DeploymentRepositoryPort deploymentRepositoryPort;
    private final DeploymentStatusPublisherPort statusPublisherPort;
    private final GitPort gitPort;
    private final ContainerPort containerPort;
    private final List<DeploymentStep> steps;
    private final DeploymentLogWriter logWriter;
    private final NotificationTrigger notificationTrigger;
    private final StackpilotProperties.Deploy settings;

    public DeploymentStateMachine(GitRepositoryPort gitRepositoryPort,
                                  DeploymentRepositoryPort deploymentRepositoryPort,
                                  DeploymentStatusPublisherPort statusPublisherPort,
                                  GitPort gitPort,
                                  ContainerPort containerPort,
                                  List<DeploymentStep> steps,
                                  DeploymentLogWriter logWriter,
                                  NotificationTrigger notificationTrigger,
                                  StackpilotProperties properties) {
        this.gitRepositoryPort = gitRepositoryPort;
        this.deploymentRepositoryPort = deploymentRepositoryPort;
        this.statusPublisherPort = statusPublisherPort;
        this.gitPort = gitPort;
        this.containerPort = containerPort;
        this.steps = steps.stream()
                .sorted(Comparator.comparing(DeploymentStep::getType))
                .toList();
        this.logWriter = logWriter;
        this.notificationTrigger = notificationTrigger;
        this.settings = properties.getDeploy();
    }

    @Override
    public Deployment execute(DeploymentRequest request) {
        GitRepository repository = gitRepositoryPort.findById(request.repositoryId())
                .orElseThrow(() -> new RepositoryNotFoundException(request.repositoryId()));

        String targetHash = request.observedHash() != null ? request.observedHash() : repository.getLastCommitHash();
        Deployment deployment = deploymentRepositoryPort.create(repository.getId(), targetHash, request.trigger());
        Long deploymentId = deployment.getId();
        publishStatus(deploymentId, repository, DeploymentStatus.PENDING);

        deploymentRepositoryPort.markRunning(deploymentId, Instant.now());
        publishStatus(deploymentId, repository, DeploymentStatus.RUNNING);
        log.info("Deployment {} of {} started (trigger: {})", deploymentId, repository.getId(), request.trigger());

        DeploymentContext context = new DeploymentContext(repository, deploymentId, logWriter);
        DeploymentEvent event;

        try {
            if (isUpToDate(context)) {
                finish(deploymentId, repository, DeploymentStatus.SUCCESS, null, null);
                return reload(deployment);
            }

            for (DeploymentStep step : steps) {
                if (!step.appliesTo(repository)) {
                    continue;
                }
                context.setCurrentStep(step.getType());
                step.execute(context);
                if (step.getType() == DeploymentStepType.PULL && context.getDeployedCommitHash() != null) {
                    deploymentRepositoryPort.updateCommitHash(deploymentId, context.getDeployedCommitHash());
                }
            }

            pruneImagesIfEnabled(context);

            gitRepositoryPort.updateLastCommitHash(repository.getId(), context.getDeployedCommitHash());
            finish(deploymentId, repository, DeploymentStatus.SUCCESS, null, null);
            log.info("Deployment {} of {} succeeded at {}", deploymentId, repository.getId(),
                    context.getDeployedCommitHash());
            event = DeploymentEvent.SUCCESS;

        } catch (StackpilotException e) {
            log.error("Deployment {} of {} failed at {}: {}", deploymentId, repository.getId(),
                    context.getCurrentStep(), e.getMessage());
            context.log(context.getCurrentStep(), "FAILED [" + describe(e) + "] " + e.getMessage());
            finish(deploymentId, repository, DeploymentStatus.FAILED, e.getErrorCode(), e.getFailureKind());
            event = DeploymentEvent.FAILURE;

        } catch (RuntimeException e) {
            log.error("Deployment {} of {} crashed at {}", deploymentId, repository.getId(),
                    context.getCurrentStep(), e);
            context.log(context.getCurrentStep(), "FAILED [" + INTERNAL_ERROR_CODE + "] " + e.getMessage());
            finish(deploymentId, repository, DeploymentStatus.FAILED, INTERNAL_ERROR_CODE, null);
            event = DeploymentEvent.FAILURE;
        }

        Deployment finished = reload(deployment);
        notificationTrigger.fire(event, repository, finished);
        return finished;
    }

    /**
     * A repository already deployed at the remote tip needs no work, unless its stack was stopped
     * and redeploying stopped stacks is enabled.
     */
    private boolean isUpToDate(DeploymentContext context) {
        GitRepository repository = context.getRepository();
        String lastHash = repository.getLastCommitHash();

        if (lastHash == null || !Files.isDirectory(repository.localWorkingPath())) {
            context.log(DeploymentStepType.CHANGE_CHECK, "Initial deployment of " + repository.getId());
            return false;
        }

        String remoteHash = gitPort.remoteHash(repository.localWorkingPath(), repository.getBranch(),
                repository.getGitUrl(), repository.getToken());

        if (!Objects.equals(lastHash, remoteHash)) {
            deploymentRepositoryPort.updateCommitHash(context.getDeploymentId(), remoteHash);
            context.log(DeploymentStepType.CHANGE_CHECK, "New commit " + shortHash(lastHash) + " -> " + shortHash(remoteHash));
            return false;
        }

        if (settings.isRedeployStoppedStacks() && !isStackRunning(repository)) {
            context.log(DeploymentStepType.CHANGE_CHECK, "No changes but stack is not running, redeploying");
            return false;
        }

        context.log(DeploymentStepType.CHANGE_CHECK, "No changes (at " + shortHash(lastHash) + ")");
        return true;
    }

    private boolean isStackRunning(GitRepository repository) {
        try {
            return containerPort.isRunning(repository.composeProjectName());
        } catch (DockerOperationException e) {
            log.warn("Cannot inspect stack of {}, assuming it runs: {}", repository.getId(), e.getMessage());
            return true;
        }
    }

    private void pruneImagesIfEnabled(DeploymentContext context) {
        if (!settings.isPruneImages()) {
            return;
        }
        context.setCurrentStep(DeploymentStepType.PRUNE);
        try {
            context.log(DeploymentStepType.PRUNE, "Pruning unused images");
            containerPort.pruneImages();
            context.log(DeploymentStepType.PRUNE, "Unused images pruned");
        } catch (RuntimeException e) {
            log.warn("Image prune after deployment {} failed: {}", context.getDeploymentId(), e.getMessage());
            context.log(DeploymentStepType.PRUNE, "WARNING: image prune failed: " + e.getMessage());
        }
    }

    private void finish(Long deploymentId, GitRepository repository, DeploymentStatus status,
                        String errorCode, String failureKind) {
        deploymentRepositoryPort.finish(deploymentId, status, Instant.now(), errorCode, failureKind);
        publishStatus(deploymentId, repository, status);
    }

    private void publishStatus(Long deploymentId, GitRepository repository, DeploymentStatus status) {
        try {
            statusPublisherPort.publish(deploymentId, repository.getId(), status);
        } catch (RuntimeException e) {
            log.warn("Failed to publish status {} for deployment {}: {}", status, deploymentId, e.getMessage());
        }
    }

    private Deployment reload(Deployment deployment) {
        return deploymentRepositoryPort.findById(deployment.getId()).orElse(deployment);
    }

    private static String describe(StackpilotException e) {
        return e.getFailureKind() != null ? e.getErrorCode() + "/" + e.getFailureKind() : e.getErrorCode();
    }

    private static String shortHash(String hash) {
        return hash != null && hash.length() > 8 ? hash.substring(0, 8) : String.valueOf(hash);
    }
}
