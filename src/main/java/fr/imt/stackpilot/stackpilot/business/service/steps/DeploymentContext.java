package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.service.DeploymentLogWriter;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.Getter;
import lombok.Setter;

import java.util.function.Consumer;

/**
 * State shared by the steps of a single deployment run.
 */
@Getter
public class DeploymentContext {

    private final GitRepository repository;
    private final Long deploymentId;
    private final DeploymentLogWriter logWriter;

    @Setter
    private DeploymentStepType currentStep = DeploymentStepType.CHANGE_CHECK;

    // Commit checked out by the pull step
    @Setter
    private String deployedCommitHash;

    public DeploymentContext(GitRepository repository, Long deploymentId, DeploymentLogWriter logWriter) {
        this.repository = repository;
        this.deploymentId = deploymentId;
        this.logWriter = logWriter;
    }

    public void log(DeploymentStepType step, String message) {
        logWriter.append(deploymentId, step, message);
    }

    public Consumer<String> output(DeploymentStepType step) {
        return logWriter.streamFor(deploymentId, step);
    }
}
