package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.ContainerPort;
import fr.imt.stackpilot.stackpilot.exception.ContainerExecutionException;
import fr.imt.stackpilot.stackpilot.exception.ContainerFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reconciles the compose stack. Output is streamed into the deployment log line by line.
 */
@Component
@RequiredArgsConstructor
public class ComposeUpStep implements DeploymentStep {

    private final ContainerPort containerPort;

    @Override
    public DeploymentStepType getType() {
        return DeploymentStepType.COMPOSE_UP;
    }

    @Override
    public void execute(DeploymentContext context) {
        GitRepository repository = context.getRepository();
        String composeProject = repository.composeProjectName();

        context.log(getType(), "Bringing up " + composeProject + " in " + repository.composeDirectory());
        int exitCode = containerPort.bringUp(repository.composeDirectory(), composeProject, context.output(getType()));

        if (exitCode != 0) {
            throw new ContainerExecutionException(ContainerFailureKind.NONZERO_EXIT,
                    "docker compose up exited with code " + exitCode);
        }
        context.log(getType(), "Stack " + composeProject + " is up");
    }
}
