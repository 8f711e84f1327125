package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;

/**
 * One stage of the deployment chain. A step signals failure by throwing a
 * {@link fr.imt.stackpilot.stackpilot.exception.StackpilotException}; later steps then never run.
 */
public interface DeploymentStep {

    DeploymentStepType getType();

    default boolean appliesTo(GitRepository repository) {
        return true;
    }

    void execute(DeploymentContext context);

}
