package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;

/**
 * Runs one admitted deployment request to a terminal state.
 */
@FunctionalInterface
public interface DeploymentExecutor {

    Deployment execute(DeploymentRequest request);

}
