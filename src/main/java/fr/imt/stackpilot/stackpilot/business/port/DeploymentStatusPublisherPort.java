package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;

public interface DeploymentStatusPublisherPort {
    void publish(Long deploymentId, String repositoryId, DeploymentStatus status);
}
