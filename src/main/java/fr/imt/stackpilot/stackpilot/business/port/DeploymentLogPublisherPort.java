package fr.imt.stackpilot.stackpilot.business.port;

public interface DeploymentLogPublisherPort {
    void publish(Long deploymentId, String message);
}
