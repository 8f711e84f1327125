package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a requested deployment record does not exist.
 */
public class DeploymentNotFoundException extends StackpilotException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public DeploymentNotFoundException(Long deploymentId) {
        super(ERROR_CODE, "Deployment not found: " + deploymentId);
    }
}
