package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a Docker daemon query (logs, container listing) fails.
 */
public class DockerOperationException extends StackpilotException {

    private static final String ERROR_CODE = "DOCKER_ERR";

    public DockerOperationException(String operation, Throwable cause) {
        super(ERROR_CODE, "Docker operation failed: " + operation, cause);
    }

    public DockerOperationException(String message) {
        super(ERROR_CODE, message);
    }
}
