package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a compose stack cannot be brought up or does not become healthy.
 */
public class ContainerExecutionException extends StackpilotException {

    private static final String ERROR_CODE = "CONTAINER_ERR";

    private final ContainerFailureKind kind;

    public ContainerExecutionException(ContainerFailureKind kind, String message) {
        super(ERROR_CODE, message);
        this.kind = kind;
    }

    public ContainerExecutionException(ContainerFailureKind kind, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.kind = kind;
    }

    public ContainerFailureKind getKind() {
        return kind;
    }

    @Override
    public String getFailureKind() {
        return kind.name();
    }
}
