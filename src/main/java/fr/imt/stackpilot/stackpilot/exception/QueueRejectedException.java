package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when the deployment queue refuses a request.
 */
public class QueueRejectedException extends StackpilotException {

    private static final String ERROR_CODE = "QUEUE_REJECTED";

    public enum Reason {
        ALREADY_PENDING,
        STOPPED
    }

    private final Reason reason;

    public QueueRejectedException(Reason reason, String repositoryId) {
        super(ERROR_CODE, "Deployment request for " + repositoryId + " rejected: " + reason);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getFailureKind() {
        return reason.name();
    }
}
