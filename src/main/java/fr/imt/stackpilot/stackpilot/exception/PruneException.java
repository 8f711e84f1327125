package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when pruning unused images fails. Never fatal for a deployment.
 */
public class PruneException extends StackpilotException {

    private static final String ERROR_CODE = "PRUNE_ERR";

    public PruneException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
