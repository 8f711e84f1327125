package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a notification cannot be delivered. Never fatal for a deployment.
 */
public class NotificationException extends StackpilotException {

    private static final String ERROR_CODE = "NOTIFY_ERR";

    public NotificationException(String message) {
        super(ERROR_CODE, message);
    }

    public NotificationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
