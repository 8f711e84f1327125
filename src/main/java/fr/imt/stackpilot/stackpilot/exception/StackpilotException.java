package fr.imt.stackpilot.stackpilot.exception;

/**
 * Base exception class for all Stackpilot domain exceptions.
 * Provides structured error handling with error codes for deployment logs and API responses.
 */
public class StackpilotException extends RuntimeException {

    private final String errorCode;

    public StackpilotException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StackpilotException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Finer-grained failure kind recorded next to the error code, e.g. {@code AUTH} for a Git failure.
     */
    public String getFailureKind() {
        return null;
    }
}
