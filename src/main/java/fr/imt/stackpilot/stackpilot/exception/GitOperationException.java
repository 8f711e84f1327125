package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a Git operation (clone, fetch, pull, rev-parse) fails.
 */
public class GitOperationException extends StackpilotException {

    private static final String ERROR_CODE = "GIT_ERR";

    private final GitFailureKind kind;

    public GitOperationException(GitFailureKind kind, String message) {
        super(ERROR_CODE, message);
        this.kind = kind;
    }

    public GitOperationException(GitFailureKind kind, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.kind = kind;
    }

    public GitFailureKind getKind() {
        return kind;
    }

    @Override
    public String getFailureKind() {
        return kind.name();
    }
}
