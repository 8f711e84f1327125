package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when a requested repository is not known.
 */
public class RepositoryNotFoundException extends StackpilotException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public RepositoryNotFoundException(String repositoryId) {
        super(ERROR_CODE, "Repository not found: " + repositoryId);
    }
}
