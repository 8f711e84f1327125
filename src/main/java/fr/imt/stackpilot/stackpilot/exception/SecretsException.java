package fr.imt.stackpilot.stackpilot.exception;

/**
 * Exception thrown when an encrypted environment file cannot be decrypted.
 */
public class SecretsException extends StackpilotException {

    private static final String ERROR_CODE = "SECRETS_ERR";

    private final SecretsFailureKind kind;

    public SecretsException(SecretsFailureKind kind, String message) {
        super(ERROR_CODE, message);
        this.kind = kind;
    }

    public SecretsException(SecretsFailureKind kind, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.kind = kind;
    }

    public SecretsFailureKind getKind() {
        return kind;
    }

    @Override
    public String getFailureKind() {
        return kind.name();
    }
}
