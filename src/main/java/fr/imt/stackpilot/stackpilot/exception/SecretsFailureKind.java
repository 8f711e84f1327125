package fr.imt.stackpilot.stackpilot.exception;

public enum SecretsFailureKind {
    MISSING_KEY,
    MALFORMED,
    BINARY_UNAVAILABLE,
    TIMEOUT
}
