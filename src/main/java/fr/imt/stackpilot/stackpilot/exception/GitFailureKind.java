package fr.imt.stackpilot.stackpilot.exception;

public enum GitFailureKind {
    AUTH,
    NETWORK,
    CONFLICT,
    CORRUPTED
}
