package fr.imt.stackpilot.stackpilot.exception;

public enum ContainerFailureKind {
    NONZERO_EXIT,
    TIMEOUT,
    UNHEALTHY
}
