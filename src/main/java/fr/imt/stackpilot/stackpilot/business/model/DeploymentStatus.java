package fr.imt.stackpilot.stackpilot.business.model;

/**
 * Lifecycle of a deployment record: {@code PENDING -> RUNNING -> SUCCESS | FAILED}.
 */
public enum DeploymentStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
