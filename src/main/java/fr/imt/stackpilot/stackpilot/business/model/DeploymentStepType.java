package fr.imt.stackpilot.stackpilot.business.model;

import lombok.Getter;

@Getter
public enum DeploymentStepType {
    CHANGE_CHECK("CHANGE_CHECK"),
    PULL("PULL"),
    DECRYPT("DECRYPT"),
    COMPOSE_UP("COMPOSE_UP"),
    HEALTHCHECK("HEALTHCHECK"),
    PRUNE("PRUNE"),
    NOTIFY("NOTIFY");

    private final String stepName;

    DeploymentStepType(String stepName) {
        this.stepName = stepName;
    }

    /**
     * Prefix used for every deployment log line written by this step.
     */
    public String getLabel() {
        return "[" + stepName + "]";
    }
}
