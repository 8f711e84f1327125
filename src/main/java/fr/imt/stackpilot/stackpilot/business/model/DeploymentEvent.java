package fr.imt.stackpilot.stackpilot.business.model;

import lombok.Getter;

@Getter
public enum DeploymentEvent {
    SUCCESS("success"),
    FAILURE("failure");

    private final String eventName;

    DeploymentEvent(String eventName) {
        this.eventName = eventName;
    }
}
