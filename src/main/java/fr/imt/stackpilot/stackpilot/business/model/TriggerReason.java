package fr.imt.stackpilot.stackpilot.business.model;

public enum TriggerReason {
    POLL,
    MANUAL
}
