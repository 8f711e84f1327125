package fr.imt.stackpilot.stackpilot.business.model;

public enum TriggerResult {
    ACCEPTED,
    ALREADY_PENDING
}
