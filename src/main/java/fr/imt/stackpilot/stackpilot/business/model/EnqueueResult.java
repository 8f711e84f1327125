package fr.imt.stackpilot.stackpilot.business.model;

public enum EnqueueResult {
    /** A new candidate was added to the queue. */
    ACCEPTED,
    /** A pending candidate for the same repository was replaced. */
    SUPERSEDED
}
