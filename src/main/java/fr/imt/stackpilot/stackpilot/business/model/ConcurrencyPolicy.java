package fr.imt.stackpilot.stackpilot.business.model;

/**
 * How many workers the deployment queue dispatches to. Deployments of one project
 * stay serialized whatever the policy.
 */
public record ConcurrencyPolicy(Mode mode, int maxWorkers) {

    public enum Mode {
        SEQUENTIAL,
        PARALLEL
    }

    public ConcurrencyPolicy {
        if (mode == Mode.SEQUENTIAL) {
            maxWorkers = 1;
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
    }

    public static ConcurrencyPolicy sequential() {
        return new ConcurrencyPolicy(Mode.SEQUENTIAL, 1);
    }

    public static ConcurrencyPolicy parallel(int maxWorkers) {
        return new ConcurrencyPolicy(Mode.PARALLEL, maxWorkers);
    }
}
