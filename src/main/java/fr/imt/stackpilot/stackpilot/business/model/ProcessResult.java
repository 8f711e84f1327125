package fr.imt.stackpilot.stackpilot.business.model;

/**
 * Outcome of an external process.
 *
 * @param exitCode exit status, {@code -1} when the process was killed on timeout
 * @param output   tail of the combined output
 * @param timedOut whether the process exceeded its time budget and was killed
 */
public record ProcessResult(int exitCode, String output, boolean timedOut) {

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
