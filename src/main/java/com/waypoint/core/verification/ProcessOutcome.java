package com.waypoint.core.verification;

/**
 * Exit status and merged stdout/stderr of an external tool run.
 *
 * @param exitCode process exit code, {@code -1} when the run timed out
 * @param output   everything the process printed
 * @param timedOut true if the process was killed after exceeding its timeout
 */
public record ProcessOutcome(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
