package com.waypoint.core.model;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Outcome of one model-checker run.
 *
 * @param outcome            what the checker reported
 * @param counterexampleText replayed trail for a violation, raw checker output for a setup
 *                           failure, {@code null} when the model passed
 * @param modelPath          the assembled model file that was checked
 */
public record VerificationResult(Outcome outcome, String counterexampleText, String modelPath)
        implements Serializable {

    public enum Outcome {
        PASSED,
        /** A trail was produced: the plan violates the property. */
        VIOLATION,
        /** The checker rejected the generated source or could not run. */
        SETUP_FAILURE
    }

    public static VerificationResult passed(Path modelPath) {
        return new VerificationResult(Outcome.PASSED, null, modelPath.toString());
    }

    public static VerificationResult violation(Path modelPath, String counterexample) {
        return new VerificationResult(Outcome.VIOLATION, counterexample, modelPath.toString());
    }

    public static VerificationResult setupFailure(Path modelPath, String checkerOutput) {
        return new VerificationResult(Outcome.SETUP_FAILURE, checkerOutput, modelPath.toString());
    }

    public boolean passed() {
        return outcome == Outcome.PASSED;
    }
}
