package com.waypoint.core.model;

/**
 * Why a phase did not succeed. All but {@link #COMPILATION_ERROR} and
 * {@link #RETRY_BUDGET_EXHAUSTED} are folded into the next generator prompt.
 */
public enum ErrorCategory {
    GENERATION_ERROR,
    COMPILATION_ERROR,
    CONSISTENCY_MISMATCH,
    VERIFICATION_SETUP_ERROR,
    VERIFICATION_VIOLATION,
    ARBITRATION_REJECTION,
    RETRY_BUDGET_EXHAUSTED,
    TRANSPORT_ERROR,
    /** The engine itself threw; the mission never reached a terminal phase. */
    INTERNAL_ERROR
}
