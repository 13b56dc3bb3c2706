package com.warden.engine.domain.recovery;

/**
 * Result of one remediation sub-step.
 *
 * @param message action line for the recovery result, or null when the step has nothing to report
 */
public record StepOutcome(boolean success, String message) {

    public static StepOutcome done(String message) {
        return new StepOutcome(true, message);
    }

    /** A successful step that performed no reportable action. */
    public static StepOutcome quiet() {
        return new StepOutcome(true, null);
    }

    public static StepOutcome failed(String message) {
        return new StepOutcome(false, message);
    }
}
