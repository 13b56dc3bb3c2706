package com.warden.engine.domain.recovery;

import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs remediation sub-steps so that none of them can throw.
 */
public final class RemediationSteps {

    private static final Logger log = LoggerFactory.getLogger(RemediationSteps.class);

    private RemediationSteps() {
    }

    /**
     * Runs {@code step}. An exception becomes a failed outcome reading {@code "Failed to
     * <description>: <message>"}.
     *
     * @param description what the step does, e.g. {@code "retry failed jobs"}
     */
    public static StepOutcome attempt(String description, Callable<StepOutcome> step) {
        try {
            StepOutcome outcome = step.call();
            if (outcome == null) {
                return StepOutcome.quiet();
            }
            if (outcome.message() != null) {
                log.info("Remediation: {}", outcome.message());
            }
            return outcome;
        } catch (Exception e) {
            String message = "Failed to " + description + ": " + e.getMessage();
            log.error(message, e);
            return StepOutcome.failed(message);
        }
    }
}
