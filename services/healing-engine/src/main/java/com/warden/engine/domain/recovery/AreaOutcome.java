package com.warden.engine.domain.recovery;

import java.util.ArrayList;
import java.util.List;

/**
 * Combined outcome of one remediation area. Successful only if every step succeeded.
 */
public record AreaOutcome(boolean success, List<String> actions) {

    public AreaOutcome {
        actions = List.copyOf(actions);
    }

    public static AreaOutcome of(List<StepOutcome> steps) {
        boolean success = true;
        List<String> actions = new ArrayList<>();
        for (StepOutcome step : steps) {
            success &= step.success();
            if (step.message() != null) {
                actions.add(step.message());
            }
        }
        return new AreaOutcome(success, actions);
    }
}
