package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.RequestPlan;

/**
 * Source of request plans for the scheduler's admission loop.
 */
public interface PlanSequence {

    /**
     * Produces the next plan, or null when the sequence is exhausted.
     *
     * @param previous result of the plan returned by the previous call; only
     *                 feedback sequences look at it (null on the first call)
     */
    RequestPlan next(AttackResult previous);

    /** Expected number of plans; may shrink for feedback sequences. */
    long expectedTotal();

    /** True when plan {@code j+1} depends on the result of plan {@code j}. */
    default boolean requiresFeedback() {
        return false;
    }

    /** The sequence matching the configuration's sources. */
    static PlanSequence forConfiguration(AttackConfiguration config) {
        return config.hasRecursiveSource()
                ? new RecursivePlanSequence(config)
                : new EnumeratedPlanSequence(config);
    }
}
