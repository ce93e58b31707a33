package com.omnifuzz.framework;

import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.RunStatus;

/**
 * Receives results as their slots are filled. Delivery follows availability,
 * not request number; consumers that need strict numeric order must buffer.
 */
public interface ResultListener {

    void onResult(AttackResult result);

    /** Called once, after the last result, when the run reaches a terminal state. */
    default void onRunFinished(RunStatus status) {
    }
}
