package com.fixforge.core.engine;

import com.fixforge.core.model.FixState;

/**
 * Observes one fix attempt in addition to the event bus. Called on the thread
 * running the attempt.
 */
public interface FixListener {

    FixListener NONE = new FixListener() {};

    default void onStatus(FixState state, String message) {}

    default void onOutput(String line) {}
}
