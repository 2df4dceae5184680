package com.fixforge.core.model;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * States of one fix attempt. Progression is strictly forward; ERROR is
 * reachable from every non-terminal state and both COMPLETED and ERROR absorb.
 */
public enum FixState {
    PENDING,
    BRANCHING,
    FIXING,
    REVIEWING,
    DIFF_READY,
    COMMITTING,
    PUSHING,
    CREATING_PR,
    COMPLETED,
    ERROR;

    private static final Map<FixState, FixState> SUCCESSORS = new EnumMap<>(FixState.class);

    static {
        SUCCESSORS.put(PENDING, BRANCHING);
        SUCCESSORS.put(BRANCHING, FIXING);
        SUCCESSORS.put(FIXING, REVIEWING);
        SUCCESSORS.put(REVIEWING, DIFF_READY);
        SUCCESSORS.put(DIFF_READY, COMMITTING);
        SUCCESSORS.put(COMMITTING, PUSHING);
        SUCCESSORS.put(PUSHING, CREATING_PR);
        SUCCESSORS.put(CREATING_PR, COMPLETED);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public boolean canTransitionTo(FixState next) {
        if (isTerminal()) {
            return false;
        }
        return next == ERROR || next == SUCCESSORS.get(this);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
