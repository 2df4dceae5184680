package com.fixforge.core.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle state of a managed repository {@link Task}.
 * <p>
 * Allowed transitions are encoded as data; edges leaving COMPLETED and ERROR
 * start a fresh caller-initiated run.
 */
public enum TaskState {
    PENDING,
    CLONING,
    CLONED,
    REVIEWING,
    FIXING,
    COMPLETED,
    ERROR;

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = new EnumMap<>(TaskState.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(CLONING, ERROR));
        TRANSITIONS.put(CLONING, EnumSet.of(CLONED, ERROR));
        TRANSITIONS.put(CLONED, EnumSet.of(CLONING, REVIEWING, FIXING, ERROR));
        TRANSITIONS.put(REVIEWING, EnumSet.of(COMPLETED, ERROR));
        TRANSITIONS.put(FIXING, EnumSet.of(COMPLETED, ERROR));
        TRANSITIONS.put(COMPLETED, EnumSet.of(CLONING, FIXING));
        TRANSITIONS.put(ERROR, EnumSet.of(CLONING, FIXING));
    }

    public boolean canTransitionTo(TaskState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /** True while a clone, review or fix attempt owns the task's checkout. */
    public boolean isInFlight() {
        return this == CLONING || this == REVIEWING || this == FIXING;
    }

    /**
     * State a task persisted in this state presents after a restart.
     * In-flight work never survives the process that started it.
     */
    public TaskState recovered(boolean hasLocalPath) {
        if (!isInFlight()) {
            return this;
        }
        return hasLocalPath ? CLONED : PENDING;
    }

    /** Lower-case wire value used in the persisted task document. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TaskState> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
