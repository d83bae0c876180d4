package com.eavstore.actions;

/**
 * An action whose type is not replayable or whose params are malformed.
 */
public class InvalidActionException extends RuntimeException {

    private final transient Action action;

    public InvalidActionException(String message, Action action) {
        super(message + ": " + action);
        this.action = action;
    }

    public Action getAction() {
        return action;
    }
}
