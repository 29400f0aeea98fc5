package org.uctbot.base.player.mcts.exceptions;

/**
 * Thrown when a decision is requested for a state that has no move to choose, i.e. a terminal one.
 */
public class InvalidStateException extends SearchException {

    private final Object state;

    public InvalidStateException(Object state) {
        super("Cannot choose a move in terminal state " + state);
        this.state = state;
    }

    public Object getState() {
        return state;
    }
}
