package org.uctbot.base.player.mcts.exceptions;

/**
 * Base class of the structural failures a search can report. Nothing here is transient,
 * so callers should not retry.
 */
public class SearchException extends Exception {

    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
