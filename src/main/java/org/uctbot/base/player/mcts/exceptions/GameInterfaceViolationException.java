package org.uctbot.base.player.mcts.exceptions;

/**
 * Thrown when a {@link org.uctbot.base.player.mcts.model.GameModel} answers inconsistently,
 * for example reporting no legal actions for a state it does not consider terminal.
 */
public class GameInterfaceViolationException extends SearchException {

    public GameInterfaceViolationException(String message) {
        super(message);
    }

    public GameInterfaceViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
