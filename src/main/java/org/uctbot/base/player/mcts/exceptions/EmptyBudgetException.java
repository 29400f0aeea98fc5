package org.uctbot.base.player.mcts.exceptions;

public class EmptyBudgetException extends IllegalArgumentException {

    public EmptyBudgetException(String message) {
        super(message);
    }
}
