package org.uctbot.base.player.mcts.model;

import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;

import java.util.List;

/**
 * Calls into a {@link GameModel} that check the answers for consistency before the search relies on them.
 */
public final class GameModels {

    private GameModels() {
    }

    public static <S, A, P> List<A> getLegalActions(GameModel<S, A, P> model, S state)
            throws GameInterfaceViolationException {
        List<A> actions;
        boolean terminal;
        try {
            actions = model.getLegalActions(state);
            terminal = model.isTerminal(state);
        } catch (RuntimeException e) {
            throw new GameInterfaceViolationException("Game model failed on state " + state, e);
        }
        if (actions == null) {
            throw new GameInterfaceViolationException("No action list for state " + state);
        }
        if (actions.isEmpty() != terminal) {
            throw new GameInterfaceViolationException(terminal
                    ? "Terminal state " + state + " reports legal actions " + actions
                    : "Non-terminal state " + state + " reports no legal actions");
        }
        return actions;
    }

    public static <S, A, P> S getNextState(GameModel<S, A, P> model, S state, A action)
            throws GameInterfaceViolationException {
        S next;
        try {
            next = model.getNextState(state, action);
        } catch (RuntimeException e) {
            throw new GameInterfaceViolationException("Game model rejected action " + action + " in state " + state, e);
        }
        if (next == null) {
            throw new GameInterfaceViolationException("No next state for action " + action + " in state " + state);
        }
        return next;
    }

    public static <S, A, P> P getCurrentPlayer(GameModel<S, A, P> model, S state)
            throws GameInterfaceViolationException {
        try {
            return model.getCurrentPlayer(state);
        } catch (RuntimeException e) {
            throw new GameInterfaceViolationException("Game model failed on state " + state, e);
        }
    }

    public static <S, A, P> boolean isTerminal(GameModel<S, A, P> model, S state)
            throws GameInterfaceViolationException {
        try {
            return model.isTerminal(state);
        } catch (RuntimeException e) {
            throw new GameInterfaceViolationException("Game model failed on state " + state, e);
        }
    }
}
