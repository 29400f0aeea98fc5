package org.uctbot.base.player.mcts.model.strategy;

import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.GameModel;

/**
 * Plays a sampled game from a state to its end.
 */
public interface PlayoutStrategy {

    /**
     * @param searchingPlayer the player the search is choosing a move for
     * @return the terminal state the playout reached
     */
    <S, A, P> S execute(GameModel<S, A, P> model, S state, P searchingPlayer) throws GameInterfaceViolationException;
}
