package org.uctbot.base.player.mcts.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rules of a two-player, turn-based game with perfect information.
 *
 * <p>States are treated as values: {@link #getNextState} must return a new state and leave its
 * argument untouched, so the search can hand the same state to several samples.
 *
 * @param <S> game state
 * @param <A> action
 * @param <P> player identity
 */
public interface GameModel<S, A, P> {

    /**
     * @return every action available to the player to move; empty if and only if the state is terminal.
     */
    List<A> getLegalActions(S state);

    S getNextState(S state, A action);

    /**
     * @return the player to move. In a terminal state this is the player who would move next,
     * which the search counts as the loser.
     */
    P getCurrentPlayer(S state);

    boolean isTerminal(S state);

    /**
     * Ownership of board cells, used only to score heuristic playouts.
     */
    default Map<?, P> getOwnedBoxes(S state) {
        return Collections.emptyMap();
    }

    /**
     * Final point tally per player, or {@code null} if the game keeps none (yet).
     */
    default Map<P, Integer> getPointsValues(S state) {
        return null;
    }
}
