package org.uctbot.base.player.mcts.model;

import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.strategy.PoolOfStrategies;

import java.util.Objects;

/**
 * The tree built for a single decision. It is thrown away once the move is chosen.
 */
public class SearchTree<S, A, P> {

    private final GameModel<S, A, P> gameModel;
    private final PoolOfStrategies strategies;

    private final S rootState;
    private final P searchingPlayer;
    private final SearchTreeNode<A> root;

    private int numIterations;

    public SearchTree(GameModel<S, A, P> gameModel, S rootState, PoolOfStrategies strategies)
            throws GameInterfaceViolationException {
        this.gameModel = gameModel;
        this.strategies = strategies;
        this.rootState = rootState;
        searchingPlayer = GameModels.getCurrentPlayer(gameModel, rootState);
        root = new SearchTreeNode<>(null, null, GameModels.getLegalActions(gameModel, rootState));
        numIterations = 0;
    }

    /**
     * Runs one iteration: selection, expansion, playout and back-propagation.
     */
    public void grow() throws GameInterfaceViolationException {

        // States are values, so every iteration can start from the root state itself
        NodeState<S, A> selected = strategies.getSelectionStrategy().execute(gameModel, root, rootState);

        NodeState<S, A> expanded = selected;
        if (!selected.getNode().isFullyExpanded()) {
            expanded = strategies.getExpansionStrategy().execute(gameModel, selected.getNode(), selected.getState());
        }

        S terminalState = strategies.getPlayoutStrategy().execute(gameModel, expanded.getState(), searchingPlayer);

        // Whoever is left to move at the end has lost
        boolean won = !Objects.equals(GameModels.getCurrentPlayer(gameModel, terminalState), searchingPlayer);
        strategies.getSelectionStrategy().backPropagation(expanded.getNode(), won);
        numIterations++;
    }

    /**
     * @return the action to play, or {@code null} if nothing has been expanded yet
     */
    public A getBestAction() {
        return strategies.getSelectionStrategyForMatch().execute(root);
    }

    public SearchTreeNode<A> getRoot() {
        return root;
    }

    public S getRootState() {
        return rootState;
    }

    public P getSearchingPlayer() {
        return searchingPlayer;
    }

    public int getNumIterations() {
        return numIterations;
    }

    public GameModel<S, A, P> getGameModel() {
        return gameModel;
    }

    public PoolOfStrategies getStrategies() {
        return strategies;
    }
}
