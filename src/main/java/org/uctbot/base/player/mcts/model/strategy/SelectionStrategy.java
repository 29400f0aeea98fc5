package org.uctbot.base.player.mcts.model.strategy;

import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.CumulativeStatistics;
import org.uctbot.base.player.mcts.model.GameModel;
import org.uctbot.base.player.mcts.model.GameModels;
import org.uctbot.base.player.mcts.model.NodeState;
import org.uctbot.base.player.mcts.model.SearchTreeNode;

/**
 * UCT descent from the root to a frontier node, and propagation of playout results back up.
 */
public class SelectionStrategy {

    public static final double DEFAULT_EXPLORATION_BIAS = 2.0;

    private final double explorationBias;
    private final TieBreakRule tieBreakRule;

    public SelectionStrategy() {
        this(DEFAULT_EXPLORATION_BIAS, TieBreakRule.FIRST);
    }

    public SelectionStrategy(double explorationBias, TieBreakRule tieBreakRule) {
        if (!(explorationBias >= 0) || Double.isInfinite(explorationBias)) {
            throw new IllegalArgumentException("Exploration bias must be a non-negative number: " + explorationBias);
        }
        this.explorationBias = explorationBias;
        this.tieBreakRule = tieBreakRule;
    }

    /**
     * Walks down through fully expanded nodes, applying each chosen action to the state.
     *
     * @return the node where descent stopped, with the state reached there
     */
    public <S, A, P> NodeState<S, A> execute(GameModel<S, A, P> model, SearchTreeNode<A> root, S state)
            throws GameInterfaceViolationException {
        SearchTreeNode<A> node = root;
        while (node.isFullyExpanded()) {
            SearchTreeNode<A> selectedChild = getBestChild(node);
            if (selectedChild == null) {
                break;
            }
            state = GameModels.getNextState(model, state, selectedChild.getParentAction());
            node = selectedChild;
        }
        return new NodeState<>(node, state);
    }

    // Only a strictly positive score leads further down.
    private <A> SearchTreeNode<A> getBestChild(SearchTreeNode<A> node) {
        double bestScore = 0;
        SearchTreeNode<A> bestChild = null;
        for (SearchTreeNode<A> child : node.getChildren()) {
            double score = getScore(node.getStatistics(), child.getStatistics());
            if (score > 0 && tieBreakRule.prefers(score, bestScore)) {
                bestScore = score;
                bestChild = child;
            }
        }
        return bestChild;
    }

    public double getScore(CumulativeStatistics parent, CumulativeStatistics child) {
        return getExploitationScore(child) + getExplorationScore(parent, child);
    }

    private double getExploitationScore(CumulativeStatistics child) {
        return child.getWinRate();
    }

    private double getExplorationScore(CumulativeStatistics parent, CumulativeStatistics child) {
        return explorationBias * Math.sqrt(Math.log(parent.getNumVisits()) / child.getNumVisits());
    }

    public <A> void backPropagation(SearchTreeNode<A> node, boolean won) {
        for (SearchTreeNode<A> current = node; current != null; current = current.getParent()) {
            current.getStatistics().update(won);
        }
    }

    public double getExplorationBias() {
        return explorationBias;
    }

    public TieBreakRule getTieBreakRule() {
        return tieBreakRule;
    }
}
