package org.uctbot.base.player.mcts.model.strategy;

import org.uctbot.base.player.mcts.model.SearchTreeNode;

/**
 * Picks the move actually played: the root child with the best win rate.
 */
public class SelectionStrategyForMatch {

    private final TieBreakRule tieBreakRule;

    public SelectionStrategyForMatch() {
        this(TieBreakRule.FIRST);
    }

    public SelectionStrategyForMatch(TieBreakRule tieBreakRule) {
        this.tieBreakRule = tieBreakRule;
    }

    /**
     * @return the chosen action, or {@code null} if the node has no children
     */
    public <A> A execute(SearchTreeNode<A> node) {
        double bestActionScore = Double.NEGATIVE_INFINITY;
        A bestAction = null;
        for (SearchTreeNode<A> child : node.getChildren()) {
            double actionScore = child.getStatistics().getWinRate();
            if (tieBreakRule.prefers(actionScore, bestActionScore)) {
                bestActionScore = actionScore;
                bestAction = child.getParentAction();
            }
        }
        return bestAction;
    }

    public TieBreakRule getTieBreakRule() {
        return tieBreakRule;
    }
}
