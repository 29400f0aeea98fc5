package org.uctbot.base.player.mcts.model.strategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.GameModel;
import org.uctbot.base.player.mcts.model.GameModels;
import org.uctbot.base.player.mcts.model.NodeState;
import org.uctbot.base.player.mcts.model.SearchTreeNode;

import java.util.List;
import java.util.Random;

public class ExpansionStrategy {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Random random;

    public ExpansionStrategy(Random random) {
        this.random = random;
    }

    /**
     * Adds one child for a randomly chosen untried action. Terminal and fully expanded nodes come back unchanged.
     */
    public <S, A, P> NodeState<S, A> execute(GameModel<S, A, P> model, SearchTreeNode<A> node, S state)
            throws GameInterfaceViolationException {
        if (!isNodeNeedExpanded(model, node, state)) {
            return new NodeState<>(node, state);
        }

        List<A> untriedActions = node.getUntriedActions();
        A action = untriedActions.get(random.nextInt(untriedActions.size()));
        S childState = GameModels.getNextState(model, state, action);
        SearchTreeNode<A> child = node.createChild(action, GameModels.getLegalActions(model, childState));
        LOGGER.trace("Expanded {} ({} untried left)", action, node.getUntriedActions().size());
        return new NodeState<>(child, childState);
    }

    private <S, A, P> boolean isNodeNeedExpanded(GameModel<S, A, P> model, SearchTreeNode<A> node, S state)
            throws GameInterfaceViolationException {
        return !GameModels.isTerminal(model, state) && !node.isFullyExpanded();
    }
}
