package org.uctbot.base.player.mcts.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.exceptions.InvalidStateException;
import org.uctbot.base.player.mcts.exceptions.SearchException;
import org.uctbot.base.player.mcts.model.budget.IterationBudget;
import org.uctbot.base.player.mcts.model.budget.SearchBudget;
import org.uctbot.base.player.mcts.model.strategy.PoolOfStrategies;

import java.util.concurrent.TimeUnit;

/**
 * Chooses a move for the player to move by growing a fresh {@link SearchTree} until the budget runs out.
 */
public class MonteCarloTreeSearch<S, A, P> {

    private static final Logger LOGGER = LogManager.getLogger();

    private final GameModel<S, A, P> model;
    private final SearchBudget searchBudget;
    private final PoolOfStrategies strategies;

    public MonteCarloTreeSearch(GameModel<S, A, P> model) {
        this(model, new IterationBudget(), new PoolOfStrategies());
    }

    public MonteCarloTreeSearch(GameModel<S, A, P> model, SearchBudget searchBudget, PoolOfStrategies strategies) {
        this.model = model;
        this.searchBudget = searchBudget;
        this.strategies = strategies;
    }

    public A decide(S startState) throws SearchException {
        SearchTree<S, A, P> tree = search(startState);
        A bestMove = getChosenAction(tree);
        LOGGER.info("Processed {} iterations, and playing: {}", tree.getNumIterations(), bestMove);
        return bestMove;
    }

    /**
     * Builds and returns the tree for {@code startState}.
     *
     * @throws InvalidStateException if the state is terminal
     */
    public SearchTree<S, A, P> search(S startState) throws SearchException {
        if (GameModels.isTerminal(model, startState)) {
            throw new InvalidStateException(startState);
        }

        SearchTree<S, A, P> tree = new SearchTree<>(model, startState, strategies);
        long start = System.nanoTime();
        while (!searchBudget.isExhausted(tree.getNumIterations(), System.nanoTime() - start)) {
            tree.grow();
        }

        LOGGER.debug("Processed {} iterations in {} ms within budget of {}", tree.getNumIterations(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), searchBudget);
        return tree;
    }

    public static <S, A, P> A getChosenAction(SearchTree<S, A, P> tree) throws SearchException {
        A action = tree.getBestAction();
        if (action == null) {
            throw new GameInterfaceViolationException("Search budget ran out before any move was expanded");
        }
        return action;
    }

    public GameModel<S, A, P> getModel() {
        return model;
    }

    public SearchBudget getSearchBudget() {
        return searchBudget;
    }

    public PoolOfStrategies getStrategies() {
        return strategies;
    }
}
