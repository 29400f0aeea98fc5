package org.uctbot.base.player.mcts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.event.TreeEvent;
import org.uctbot.base.player.mcts.event.TreeStartEvent;
import org.uctbot.base.player.mcts.exceptions.SearchException;
import org.uctbot.base.player.mcts.model.MonteCarloTreeSearch;
import org.uctbot.base.player.mcts.model.SearchTree;
import org.uctbot.base.util.observer.Event;
import org.uctbot.base.util.observer.Observer;
import org.uctbot.base.util.observer.Subject;

import java.util.ArrayList;
import java.util.List;

/**
 * Plays a match one move at a time, searching a fresh tree every turn and reporting each tree to its observers.
 */
public class MCTSPlayer<S, A, P> implements Subject {

    private static final Logger LOGGER = LogManager.getLogger();

    private final MonteCarloTreeSearch<S, A, P> search;
    private final List<Observer> observers = new ArrayList<>();
    private int turnCount = 0;

    public MCTSPlayer(MonteCarloTreeSearch<S, A, P> search) {
        this.search = search;
    }

    public void startMatch() {
        turnCount = 0;
        notifyObservers(new TreeStartEvent());
    }

    public A selectMove(S state) throws SearchException {
        LOGGER.info("Starting turn {}", turnCount);

        SearchTree<S, A, P> tree = search.search(state);
        A bestMove = MonteCarloTreeSearch.getChosenAction(tree);

        LOGGER.info("Processed {} iterations, and playing: {}", tree.getNumIterations(), bestMove);
        notifyObservers(new TreeEvent(tree, turnCount));
        turnCount++;
        return bestMove;
    }

    @Override
    public void addObserver(Observer observer) {
        observers.add(observer);
    }

    @Override
    public void notifyObservers(Event event) {
        for (Observer observer : observers) {
            observer.observe(event);
        }
    }

    public int getTurnCount() {
        return turnCount;
    }
}
