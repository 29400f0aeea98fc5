package org.uctbot.base.player.mcts.event;

import org.uctbot.base.player.mcts.model.SearchTree;
import org.uctbot.base.util.observer.Event;

public class TreeEvent extends Event {

    private final SearchTree<?, ?, ?> tree;
    private final int turnNumber;

    public TreeEvent(SearchTree<?, ?, ?> tree, int turnNumber) {
        this.tree = tree;
        this.turnNumber = turnNumber;
    }

    public SearchTree<?, ?, ?> getTree() {
        return tree;
    }

    public int getTurnNumber() {
        return turnNumber;
    }
}
