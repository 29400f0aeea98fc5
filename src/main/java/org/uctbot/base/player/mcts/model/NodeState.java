package org.uctbot.base.player.mcts.model;

/**
 * A tree node paired with the game state it stands for in the current iteration.
 */
public final class NodeState<S, A> {

    private final SearchTreeNode<A> node;
    private final S state;

    public NodeState(SearchTreeNode<A> node, S state) {
        this.node = node;
        this.state = state;
    }

    public SearchTreeNode<A> getNode() {
        return node;
    }

    public S getState() {
        return state;
    }
}
