package org.uctbot.base.player.mcts.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A position in the search tree. The position itself is not stored: it is rebuilt by replaying the
 * actions on the path from the root.
 */
public class SearchTreeNode<A> {

    private final SearchTreeNode<A> parent;
    private final A parentAction;

    private final Map<A, SearchTreeNode<A>> children;
    private final List<A> untriedActions;

    private final CumulativeStatistics statistics;

    public SearchTreeNode(SearchTreeNode<A> parent, A parentAction, List<A> legalActions) {
        this.parent = parent;
        this.parentAction = parentAction;
        children = new LinkedHashMap<>();
        untriedActions = new ArrayList<>(legalActions);
        statistics = new CumulativeStatistics();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isFullyExpanded() {
        return untriedActions.isEmpty();
    }

    public SearchTreeNode<A> getParent() {
        return parent;
    }

    public A getParentAction() {
        return parentAction;
    }

    public SearchTreeNode<A> getChild(A action) {
        return children.get(action);
    }

    public Collection<SearchTreeNode<A>> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public List<A> getUntriedActions() {
        return Collections.unmodifiableList(untriedActions);
    }

    /**
     * Moves an untried action into the children map.
     */
    public SearchTreeNode<A> createChild(A action, List<A> childLegalActions) {
        if (!untriedActions.remove(action)) {
            throw new IllegalArgumentException("Action " + action + " is not untried here");
        }
        SearchTreeNode<A> child = new SearchTreeNode<>(this, action, childLegalActions);
        children.put(action, child);
        return child;
    }

    public CumulativeStatistics getStatistics() {
        return statistics;
    }
}
