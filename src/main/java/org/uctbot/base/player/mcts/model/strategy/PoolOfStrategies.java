package org.uctbot.base.player.mcts.model.strategy;

import java.util.Random;

public class PoolOfStrategies {

    private final SelectionStrategy selectionStrategy;
    private final SelectionStrategyForMatch selectionStrategyForMatch;
    private final ExpansionStrategy expansionStrategy;
    private final PlayoutStrategy playoutStrategy;

    public PoolOfStrategies() {
        this(new Random());
    }

    public PoolOfStrategies(Random random) {
        this(new SelectionStrategy(), new SelectionStrategyForMatch(),
                new ExpansionStrategy(random), new RandomPlayoutStrategy(random));
    }

    public PoolOfStrategies(SelectionStrategy selectionStrategy,
                            SelectionStrategyForMatch selectionStrategyForMatch,
                            ExpansionStrategy expansionStrategy,
                            PlayoutStrategy playoutStrategy) {
        this.selectionStrategy = selectionStrategy;
        this.selectionStrategyForMatch = selectionStrategyForMatch;
        this.expansionStrategy = expansionStrategy;
        this.playoutStrategy = playoutStrategy;
    }

    public SelectionStrategy getSelectionStrategy() {
        return selectionStrategy;
    }

    public SelectionStrategyForMatch getSelectionStrategyForMatch() {
        return selectionStrategyForMatch;
    }

    public ExpansionStrategy getExpansionStrategy() {
        return expansionStrategy;
    }

    public PlayoutStrategy getPlayoutStrategy() {
        return playoutStrategy;
    }
}
