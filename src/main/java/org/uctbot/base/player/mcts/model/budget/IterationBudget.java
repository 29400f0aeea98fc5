package org.uctbot.base.player.mcts.model.budget;

import org.uctbot.base.player.mcts.exceptions.EmptyBudgetException;

public class IterationBudget implements SearchBudget {

    public static final int DEFAULT_ITERATIONS = 1000;

    private final int maxIterations;

    public IterationBudget() {
        this(DEFAULT_ITERATIONS);
    }

    public IterationBudget(int maxIterations) {
        if (maxIterations <= 0) {
            throw new EmptyBudgetException("Iteration budget must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public boolean isExhausted(int completedIterations, long elapsedNanos) {
        return completedIterations >= maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    public String toString() {
        return maxIterations + " iterations";
    }
}
