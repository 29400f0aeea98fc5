package org.uctbot.base.player.mcts.model.budget;

/**
 * Stopping rule of the search loop. Checked between iterations only, so a running iteration always completes.
 */
public interface SearchBudget {

    /**
     * @param completedIterations iterations finished so far
     * @param elapsedNanos time since the loop started
     */
    boolean isExhausted(int completedIterations, long elapsedNanos);
}
