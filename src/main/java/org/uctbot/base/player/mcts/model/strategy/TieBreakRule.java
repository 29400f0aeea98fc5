package org.uctbot.base.player.mcts.model.strategy;

/**
 * Which of two equally scored candidates wins. Shared by tree descent and the final move choice.
 */
public enum TieBreakRule {

    /** Keep the candidate seen first. */
    FIRST {
        @Override
        public boolean prefers(double candidateScore, double bestScore) {
            return candidateScore > bestScore;
        }
    },

    /** Let a later candidate replace an equal one. */
    LAST {
        @Override
        public boolean prefers(double candidateScore, double bestScore) {
            return candidateScore >= bestScore;
        }
    };

    public abstract boolean prefers(double candidateScore, double bestScore);
}
