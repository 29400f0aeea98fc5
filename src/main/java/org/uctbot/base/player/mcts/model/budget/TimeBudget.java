package org.uctbot.base.player.mcts.model.budget;

import org.uctbot.base.player.mcts.exceptions.EmptyBudgetException;

import java.time.Duration;

/**
 * Runs iterations until the time limit has passed. The last iteration may overshoot the limit by its own cost.
 */
public class TimeBudget implements SearchBudget {

    public static final Duration DEFAULT_LIMIT = Duration.ofSeconds(1);

    private final Duration limit;

    public TimeBudget() {
        this(DEFAULT_LIMIT);
    }

    public TimeBudget(Duration limit) {
        if (limit == null || limit.isZero() || limit.isNegative()) {
            throw new EmptyBudgetException("Time budget must be positive: " + limit);
        }
        this.limit = limit;
    }

    @Override
    public boolean isExhausted(int completedIterations, long elapsedNanos) {
        return elapsedNanos > limit.toNanos();
    }

    public Duration getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return limit.toMillis() + " ms";
    }
}
