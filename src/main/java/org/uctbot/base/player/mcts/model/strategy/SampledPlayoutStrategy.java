package org.uctbot.base.player.mcts.model.strategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.GameModel;
import org.uctbot.base.player.mcts.model.GameModels;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Playout in which the searching player looks one move ahead: every legal action is tried in a few short
 * random games, scored by {@link #getOutcome}, and the action with the best average is played.
 * The opponent keeps moving at random.
 *
 * <p>Costs roughly {@code samples} times the branching factor per ply of the searching player, so it
 * buys better playouts with fewer iterations.
 */
public class SampledPlayoutStrategy implements PlayoutStrategy {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final int DEFAULT_SAMPLES = 10;
    public static final int DEFAULT_MAX_DEPTH = 5;

    /** Weight of one point in a final tally, relative to one owned box. */
    public static final int POINTS_WEIGHT = 9;

    private final Random random;
    private final int samples;
    private final int maxDepth;

    public SampledPlayoutStrategy(Random random) {
        this(random, DEFAULT_SAMPLES, DEFAULT_MAX_DEPTH);
    }

    public SampledPlayoutStrategy(Random random, int samples, int maxDepth) {
        if (samples <= 0 || maxDepth < 0) {
            throw new IllegalArgumentException("Invalid sampling: " + samples + " samples, depth " + maxDepth);
        }
        this.random = random;
        this.samples = samples;
        this.maxDepth = maxDepth;
    }

    @Override
    public <S, A, P> S execute(GameModel<S, A, P> model, S state, P searchingPlayer)
            throws GameInterfaceViolationException {
        while (!GameModels.isTerminal(model, state)) {
            List<A> actions = GameModels.getLegalActions(model, state);
            A action;
            if (Objects.equals(GameModels.getCurrentPlayer(model, state), searchingPlayer)) {
                action = getBestAction(model, state, actions, searchingPlayer);
            } else {
                action = actions.get(random.nextInt(actions.size()));
            }
            state = GameModels.getNextState(model, state, action);
        }
        return state;
    }

    private <S, A, P> A getBestAction(GameModel<S, A, P> model, S state, List<A> actions, P searchingPlayer)
            throws GameInterfaceViolationException {
        A bestAction = actions.get(0);
        double bestExpectation = Double.NEGATIVE_INFINITY;

        for (A action : actions) {
            double totalScore = 0;
            for (int i = 0; i < samples; i++) {
                S sampleState = GameModels.getNextState(model, state, action);
                for (int depth = 0; depth < maxDepth && !GameModels.isTerminal(model, sampleState); depth++) {
                    List<A> sampleActions = GameModels.getLegalActions(model, sampleState);
                    A sampleAction = sampleActions.get(random.nextInt(sampleActions.size()));
                    sampleState = GameModels.getNextState(model, sampleState, sampleAction);
                }
                totalScore += getOutcome(model, sampleState, searchingPlayer);
            }

            double expectation = totalScore / samples;
            if (expectation > bestExpectation) {
                bestExpectation = expectation;
                bestAction = action;
            }
        }

        LOGGER.debug("Playout picking {} with expected score {}", bestAction, bestExpectation);
        return bestAction;
    }

    /**
     * Score of {@code player} minus the score of everybody else. Uses the point tally when the game has one,
     * otherwise counts owned boxes.
     */
    public static <S, A, P> double getOutcome(GameModel<S, A, P> model, S state, P player) {
        double ownScore = 0;
        double opponentScore = 0;

        Map<P, Integer> points = model.getPointsValues(state);
        if (points != null) {
            for (Map.Entry<P, Integer> entry : points.entrySet()) {
                double value = (double) entry.getValue() * POINTS_WEIGHT;
                if (Objects.equals(entry.getKey(), player)) {
                    ownScore += value;
                } else {
                    opponentScore += value;
                }
            }
        } else {
            for (P owner : model.getOwnedBoxes(state).values()) {
                if (owner == null) {
                    continue;
                }
                if (owner.equals(player)) {
                    ownScore++;
                } else {
                    opponentScore++;
                }
            }
        }
        return ownScore - opponentScore;
    }

    public int getSamples() {
        return samples;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
