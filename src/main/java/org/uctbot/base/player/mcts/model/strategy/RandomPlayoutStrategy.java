package org.uctbot.base.player.mcts.model.strategy;

import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.model.GameModel;
import org.uctbot.base.player.mcts.model.GameModels;

import java.util.List;
import java.util.Random;

/**
 * Uniformly random moves for both sides until the game ends.
 */
public class RandomPlayoutStrategy implements PlayoutStrategy {

    private final Random random;

    public RandomPlayoutStrategy(Random random) {
        this.random = random;
    }

    @Override
    public <S, A, P> S execute(GameModel<S, A, P> model, S state, P searchingPlayer)
            throws GameInterfaceViolationException {
        while (!GameModels.isTerminal(model, state)) {
            List<A> actions = GameModels.getLegalActions(model, state);
            state = GameModels.getNextState(model, state, actions.get(random.nextInt(actions.size())));
        }
        return state;
    }
}
