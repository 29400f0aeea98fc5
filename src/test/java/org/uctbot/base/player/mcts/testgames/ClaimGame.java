package org.uctbot.base.player.mcts.testgames;

import org.uctbot.base.player.mcts.model.GameModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Players "red" and "blue" claim one to three free cells in turn until the row is full.
 * The player with fewer cells is reported as the one to move at the end.
 */
public class ClaimGame implements GameModel<ClaimGame.State, Integer, String> {

    public static final String RED = "red";
    public static final String BLUE = "blue";

    public static State start(int cells, String firstPlayer) {
        return new State(new String[cells], firstPlayer);
    }

    @Override
    public List<Integer> getLegalActions(State state) {
        List<Integer> actions = new ArrayList<>();
        for (int take = 1; take <= Math.min(3, state.getFreeCells()); take++) {
            actions.add(take);
        }
        return actions;
    }

    @Override
    public State getNextState(State state, Integer action) {
        if (action < 1 || action > Math.min(3, state.getFreeCells())) {
            throw new IllegalArgumentException("Cannot claim " + action);
        }
        String[] owners = state.owners.clone();
        int claimed = 0;
        for (int i = 0; i < owners.length && claimed < action; i++) {
            if (owners[i] == null) {
                owners[i] = state.toMove;
                claimed++;
            }
        }
        return new State(owners, opponent(state.toMove));
    }

    @Override
    public String getCurrentPlayer(State state) {
        if (!isTerminal(state)) {
            return state.toMove;
        }
        return state.count(RED) >= state.count(BLUE) ? BLUE : RED;
    }

    @Override
    public boolean isTerminal(State state) {
        return state.getFreeCells() == 0;
    }

    @Override
    public Map<?, String> getOwnedBoxes(State state) {
        Map<Integer, String> owned = new LinkedHashMap<>();
        for (int i = 0; i < state.owners.length; i++) {
            if (state.owners[i] != null) {
                owned.put(i, state.owners[i]);
            }
        }
        return owned;
    }

    public static String opponent(String player) {
        return RED.equals(player) ? BLUE : RED;
    }

    public static final class State {
        private final String[] owners;
        private final String toMove;

        State(String[] owners, String toMove) {
            this.owners = owners;
            this.toMove = toMove;
        }

        public int getFreeCells() {
            int free = 0;
            for (String owner : owners) {
                if (owner == null) {
                    free++;
                }
            }
            return free;
        }

        public int count(String player) {
            int count = 0;
            for (String owner : owners) {
                if (player.equals(owner)) {
                    count++;
                }
            }
            return count;
        }

        public List<String> getOwners() {
            return Collections.unmodifiableList(Arrays.asList(owners));
        }

        @Override
        public String toString() {
            return Arrays.toString(owners) + ", " + toMove + " to move";
        }
    }
}
