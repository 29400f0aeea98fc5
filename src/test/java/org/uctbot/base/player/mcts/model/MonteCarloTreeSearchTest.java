package org.uctbot.base.player.mcts.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.uctbot.base.player.mcts.exceptions.GameInterfaceViolationException;
import org.uctbot.base.player.mcts.exceptions.InvalidStateException;
import org.uctbot.base.player.mcts.model.budget.IterationBudget;
import org.uctbot.base.player.mcts.model.budget.TimeBudget;
import org.uctbot.base.player.mcts.model.strategy.ExpansionStrategy;
import org.uctbot.base.player.mcts.model.strategy.PoolOfStrategies;
import org.uctbot.base.player.mcts.model.strategy.SampledPlayoutStrategy;
import org.uctbot.base.player.mcts.model.strategy.SelectionStrategy;
import org.uctbot.base.player.mcts.model.strategy.SelectionStrategyForMatch;
import org.uctbot.base.player.mcts.testgames.BrokenGame;
import org.uctbot.base.player.mcts.testgames.ClaimGame;
import org.uctbot.base.player.mcts.testgames.NimGame;
import org.uctbot.base.player.mcts.testgames.SingleMoveGame;
import org.uctbot.base.player.mcts.testgames.TicketGame;

class MonteCarloTreeSearchTest {

    private final NimGame nim = new NimGame();

    private <S, A, P> MonteCarloTreeSearch<S, A, P> searchOf(GameModel<S, A, P> model, int iterations, long seed) {
        return new MonteCarloTreeSearch<>(model, new IterationBudget(iterations), new PoolOfStrategies(new Random(seed)));
    }

    @Test
    void singleLegalMoveIsAlwaysReturned() throws Exception {
        for (int iterations : new int[] {1, 2, 50}) {
            assertEquals("only", searchOf(new SingleMoveGame(), iterations, 1).decide(SingleMoveGame.START));
        }
    }

    @Test
    void terminalStateIsRejected() {
        MonteCarloTreeSearch<Integer, String, String> search = searchOf(new SingleMoveGame(), 10, 1);

        InvalidStateException e = assertThrows(InvalidStateException.class, () -> search.decide(SingleMoveGame.END));
        assertEquals(SingleMoveGame.END, e.getState());
    }

    @Test
    void iterationBudgetRunsExactlyThatManyIterations() throws Exception {
        SearchTree<NimGame.State, Integer, Integer> tree = searchOf(nim, 137, 2).search(NimGame.start(15));

        assertEquals(137, tree.getNumIterations());
        assertEquals(137, tree.getRoot().getStatistics().getNumVisits());
    }

    @Test
    void timeBudgetRunsAtLeastTheLimit() throws Exception {
        MonteCarloTreeSearch<NimGame.State, Integer, Integer> search = new MonteCarloTreeSearch<>(nim,
                new TimeBudget(Duration.ofMillis(50)), new PoolOfStrategies(new Random(3)));

        long start = System.nanoTime();
        SearchTree<NimGame.State, Integer, Integer> tree = search.search(NimGame.start(15));
        long elapsed = System.nanoTime() - start;

        assertTrue(elapsed >= Duration.ofMillis(50).toNanos(), "stopped after " + elapsed + " ns");
        assertTrue(tree.getNumIterations() > 0);
        assertEquals(tree.getNumIterations(), tree.getRoot().getStatistics().getNumVisits());
    }

    @Test
    void countsStayMonotoneThroughoutTheTree() throws Exception {
        SearchTree<NimGame.State, Integer, Integer> tree = searchOf(nim, 2000, 4).search(NimGame.start(12));

        List<SearchTreeNode<Integer>> pending = new ArrayList<>();
        pending.add(tree.getRoot());
        while (!pending.isEmpty()) {
            SearchTreeNode<Integer> node = pending.remove(pending.size() - 1);
            CumulativeStatistics statistics = node.getStatistics();
            assertTrue(statistics.getNumWins() <= statistics.getNumVisits());
            for (SearchTreeNode<Integer> child : node.getChildren()) {
                assertTrue(child.getStatistics().getNumVisits() >= 1);
                assertTrue(child.getStatistics().getNumVisits() <= statistics.getNumVisits());
                assertFalse(node.getUntriedActions().contains(child.getParentAction()));
                pending.add(child);
            }
        }
    }

    @Test
    void everyRootActionIsExpandedExactlyOnce() throws Exception {
        SearchTree<NimGame.State, Integer, Integer> tree = searchOf(nim, 300, 5).search(NimGame.start(10));

        SearchTreeNode<Integer> root = tree.getRoot();
        assertTrue(root.isFullyExpanded());
        assertEquals(3, root.getChildren().size());
        List<Integer> actions = new ArrayList<>();
        for (SearchTreeNode<Integer> child : root.getChildren()) {
            actions.add(child.getParentAction());
        }
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3)), new HashSet<>(actions));
    }

    @Test
    void sameSeedBuildsTheSameTree() throws Exception {
        SearchTree<NimGame.State, Integer, Integer> first = searchOf(nim, 500, 42).search(NimGame.start(14));
        SearchTree<NimGame.State, Integer, Integer> second = searchOf(nim, 500, 42).search(NimGame.start(14));

        assertSameTree(first.getRoot(), second.getRoot());
        assertEquals(first.getBestAction(), second.getBestAction());
    }

    private static void assertSameTree(SearchTreeNode<Integer> expected, SearchTreeNode<Integer> actual) {
        assertEquals(expected.getParentAction(), actual.getParentAction());
        assertEquals(expected.getStatistics().getNumVisits(), actual.getStatistics().getNumVisits());
        assertEquals(expected.getStatistics().getNumWins(), actual.getStatistics().getNumWins());
        assertEquals(expected.getUntriedActions(), actual.getUntriedActions());
        assertEquals(expected.getChildren().size(), actual.getChildren().size());
        Iterator<SearchTreeNode<Integer>> actualChildren = actual.getChildren().iterator();
        for (SearchTreeNode<Integer> child : expected.getChildren()) {
            assertSameTree(child, actualChildren.next());
        }
    }

    @Test
    void equallyGoodMovesConvergeToHalf() throws Exception {
        TicketGame game = new TicketGame(1000);
        SearchTree<List<String>, String, String> tree = searchOf(game, 1000, 6).search(game.start());

        assertEquals(2, tree.getRoot().getChildren().size());
        for (SearchTreeNode<String> child : tree.getRoot().getChildren()) {
            assertEquals(0.5, child.getStatistics().getWinRate(), 0.1, "door " + child.getParentAction());
        }
    }

    @Test
    void sampledPlayoutsPlugInWithoutTreeChanges() throws Exception {
        Random random = new Random(9);
        PoolOfStrategies strategies = new PoolOfStrategies(new SelectionStrategy(), new SelectionStrategyForMatch(),
                new ExpansionStrategy(random), new SampledPlayoutStrategy(random));
        ClaimGame game = new ClaimGame();
        MonteCarloTreeSearch<ClaimGame.State, Integer, String> search =
                new MonteCarloTreeSearch<>(game, new IterationBudget(60), strategies);

        ClaimGame.State start = ClaimGame.start(6, ClaimGame.RED);
        SearchTree<ClaimGame.State, Integer, String> tree = search.search(start);

        assertEquals(ClaimGame.RED, tree.getSearchingPlayer());
        assertEquals(60, tree.getRoot().getStatistics().getNumVisits());
        assertTrue(game.getLegalActions(start).contains(MonteCarloTreeSearch.getChosenAction(tree)));
    }

    @Test
    void inconsistentGameIsSurfaced() {
        MonteCarloTreeSearch<Integer, String, String> search = searchOf(new BrokenGame(), 10, 1);

        assertThrows(GameInterfaceViolationException.class, () -> search.decide(0));
        assertThrows(GameInterfaceViolationException.class, () -> search.decide(1));
    }

    @Test
    void budgetSpentBeforeFirstIterationIsReported() {
        MonteCarloTreeSearch<NimGame.State, Integer, Integer> search = new MonteCarloTreeSearch<>(nim,
                (iterations, elapsedNanos) -> true, new PoolOfStrategies(new Random(1)));

        assertThrows(GameInterfaceViolationException.class, () -> search.decide(NimGame.start(5)));
    }

    @Test
    void nanosecondTimeBudgetEndsWithoutAMove() {
        MonteCarloTreeSearch<NimGame.State, Integer, Integer> search = new MonteCarloTreeSearch<>(nim,
                new TimeBudget(Duration.ofNanos(1)), new PoolOfStrategies(new Random(1)));

        assertThrows(GameInterfaceViolationException.class, () -> search.decide(NimGame.start(5)));
    }

    @Test
    void failingPlayerLookupIsSurfaced() {
        SingleMoveGame game = new SingleMoveGame() {
            @Override
            public String getCurrentPlayer(Integer state) {
                if (state.equals(END)) {
                    throw new IllegalStateException("nobody moves at the end");
                }
                return super.getCurrentPlayer(state);
            }
        };
        MonteCarloTreeSearch<Integer, String, String> search = searchOf(game, 10, 1);

        GameInterfaceViolationException e =
                assertThrows(GameInterfaceViolationException.class, () -> search.decide(SingleMoveGame.START));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void defaultSearchUsesThousandIterations() throws Exception {
        MonteCarloTreeSearch<NimGame.State, Integer, Integer> search = new MonteCarloTreeSearch<>(nim);

        assertEquals(1000, ((IterationBudget) search.getSearchBudget()).getMaxIterations());
        assertEquals(1000, search.search(NimGame.start(6)).getNumIterations());
    }
}
