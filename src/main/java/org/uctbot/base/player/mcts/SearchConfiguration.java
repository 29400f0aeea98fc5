package org.uctbot.base.player.mcts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.model.GameModel;
import org.uctbot.base.player.mcts.model.MonteCarloTreeSearch;
import org.uctbot.base.player.mcts.model.budget.IterationBudget;
import org.uctbot.base.player.mcts.model.budget.SearchBudget;
import org.uctbot.base.player.mcts.model.budget.TimeBudget;
import org.uctbot.base.player.mcts.model.strategy.ExpansionStrategy;
import org.uctbot.base.player.mcts.model.strategy.PlayoutStrategy;
import org.uctbot.base.player.mcts.model.strategy.PoolOfStrategies;
import org.uctbot.base.player.mcts.model.strategy.RandomPlayoutStrategy;
import org.uctbot.base.player.mcts.model.strategy.SampledPlayoutStrategy;
import org.uctbot.base.player.mcts.model.strategy.SelectionStrategy;
import org.uctbot.base.player.mcts.model.strategy.SelectionStrategyForMatch;
import org.uctbot.base.player.mcts.model.strategy.TieBreakRule;
import org.uctbot.base.player.mcts.observer.TreeObserver;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.Random;

/**
 * Search settings read from a classpath properties file. A system property with the same key wins over the file.
 */
public class SearchConfiguration {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final String DEFAULT_RESOURCE = "mcts.properties";

    public static final String BUDGET = "mcts.budget";
    public static final String BUDGET_ITERATIONS = "mcts.budget.iterations";
    public static final String BUDGET_MILLIS = "mcts.budget.millis";
    public static final String EXPLORATION = "mcts.exploration";
    public static final String PLAYOUT = "mcts.playout";
    public static final String PLAYOUT_SAMPLES = "mcts.playout.samples";
    public static final String PLAYOUT_DEPTH = "mcts.playout.depth";
    public static final String TIE_BREAK = "mcts.tiebreak";
    public static final String SEED = "mcts.seed";
    public static final String TREE_DIRECTORY = "mcts.tree.dir";

    private static final String[] KEYS = {
            BUDGET, BUDGET_ITERATIONS, BUDGET_MILLIS, EXPLORATION, PLAYOUT,
            PLAYOUT_SAMPLES, PLAYOUT_DEPTH, TIE_BREAK, SEED, TREE_DIRECTORY
    };

    public enum BudgetType {
        ITERATIONS, TIME
    }

    public enum PlayoutType {
        RANDOM, SAMPLED
    }

    private final Properties properties;

    public SearchConfiguration(Properties properties) {
        this.properties = properties;
    }

    public static SearchConfiguration load() {
        return load(DEFAULT_RESOURCE);
    }

    public static SearchConfiguration load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfiguration.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.warn("No {} on the classpath, using defaults", resource);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }

        for (String key : KEYS) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }

        SearchConfiguration configuration = new SearchConfiguration(properties);
        LOGGER.info("Search configuration: budget {}, exploration {}, {} playout, tie break {}",
                configuration.getBudget(), configuration.getExplorationBias(),
                configuration.getPlayoutType().name().toLowerCase(Locale.ROOT), configuration.getTieBreakRule());
        return configuration;
    }

    public BudgetType getBudgetType() {
        return getEnum(BUDGET, BudgetType.class, BudgetType.ITERATIONS);
    }

    public SearchBudget getBudget() {
        if (getBudgetType() == BudgetType.TIME) {
            return new TimeBudget(Duration.ofMillis(getLong(BUDGET_MILLIS, TimeBudget.DEFAULT_LIMIT.toMillis())));
        }
        return new IterationBudget(getInt(BUDGET_ITERATIONS, IterationBudget.DEFAULT_ITERATIONS));
    }

    public double getExplorationBias() {
        String value = properties.getProperty(EXPLORATION);
        if (value == null) {
            return SelectionStrategy.DEFAULT_EXPLORATION_BIAS;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + EXPLORATION + ": " + value, e);
        }
    }

    public PlayoutType getPlayoutType() {
        return getEnum(PLAYOUT, PlayoutType.class, PlayoutType.RANDOM);
    }

    public int getPlayoutSamples() {
        return getInt(PLAYOUT_SAMPLES, SampledPlayoutStrategy.DEFAULT_SAMPLES);
    }

    public int getPlayoutDepth() {
        return getInt(PLAYOUT_DEPTH, SampledPlayoutStrategy.DEFAULT_MAX_DEPTH);
    }

    public TieBreakRule getTieBreakRule() {
        return getEnum(TIE_BREAK, TieBreakRule.class, TieBreakRule.FIRST);
    }

    /**
     * @return the random seed, or {@code null} for an unseeded search
     */
    public Long getSeed() {
        return properties.getProperty(SEED) == null ? null : getLong(SEED, 0);
    }

    public File getTreeDirectory() {
        String value = properties.getProperty(TREE_DIRECTORY);
        return value == null || value.trim().isEmpty() ? null : new File(value.trim());
    }

    public PoolOfStrategies createStrategies() {
        Long seed = getSeed();
        Random random = seed == null ? new Random() : new Random(seed);

        PlayoutStrategy playoutStrategy;
        if (getPlayoutType() == PlayoutType.SAMPLED) {
            playoutStrategy = new SampledPlayoutStrategy(random, getPlayoutSamples(), getPlayoutDepth());
        } else {
            playoutStrategy = new RandomPlayoutStrategy(random);
        }

        TieBreakRule tieBreakRule = getTieBreakRule();
        return new PoolOfStrategies(
                new SelectionStrategy(getExplorationBias(), tieBreakRule),
                new SelectionStrategyForMatch(tieBreakRule),
                new ExpansionStrategy(random),
                playoutStrategy);
    }

    public <S, A, P> MonteCarloTreeSearch<S, A, P> createSearch(GameModel<S, A, P> model) {
        return new MonteCarloTreeSearch<>(model, getBudget(), createStrategies());
    }

    /**
     * Creates a player; when a tree directory is configured, every searched tree is dumped there.
     */
    public <S, A, P> MCTSPlayer<S, A, P> createPlayer(GameModel<S, A, P> model) {
        MCTSPlayer<S, A, P> player = new MCTSPlayer<>(createSearch(model));
        File treeDirectory = getTreeDirectory();
        if (treeDirectory != null) {
            player.addObserver(new TreeObserver(treeDirectory));
        }
        return player;
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
        }
    }

    private long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
        }
    }

    private <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
        }
    }
}
