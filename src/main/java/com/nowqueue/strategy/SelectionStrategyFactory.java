package com.nowqueue.strategy;

import com.nowqueue.config.SelectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating SelectionStrategy instances.
 */
public class SelectionStrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(SelectionStrategyFactory.class);

    /**
     * Create the primary strategy for the given configuration.
     *
     * @param config Selection configuration
     * @return SelectionStrategy instance
     */
    public static SelectionStrategy create(SelectionConfig config) {
        if (config == null) {
            log.info("No selection config provided, defaulting to GREEDY");
            return createDefault();
        }

        StrategyType type = config.effectiveStrategy();
        log.info("Creating SelectionStrategy: {}", type);

        return switch (type) {
            case EXACT -> new ExactStrategy(config.solverTimeoutMs());
            case GREEDY -> new GreedyStrategy();
        };
    }

    /**
     * Create the greedy strategy, which is also the fallback of EXACT.
     */
    public static SelectionStrategy createDefault() {
        return new GreedyStrategy();
    }
}
