package org.javai.transientfault.manager;

import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.retry.RetryPolicy;
import org.javai.transientfault.strategy.RetryPolicyOptions;
import org.javai.transientfault.strategy.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Registry of named retry strategies, resolving default policies per technology.
 *
 * <p>A manager is built once, usually from configuration, and is read-only afterwards.
 * Every name it refers to is checked at construction, so lookups by technology never fail.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryManager manager = new RetryManager(
 *     List.of(new FixedIntervalRetryStrategy("standard", 3, Duration.ofSeconds(1)),
 *             new ExponentialBackoffRetryStrategy("patient", 8, Duration.ofSeconds(1),
 *                     Duration.ofSeconds(30), Duration.ofSeconds(2))),
 *     "standard",
 *     Map.of("SQL", "patient"));
 *
 * RetryPolicy commands = manager.getDefaultSqlCommandRetryPolicy();      // patient
 * RetryPolicy connections = manager.getDefaultSqlConnectionRetryPolicy(); // patient, via SQL
 * }</pre>
 *
 * <p>Code that cannot be handed a manager may use the process-wide one, installed once at startup
 * with {@link #setDefault(RetryManager)} and read with {@link #getInstance()}.</p>
 */
public final class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    private static final AtomicReference<RetryManager> INSTANCE = new AtomicReference<>();

    private final Map<String, RetryStrategy> strategies;
    private final String defaultStrategyName;
    private final RetryStrategy defaultStrategy;
    private final Map<String, String> technologyDefaults;

    /**
     * Creates a manager without technology mappings; every technology uses the default strategy.
     */
    public RetryManager(Collection<? extends RetryStrategy> strategies, String defaultStrategyName) {
        this(strategies, defaultStrategyName, Map.of());
    }

    /**
     * @param strategies the strategies to register, each with a unique non-null name
     * @param defaultStrategyName the name of the strategy returned when no name is given
     * @param technologyDefaults strategy names keyed by technology name, such as {@code "SQL"}
     * @throws IllegalArgumentException if a strategy has no name, two strategies share a name,
     *         or the default or a mapped name is not registered
     */
    public RetryManager(Collection<? extends RetryStrategy> strategies, String defaultStrategyName,
                        Map<String, String> technologyDefaults) {
        this(byName(strategies), defaultStrategyName, technologyDefaults);
    }

    private RetryManager(Map<String, RetryStrategy> strategies, String defaultStrategyName,
                         Map<String, String> technologyDefaults) {
        Objects.requireNonNull(defaultStrategyName, "defaultStrategyName must not be null");
        Objects.requireNonNull(technologyDefaults, "technologyDefaults must not be null");
        this.strategies = Collections.unmodifiableMap(strategies);
        this.defaultStrategy = strategies.get(defaultStrategyName);
        if (defaultStrategy == null) {
            throw new IllegalArgumentException("Default retry strategy is not registered: " + defaultStrategyName);
        }
        this.defaultStrategyName = defaultStrategyName;

        Map<String, String> mappings = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : technologyDefaults.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "technology name must not be null");
            if (!strategies.containsKey(entry.getValue())) {
                throw new IllegalArgumentException("Technology " + entry.getKey()
                        + " refers to an unregistered retry strategy: " + entry.getValue());
            }
            mappings.put(entry.getKey(), entry.getValue());
        }
        this.technologyDefaults = Collections.unmodifiableMap(mappings);
    }

    /**
     * Builds a manager from options. Each named strategy is built with
     * {@link RetryStrategy#fromOptions(String, RetryPolicyOptions)}.
     */
    public static RetryManager fromOptions(RetryManagerOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Map<String, RetryStrategy> strategies = new LinkedHashMap<>();
        for (Map.Entry<String, RetryPolicyOptions> entry : options.getStrategies().entrySet()) {
            Objects.requireNonNull(entry.getKey(), "strategy name must not be null");
            strategies.put(entry.getKey(), RetryStrategy.fromOptions(entry.getKey(), entry.getValue()));
        }
        return new RetryManager(strategies, options.getDefaultStrategy(), options.getTechnologyDefaults());
    }

    private static Map<String, RetryStrategy> byName(Collection<? extends RetryStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        Map<String, RetryStrategy> byName = new LinkedHashMap<>();
        for (RetryStrategy strategy : strategies) {
            Objects.requireNonNull(strategy, "strategy must not be null");
            if (strategy.name() == null) {
                throw new IllegalArgumentException("Registered retry strategies must be named: " + strategy);
            }
            if (byName.putIfAbsent(strategy.name(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate retry strategy name: " + strategy.name());
            }
        }
        return byName;
    }

    // === PROCESS-WIDE INSTANCE ===

    /**
     * Returns the process-wide manager.
     *
     * @throws IllegalStateException if none has been set
     */
    public static RetryManager getInstance() {
        RetryManager manager = INSTANCE.get();
        if (manager == null) {
            throw new IllegalStateException("The default RetryManager has not been set; call RetryManager.setDefault first");
        }
        return manager;
    }

    /**
     * Installs the process-wide manager.
     *
     * @throws IllegalStateException if a manager is already installed
     */
    public static void setDefault(RetryManager manager) {
        setDefault(manager, true);
    }

    /**
     * Installs the process-wide manager.
     *
     * @param manager the manager
     * @param throwIfSet if true, fail when a manager is already installed; if false, replace it
     */
    public static void setDefault(RetryManager manager, boolean throwIfSet) {
        Objects.requireNonNull(manager, "manager must not be null");
        if (!throwIfSet) {
            INSTANCE.set(manager);
            return;
        }
        if (!INSTANCE.compareAndSet(null, manager)) {
            throw new IllegalStateException("The default RetryManager is already set");
        }
    }

    static void clearDefault() {
        INSTANCE.set(null);
    }

    // === LOOKUPS ===

    public String defaultStrategyName() {
        return defaultStrategyName;
    }

    /**
     * Returns the default strategy.
     */
    public RetryStrategy getRetryStrategy() {
        return defaultStrategy;
    }

    /**
     * Returns the strategy registered under the name.
     *
     * @throws UnknownRetryStrategyException if none is
     */
    public RetryStrategy getRetryStrategy(String name) {
        Objects.requireNonNull(name, "name must not be null");
        RetryStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new UnknownRetryStrategyException(name);
        }
        return strategy;
    }

    /**
     * Returns a policy pairing the default strategy with a new classifier.
     */
    public RetryPolicy getRetryPolicy(Supplier<? extends ErrorClassifier> classifierFactory) {
        Objects.requireNonNull(classifierFactory, "classifierFactory must not be null");
        return new RetryPolicy(classifierFactory.get(), getRetryStrategy());
    }

    /**
     * Returns a policy pairing the named strategy with a new classifier.
     *
     * @throws UnknownRetryStrategyException if no strategy is registered under the name
     */
    public RetryPolicy getRetryPolicy(Supplier<? extends ErrorClassifier> classifierFactory, String strategyName) {
        Objects.requireNonNull(classifierFactory, "classifierFactory must not be null");
        RetryStrategy strategy = getRetryStrategy(strategyName);
        return new RetryPolicy(classifierFactory.get(), strategy);
    }

    /**
     * Returns the strategy mapped to the technology name, or the default strategy if it is not mapped.
     */
    public RetryStrategy getDefaultRetryStrategy(String technologyName) {
        Objects.requireNonNull(technologyName, "technologyName must not be null");
        String name = technologyDefaults.get(technologyName);
        if (name == null) {
            log.debug("No retry strategy mapped for {}, using default [{}]", technologyName, defaultStrategyName);
            return defaultStrategy;
        }
        return strategies.get(name);
    }

    /**
     * Returns the strategy for commands of the technology.
     */
    public RetryStrategy getDefaultCommandRetryStrategy(Technology technology) {
        Objects.requireNonNull(technology, "technology must not be null");
        return getDefaultRetryStrategy(technology.commandName());
    }

    /**
     * Returns the strategy for opening connections of the technology: its connection mapping,
     * else its command mapping, else the default strategy.
     */
    public RetryStrategy getDefaultConnectionRetryStrategy(Technology technology) {
        Objects.requireNonNull(technology, "technology must not be null");
        String name = technologyDefaults.get(technology.connectionName());
        if (name != null) {
            return strategies.get(name);
        }
        log.debug("No retry strategy mapped for {}, falling back to {}", technology.connectionName(),
                technology.commandName());
        return getDefaultCommandRetryStrategy(technology);
    }

    public RetryPolicy getDefaultCommandRetryPolicy(Technology technology) {
        return new RetryPolicy(technology.newErrorClassifier(), getDefaultCommandRetryStrategy(technology));
    }

    public RetryPolicy getDefaultConnectionRetryPolicy(Technology technology) {
        return new RetryPolicy(technology.newErrorClassifier(), getDefaultConnectionRetryStrategy(technology));
    }

    public RetryPolicy getDefaultSqlCommandRetryPolicy() {
        return getDefaultCommandRetryPolicy(Technology.SQL);
    }

    public RetryPolicy getDefaultSqlConnectionRetryPolicy() {
        return getDefaultConnectionRetryPolicy(Technology.SQL);
    }

    public RetryPolicy getDefaultAzureSqlCommandRetryPolicy() {
        return getDefaultCommandRetryPolicy(Technology.AZURE_SQL);
    }

    public RetryPolicy getDefaultAzureSqlConnectionRetryPolicy() {
        return getDefaultConnectionRetryPolicy(Technology.AZURE_SQL);
    }

    public RetryPolicy getDefaultMySqlCommandRetryPolicy() {
        return getDefaultCommandRetryPolicy(Technology.MYSQL);
    }

    public RetryPolicy getDefaultMySqlConnectionRetryPolicy() {
        return getDefaultConnectionRetryPolicy(Technology.MYSQL);
    }

    public RetryPolicy getDefaultOracleCommandRetryPolicy() {
        return getDefaultCommandRetryPolicy(Technology.ORACLE);
    }

    public RetryPolicy getDefaultOracleConnectionRetryPolicy() {
        return getDefaultConnectionRetryPolicy(Technology.ORACLE);
    }

    public RetryPolicy getDefaultNpgsqlCommandRetryPolicy() {
        return getDefaultCommandRetryPolicy(Technology.NPGSQL);
    }

    public RetryPolicy getDefaultNpgsqlConnectionRetryPolicy() {
        return getDefaultConnectionRetryPolicy(Technology.NPGSQL);
    }

    @Override
    public String toString() {
        return "RetryManager[strategies=" + strategies.keySet() + ", default=" + defaultStrategyName
                + ", technologyDefaults=" + technologyDefaults + "]";
    }
}
