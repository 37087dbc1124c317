package org.javai.transientfault.manager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.javai.transientfault.strategy.RetryPolicyOptions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options from which a {@link RetryManager} is built with {@link RetryManager#fromOptions(RetryManagerOptions)}.
 *
 * <pre>{@code
 * {
 *   "defaultStrategy": "standard",
 *   "strategies": {
 *     "standard": { "enabled": true, "retryStrategyName": "Fixed", "retryCount": 3, "interval": "PT1S" },
 *     "patient":  { "enabled": true, "retryStrategyName": "Exponential", "retryCount": 8 }
 *   },
 *   "technologyDefaults": { "SQL": "patient", "SQLConnection": "standard" }
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryManagerOptions {

    private String defaultStrategy;
    private Map<String, RetryPolicyOptions> strategies = new LinkedHashMap<>();
    private Map<String, String> technologyDefaults = new LinkedHashMap<>();

    public String getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(String defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    /**
     * Strategy options keyed by strategy name.
     */
    public Map<String, RetryPolicyOptions> getStrategies() {
        return strategies;
    }

    public void setStrategies(Map<String, RetryPolicyOptions> strategies) {
        this.strategies = strategies != null ? strategies : new LinkedHashMap<>();
    }

    /**
     * Strategy names keyed by technology name, such as {@code "SQL"} or {@code "SQLConnection"}.
     */
    public Map<String, String> getTechnologyDefaults() {
        return technologyDefaults;
    }

    public void setTechnologyDefaults(Map<String, String> technologyDefaults) {
        this.technologyDefaults = technologyDefaults != null ? technologyDefaults : new LinkedHashMap<>();
    }
}
