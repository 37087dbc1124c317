package org.javai.transientfault.manager;

/**
 * Thrown when a retry strategy is requested by a name no strategy is registered under.
 */
public class UnknownRetryStrategyException extends IllegalArgumentException {

    private final String strategyName;

    public UnknownRetryStrategyException(String strategyName) {
        super("No retry strategy is registered with name: " + strategyName);
        this.strategyName = strategyName;
    }

    public String strategyName() {
        return strategyName;
    }
}
