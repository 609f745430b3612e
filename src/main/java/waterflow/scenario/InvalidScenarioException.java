package waterflow.scenario;

/**
 * Thrown by {@link ScenarioBuilder#apply} when a scenario cannot be applied to a network: a leakage
 * fraction outside {@code [0,1)}, or a reference to an edge the network does not contain.
 */
public class InvalidScenarioException extends IllegalArgumentException {

    public InvalidScenarioException(String message) {
        super(message);
    }
}
