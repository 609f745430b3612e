package waterflow.engine;

import waterflow.algorithms.FlowResult;
import waterflow.trace.AlgorithmEvent;

import java.util.List;

/**
 * A run's result together with every event it emitted, in order.
 */
public final class TracedRun {

    private final FlowResult result;
    private final List<AlgorithmEvent> events;

    TracedRun(FlowResult result, List<AlgorithmEvent> events) {
        this.result = result;
        this.events = List.copyOf(events);
    }

    public FlowResult result() {
        return result;
    }

    public List<AlgorithmEvent> events() {
        return events;
    }
}
