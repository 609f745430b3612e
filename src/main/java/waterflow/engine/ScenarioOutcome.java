package waterflow.engine;

import waterflow.algorithms.FlowResult;
import waterflow.core.FlowNetwork;
import waterflow.cut.FlowPath;
import waterflow.cut.MinCut;

import java.util.List;

/**
 * Everything the engine reports for one network + scenario + algorithm: the derived network,
 * the flow, its bottleneck cut and the flow decomposed into supply paths.
 */
public final class ScenarioOutcome {

    private final FlowNetwork network;
    private final FlowResult result;
    private final MinCut minCut;
    private final List<FlowPath> paths;

    ScenarioOutcome(FlowNetwork network, FlowResult result, MinCut minCut, List<FlowPath> paths) {
        this.network = network;
        this.result = result;
        this.minCut = minCut;
        this.paths = List.copyOf(paths);
    }

    /** @return the network after the scenario was applied */
    public FlowNetwork network() {
        return network;
    }

    public FlowResult result() {
        return result;
    }

    /** @return the bottleneck cut, or null if the run stopped early */
    public MinCut minCut() {
        return minCut;
    }

    public List<FlowPath> paths() {
        return paths;
    }
}
