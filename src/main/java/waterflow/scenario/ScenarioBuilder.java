package waterflow.scenario;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waterflow.core.Edge;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;

import java.util.Map;

/**
 * Derives perturbed networks from a base network.
 *
 * <p>{@link #apply} is a pure function. The derived network has the same nodes, edge ids and edge order as
 * the base; only capacities change:
 * <ul>
 *   <li>failed edge: {@code 0} (the edge stays in the topology so a cut can still name it)</li>
 *   <li>leaked edge: {@code capacity * (1 - leakage)}</li>
 *   <li>any other edge: unchanged</li>
 * </ul>
 */
public final class ScenarioBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScenarioBuilder.class);

    private ScenarioBuilder() {
    }

    /**
     * @param base     network to perturb; never modified
     * @param scenario perturbation to apply
     * @return new network with recomputed capacities
     * @throws InvalidScenarioException if a leakage fraction is outside {@code [0,1)} or an edge is unknown
     */
    public static FlowNetwork apply(FlowNetwork base, Scenario scenario) {
        checkFraction("default leakage", scenario.defaultLeakage());
        for (Map.Entry<EdgeKey, Double> en : scenario.leakageOverrides().entrySet()) {
            requireEdge(base, en.getKey());
            checkFraction("leakage of " + en.getKey(), en.getValue());
        }
        for (EdgeKey k : scenario.failedEdges()) {
            requireEdge(base, k);
        }

        double[] caps = new double[base.edgeCount()];
        int leaked = 0;
        for (Edge e : base.edges()) {
            EdgeKey k = e.key();
            if (scenario.isFailed(k)) {
                caps[e.index()] = 0.0;
                continue;
            }
            double leak = scenario.leakageFor(k);
            if (leak > 0.0) leaked++;
            caps[e.index()] = leak == 0.0 ? e.capacity() : e.capacity() * (1.0 - leak);
        }

        log.debug("Applied {}: {} leaked edges, {} failed edges", scenario, leaked, scenario.failedEdges().size());
        return base.withCapacities(caps);
    }

    private static void requireEdge(FlowNetwork g, EdgeKey k) {
        if (g.findEdge(k).isEmpty()) {
            throw new InvalidScenarioException("Scenario refers to unknown edge " + k);
        }
    }

    private static void checkFraction(String what, double f) {
        if (Double.isNaN(f) || f < 0.0 || f >= 1.0) {
            throw new InvalidScenarioException("Invalid " + what + ": " + f + " (expected 0 <= leakage < 1)");
        }
    }
}
