package waterflow.cut;

import waterflow.algorithms.FlowResult;
import waterflow.core.Edge;
import waterflow.core.FlowNetwork;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the minimum cut certified by a terminated run.
 *
 * <p>The per-edge flows of a {@link FlowResult} together with the network determine the final residual
 * network exactly. One residual reachability search from the source, over arcs with residual capacity
 * above the run's tolerance, gives the source side S. When source and sink were never connected the
 * result is a cut of capacity 0 (possibly without edges); this is a regular outcome, not an error.</p>
 *
 * <p>Only converged runs certify a cut. After an early stop the sink may still be residually reachable,
 * so such results are rejected.</p>
 */
public final class MinCutExtractor {

    private MinCutExtractor() {
    }

    /**
     * @param network the network {@code result} was computed on
     * @param result  a converged run on {@code network}
     * @throws IllegalArgumentException if the result does not belong to the network or did not converge
     */
    public static MinCut extract(FlowNetwork network, FlowResult result) {
        if (!result.isMaximal()) {
            throw new IllegalArgumentException(result.algorithm().displayName() + " stopped early ("
                    + result.termination() + "); its flow does not certify a minimum cut");
        }
        double[] flows = result.flowArray();
        if (flows.length != network.edgeCount()) {
            throw new IllegalArgumentException("Result has " + flows.length + " edge flows but network has "
                    + network.edgeCount() + " edges");
        }
        Node source = network.node(result.sourceId());
        Node sink = network.node(result.sinkId());

        ResidualNetwork r = ResidualNetwork.withFlows(network, flows);
        boolean[] inS = r.residualReachable(source.index(), result.tolerance());
        if (inS[sink.index()]) {
            throw new IllegalArgumentException("Sink " + sink.id() + " is still reachable in the residual network; "
                    + "the flow is not maximal");
        }

        Set<String> sourceSide = new LinkedHashSet<>();
        Set<String> sinkSide = new LinkedHashSet<>();
        for (Node v : network.nodes()) {
            if (inS[v.index()]) sourceSide.add(v.id());
            else sinkSide.add(v.id());
        }

        List<Edge> cut = new ArrayList<>();
        List<Edge> zero = new ArrayList<>();
        double capacity = 0.0;
        for (Edge e : network.edges()) {
            if (!inS[e.from().index()] || inS[e.to().index()]) continue;
            if (e.capacity() > 0.0) {
                cut.add(e);
                capacity += e.capacity();
            } else {
                zero.add(e);
            }
        }

        return new MinCut(sourceSide, sinkSide, cut, zero, capacity);
    }
}
