package waterflow.cut;

import waterflow.core.Edge;
import waterflow.core.EdgeKey;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Minimum s-t cut derived from a terminated run: the bottleneck pipes of the network.
 *
 * <p>{@link #sourceSide()} holds the nodes still reachable from the source in the final residual network,
 * {@link #sinkSide()} the rest. {@link #edges()} are the positive-capacity edges leading from the source
 * side to the sink side; for a converged run their capacity sum equals the maximum flow.
 * {@link #zeroCapacityEdges()} lists crossing edges without capacity (failed pipes), which do not count
 * towards the cut value but show where a failure isolated part of the grid.</p>
 */
public final class MinCut {

    private final Set<String> sourceSide;
    private final Set<String> sinkSide;
    private final List<Edge> edges;
    private final List<Edge> zeroCapacityEdges;
    private final double capacity;

    MinCut(Set<String> sourceSide, Set<String> sinkSide, List<Edge> edges, List<Edge> zeroCapacityEdges,
           double capacity) {
        this.sourceSide = Collections.unmodifiableSet(sourceSide);
        this.sinkSide = Collections.unmodifiableSet(sinkSide);
        this.edges = Collections.unmodifiableList(edges);
        this.zeroCapacityEdges = Collections.unmodifiableList(zeroCapacityEdges);
        this.capacity = capacity;
    }

    /** @return node ids on the source side, in node index order */
    public Set<String> sourceSide() {
        return sourceSide;
    }

    /** @return node ids on the sink side, in node index order */
    public Set<String> sinkSide() {
        return sinkSide;
    }

    /** @return positive-capacity crossing edges, in edge index order */
    public List<Edge> edges() {
        return edges;
    }

    public List<Edge> zeroCapacityEdges() {
        return zeroCapacityEdges;
    }

    /** @return sum of the capacities of {@link #edges()} */
    public double capacity() {
        return capacity;
    }

    public boolean contains(EdgeKey key) {
        for (Edge e : edges) {
            if (e.key().equals(key)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    @Override
    public String toString() {
        return "MinCut{capacity=" + capacity + ", edges=" + edges + "}";
    }
}
