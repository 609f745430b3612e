package waterflow.core;

/**
 * Directed pipe of a {@link FlowNetwork}.
 *
 * <p>Edges are immutable. Mutable flow state during a run lives in a {@link ResidualNetwork},
 * which addresses edges by their {@link #index()}:
 * <ul>
 *   <li>{@code index} is the insertion position of the edge in the network and never changes
 *       when a scenario derives a new network from this one.</li>
 *   <li>All algorithms iterate outgoing edges in increasing {@code index}, which makes every
 *       tie-break (BFS order, DFS order, discharge order) deterministic.</li>
 *   <li>{@code capacity} is the usable capacity in this network (already derated by leakage or
 *       forced to 0 by a pipe failure if the network was produced by a scenario).</li>
 * </ul>
 * </p>
 */
public final class Edge {

    private final int index;
    private final Node from;
    private final Node to;
    private final double capacity;

    Edge(int index, Node from, Node to, double capacity) {
        this.index = index;
        this.from = from;
        this.to = to;
        this.capacity = capacity;
    }

    /** @return stable insertion index of this edge */
    public int index() {
        return index;
    }

    public Node from() {
        return from;
    }

    public Node to() {
        return to;
    }

    public double capacity() {
        return capacity;
    }

    public EdgeKey key() {
        return new EdgeKey(from.id(), to.id());
    }

    @Override
    public String toString() {
        return from.id() + "->" + to.id() + " [" + capacity + "]";
    }
}
