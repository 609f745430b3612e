package waterflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable directed capacitated network (water grid) shared by all max-flow algorithms.
 *
 * <p>Representation:
 * <ul>
 *   <li>Nodes are indexed {@code 0..n-1} in insertion order, edges {@code 0..m-1} in insertion order.</li>
 *   <li>For every node the outgoing and incoming edges are kept in increasing edge index, which is the
 *       deterministic iteration order used by every algorithm.</li>
 *   <li>Exactly one node has role {@link NodeRole#SOURCE} and exactly one has role {@link NodeRole#SINK}.</li>
 * </ul>
 *
 * <p>A network never changes after {@link Builder#build()}. Scenario application and
 * {@link #withCapacities(double[])} produce new networks with the same topology, so a base network can be
 * shared between concurrently running algorithms without synchronization.</p>
 */
public final class FlowNetwork {

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Node> nodesById;
    private final Map<EdgeKey, Edge> edgesByKey;
    private final List<List<Edge>> out;
    private final List<List<Edge>> in;
    private final Node source;
    private final Node sink;

    private FlowNetwork(List<Node> nodes, List<Edge> edges, Node source, Node sink) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.source = source;
        this.sink = sink;

        Map<String, Node> byId = new HashMap<>();
        for (Node v : nodes) byId.put(v.id(), v);
        this.nodesById = Collections.unmodifiableMap(byId);

        Map<EdgeKey, Edge> byKey = new LinkedHashMap<>();
        List<List<Edge>> outLists = new ArrayList<>(nodes.size());
        List<List<Edge>> inLists = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            outLists.add(new ArrayList<>());
            inLists.add(new ArrayList<>());
        }
        for (Edge e : edges) {
            byKey.put(e.key(), e);
            outLists.get(e.from().index()).add(e);
            inLists.get(e.to().index()).add(e);
        }
        for (int i = 0; i < nodes.size(); i++) {
            outLists.set(i, Collections.unmodifiableList(outLists.get(i)));
            inLists.set(i, Collections.unmodifiableList(inLists.get(i)));
        }
        this.edgesByKey = Collections.unmodifiableMap(byKey);
        this.out = Collections.unmodifiableList(outLists);
        this.in = Collections.unmodifiableList(inLists);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return number of nodes */
    public int nodeCount() {
        return nodes.size();
    }

    /** @return number of edges */
    public int edgeCount() {
        return edges.size();
    }

    /** @return nodes in index order */
    public List<Node> nodes() {
        return nodes;
    }

    /** @return edges in insertion (index) order */
    public List<Edge> edges() {
        return edges;
    }

    public Node source() {
        return source;
    }

    public Node sink() {
        return sink;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public Edge edge(int index) {
        return edges.get(index);
    }

    public Optional<Node> findNode(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * @throws IllegalArgumentException if no node with this id exists
     */
    public Node node(String id) {
        Node v = nodesById.get(id);
        if (v == null) throw new IllegalArgumentException("Unknown node: " + id);
        return v;
    }

    public Optional<Edge> findEdge(EdgeKey key) {
        return Optional.ofNullable(edgesByKey.get(key));
    }

    /** @return outgoing edges of node {@code u} in increasing edge index */
    public List<Edge> outEdges(int u) {
        return out.get(u);
    }

    /** @return incoming edges of node {@code v} in increasing edge index */
    public List<Edge> inEdges(int v) {
        return in.get(v);
    }

    /** @return sum of the capacities of all edges leaving the source */
    public double sourceOutCapacity() {
        double sum = 0.0;
        for (Edge e : outEdges(source.index())) sum += e.capacity();
        return sum;
    }

    /**
     * Returns a network with identical nodes, edges and edge order but new capacities.
     *
     * @param capacities new capacity per edge index; must have length {@link #edgeCount()}
     * @throws InvalidNetworkException if the array has the wrong length or contains a negative or non-finite value
     */
    public FlowNetwork withCapacities(double[] capacities) {
        if (capacities.length != edges.size()) {
            throw new InvalidNetworkException("Expected " + edges.size() + " capacities, got " + capacities.length);
        }
        List<Edge> copy = new ArrayList<>(edges.size());
        for (Edge e : edges) {
            double c = capacities[e.index()];
            checkCapacity(e.from().id(), e.to().id(), c);
            copy.add(new Edge(e.index(), e.from(), e.to(), c));
        }
        return new FlowNetwork(new ArrayList<>(nodes), copy, source, sink);
    }

    @Override
    public String toString() {
        return "FlowNetwork{nodes=" + nodes.size() + ", edges=" + edges.size()
                + ", source=" + source.id() + ", sink=" + sink.id() + "}";
    }

    private static void checkCapacity(String from, String to, double capacity) {
        if (Double.isNaN(capacity) || Double.isInfinite(capacity)) {
            throw new InvalidNetworkException("Capacity of " + from + "->" + to + " is not finite: " + capacity);
        }
        if (capacity < 0.0) {
            throw new InvalidNetworkException("Negative capacity on " + from + "->" + to + ": " + capacity);
        }
    }

    /**
     * Collects nodes and edges and validates them all at once in {@link #build()}.
     *
     * <p>Nodes must be declared before {@link #build()}; edges may be declared in any order relative to
     * their nodes. Edge insertion order is preserved and defines the edge indices.</p>
     */
    public static final class Builder {

        private final Map<String, NodeRole> nodeRoles = new LinkedHashMap<>();
        private final List<String[]> edgeEnds = new ArrayList<>();
        private final List<Double> edgeCaps = new ArrayList<>();

        private Builder() {
        }

        public Builder node(String id, NodeRole role) {
            if (id == null || id.isEmpty()) throw new InvalidNetworkException("Node id must not be empty.");
            if (role == null) throw new InvalidNetworkException("Node role must not be null: " + id);
            if (nodeRoles.putIfAbsent(id, role) != null) {
                throw new InvalidNetworkException("Duplicate node id: " + id);
            }
            return this;
        }

        public Builder node(String id) {
            return node(id, NodeRole.INTERMEDIATE);
        }

        public Builder source(String id) {
            return node(id, NodeRole.SOURCE);
        }

        public Builder sink(String id) {
            return node(id, NodeRole.SINK);
        }

        /** @return whether a node with this id has already been declared */
        public boolean hasNode(String id) {
            return nodeRoles.containsKey(id);
        }

        public Builder edge(String from, String to, double capacity) {
            edgeEnds.add(new String[]{from, to});
            edgeCaps.add(capacity);
            return this;
        }

        /**
         * Validates the collected description and creates the network.
         *
         * @throws InvalidNetworkException on the first structural violation found
         */
        public FlowNetwork build() {
            List<Node> nodes = new ArrayList<>(nodeRoles.size());
            Map<String, Node> byId = new HashMap<>();
            Node source = null;
            Node sink = null;

            for (Map.Entry<String, NodeRole> en : nodeRoles.entrySet()) {
                Node v = new Node(en.getKey(), en.getValue(), nodes.size());
                nodes.add(v);
                byId.put(v.id(), v);

                if (v.role() == NodeRole.SOURCE) {
                    if (source != null) {
                        throw new InvalidNetworkException("Duplicate source: " + source.id() + " and " + v.id());
                    }
                    source = v;
                } else if (v.role() == NodeRole.SINK) {
                    if (sink != null) {
                        throw new InvalidNetworkException("Duplicate sink: " + sink.id() + " and " + v.id());
                    }
                    sink = v;
                }
            }
            if (source == null) throw new InvalidNetworkException("Network has no source node.");
            if (sink == null) throw new InvalidNetworkException("Network has no sink node.");

            List<Edge> edges = new ArrayList<>(edgeEnds.size());
            Map<EdgeKey, Edge> seen = new HashMap<>();
            for (int i = 0; i < edgeEnds.size(); i++) {
                String fromId = edgeEnds.get(i)[0];
                String toId = edgeEnds.get(i)[1];
                double cap = edgeCaps.get(i);

                Node from = byId.get(fromId);
                Node to = byId.get(toId);
                if (from == null) throw new InvalidNetworkException("Edge refers to unknown node: " + fromId);
                if (to == null) throw new InvalidNetworkException("Edge refers to unknown node: " + toId);
                if (from == to) throw new InvalidNetworkException("Self-loop on node " + fromId);
                checkCapacity(fromId, toId, cap);

                Edge e = new Edge(edges.size(), from, to, cap);
                if (seen.putIfAbsent(e.key(), e) != null) {
                    throw new InvalidNetworkException("Duplicate edge " + fromId + "->" + toId);
                }
                edges.add(e);
            }

            return new FlowNetwork(nodes, edges, source, sink);
        }
    }
}
