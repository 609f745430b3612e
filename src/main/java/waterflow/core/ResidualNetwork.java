package waterflow.core;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Per-run residual state (the "arena") over an immutable {@link FlowNetwork}.
 *
 * <p>Representation:
 * <ul>
 *   <li>{@code flow[e]} is the current flow on network edge {@code e}; it is the single source of truth.</li>
 *   <li>Every edge {@code e} induces two residual arcs: the forward arc {@code 2e} (tail {@code from},
 *       residual capacity {@code capacity - flow}) and the reverse arc {@code 2e+1} (tail {@code to},
 *       residual capacity {@code flow}).</li>
 *   <li>{@code arcs(u)} lists the residual arcs leaving {@code u} in increasing edge index, forward and
 *       reverse arcs interleaved exactly as the edges were inserted. This is the tie-break order used by
 *       BFS, DFS and discharge scans.</li>
 * </ul>
 *
 * <p>Instances are confined to one run and are not thread-safe. Each concurrent run creates its own
 * residual network; the underlying {@link FlowNetwork} is shared read-only.</p>
 */
public final class ResidualNetwork {

    private final FlowNetwork network;
    private final int n;
    private final double[] cap;
    private final double[] flow;
    private final int[] tail;
    private final int[] head;
    private final int[][] adj;

    /**
     * Creates a residual network with zero flow on every edge.
     *
     * @param network network whose capacities bound the flow
     */
    public ResidualNetwork(FlowNetwork network) {
        this.network = network;
        this.n = network.nodeCount();
        int m = network.edgeCount();
        this.cap = new double[m];
        this.flow = new double[m];
        this.tail = new int[2 * m];
        this.head = new int[2 * m];

        int[] degree = new int[n];
        for (Edge e : network.edges()) {
            int i = e.index();
            int u = e.from().index();
            int v = e.to().index();
            cap[i] = e.capacity();
            tail[2 * i] = u;
            head[2 * i] = v;
            tail[2 * i + 1] = v;
            head[2 * i + 1] = u;
            degree[u]++;
            degree[v]++;
        }

        // Forward arc goes to adj[from], reverse arc to adj[to], both appended in edge order.
        this.adj = new int[n][];
        for (int u = 0; u < n; u++) adj[u] = new int[degree[u]];
        int[] fill = new int[n];
        for (Edge e : network.edges()) {
            int i = e.index();
            int u = e.from().index();
            int v = e.to().index();
            adj[u][fill[u]++] = 2 * i;
            adj[v][fill[v]++] = 2 * i + 1;
        }
    }

    /**
     * Rebuilds the residual state of a terminated run from its per-edge flows.
     *
     * @param network network the flows were computed on
     * @param flows   flow per edge index
     * @return residual network holding exactly these flows
     */
    public static ResidualNetwork withFlows(FlowNetwork network, double[] flows) {
        if (flows.length != network.edgeCount()) {
            throw new IllegalArgumentException("Expected " + network.edgeCount() + " flows, got " + flows.length);
        }
        ResidualNetwork r = new ResidualNetwork(network);
        System.arraycopy(flows, 0, r.flow, 0, flows.length);
        return r;
    }

    public FlowNetwork network() {
        return network;
    }

    /** @return number of nodes */
    public int size() {
        return n;
    }

    /** @return residual arcs leaving {@code u}, in deterministic order; callers must not modify the array */
    public int[] arcs(int u) {
        return adj[u];
    }

    public int tail(int arc) {
        return tail[arc];
    }

    public int head(int arc) {
        return head[arc];
    }

    /** @return network edge index underlying {@code arc} */
    public static int edgeOf(int arc) {
        return arc >>> 1;
    }

    /** @return whether {@code arc} runs against its edge direction (i.e. pushing on it cancels flow) */
    public static boolean isReverse(int arc) {
        return (arc & 1) == 1;
    }

    /** @return the opposite arc of the same edge */
    public static int partner(int arc) {
        return arc ^ 1;
    }

    /**
     * @return residual capacity of {@code arc}: {@code capacity - flow} for a forward arc, {@code flow} for a reverse arc
     */
    public double residual(int arc) {
        int e = arc >>> 1;
        return (arc & 1) == 0 ? cap[e] - flow[e] : flow[e];
    }

    /**
     * Pushes {@code amount} along {@code arc}. A forward push increases the edge flow, a reverse push
     * decreases it. The resulting flow is clamped to {@code [0, capacity]} to absorb rounding.
     */
    public void push(int arc, double amount) {
        int e = arc >>> 1;
        if ((arc & 1) == 0) {
            double f = flow[e] + amount;
            flow[e] = f > cap[e] ? cap[e] : f;
        } else {
            double f = flow[e] - amount;
            flow[e] = f < 0.0 ? 0.0 : f;
        }
    }

    public double flow(int edge) {
        return flow[edge];
    }

    public double capacity(int edge) {
        return cap[edge];
    }

    /** @return a copy of the per-edge flow array */
    public double[] flows() {
        return Arrays.copyOf(flow, flow.length);
    }

    /**
     * Overwrites one edge flow without any clamping. Only meant for corrupting a solved state on
     * purpose, to demonstrate that {@link FlowValidators} detect the violation.
     */
    public void overrideFlow(int edge, double value) {
        flow[edge] = value;
    }

    /**
     * Net flow balance per node: {@code inflow - outflow}.
     */
    public double[] netInflow() {
        double[] net = new double[n];
        for (int e = 0; e < flow.length; e++) {
            net[tail[2 * e]] -= flow[e];
            net[head[2 * e]] += flow[e];
        }
        return net;
    }

    /**
     * Residual reachability from {@code s} using only arcs whose residual capacity exceeds {@code tolerance}.
     *
     * @return {@code vis[v] == true} iff v is reachable from s in the current residual network
     */
    public boolean[] residualReachable(int s, double tolerance) {
        boolean[] vis = new boolean[n];
        ArrayDeque<Integer> q = new ArrayDeque<>();

        vis[s] = true;
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (int a : adj[u]) {
                int v = head[a];
                if (!vis[v] && residual(a) > tolerance) {
                    vis[v] = true;
                    q.add(v);
                }
            }
        }
        return vis;
    }
}
