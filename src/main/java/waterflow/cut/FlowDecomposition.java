package waterflow.cut;

import waterflow.algorithms.FlowResult;
import waterflow.core.Edge;
import waterflow.core.FlowNetwork;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

/**
 * Splits a flow into source-to-sink paths, e.g. to show which supply routes feed the sink.
 *
 * <p>Repeatedly finds a shortest path from the source to the sink over edges with remaining flow
 * (BFS in edge insertion order), records it with its bottleneck amount and subtracts that amount.
 * Every round empties at least one edge, so at most {@code E} paths are produced. Flow circulating in
 * cycles carries no source-sink value and is left out. The path amounts add up to the total flow.</p>
 */
public final class FlowDecomposition {

    private FlowDecomposition() {
    }

    public static List<FlowPath> decompose(FlowNetwork network, FlowResult result) {
        double[] rest = result.flowArray();
        if (rest.length != network.edgeCount()) {
            throw new IllegalArgumentException("Result does not belong to " + network);
        }
        int s = network.node(result.sourceId()).index();
        int t = network.node(result.sinkId()).index();
        double eps = result.tolerance();

        List<FlowPath> paths = new ArrayList<>();
        int[] viaEdge = new int[network.nodeCount()];

        while (findPath(network, rest, s, t, eps, viaEdge)) {
            double amount = Double.POSITIVE_INFINITY;
            for (int v = t; v != s; v = network.edge(viaEdge[v]).from().index()) {
                amount = Math.min(amount, rest[viaEdge[v]]);
            }

            List<String> nodes = new ArrayList<>();
            for (int v = t; v != s; v = network.edge(viaEdge[v]).from().index()) {
                nodes.add(network.node(v).id());
                rest[viaEdge[v]] -= amount;
            }
            nodes.add(network.node(s).id());
            Collections.reverse(nodes);

            paths.add(new FlowPath(nodes, amount));
        }
        return paths;
    }

    private static boolean findPath(FlowNetwork g, double[] rest, int s, int t, double eps, int[] viaEdge) {
        Arrays.fill(viaEdge, -1);
        boolean[] seen = new boolean[g.nodeCount()];
        seen[s] = true;

        Queue<Integer> q = new ArrayDeque<>();
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (Edge e : g.outEdges(u)) {
                int v = e.to().index();
                if (seen[v] || rest[e.index()] <= eps) continue;
                seen[v] = true;
                viaEdge[v] = e.index();
                if (v == t) return true;
                q.add(v);
            }
        }
        return false;
    }
}
