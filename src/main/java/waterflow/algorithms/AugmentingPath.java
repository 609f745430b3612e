package waterflow.algorithms;

import waterflow.core.FlowNetwork;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;
import waterflow.trace.TraceRecorder;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;

/**
 * Edmonds–Karp algorithm (Ford–Fulkerson with BFS) for computing a maximum s-t flow.
 *
 * <p>Key idea:
 * Repeatedly find a shortest (in number of edges) augmenting path in the residual network using BFS,
 * augment along it by the path bottleneck, and update residual capacities.
 *
 * <p>Complexity:
 * O(V * E^2) in general. The number of augmentations is O(V * E) independent of the capacity values,
 * so leaked (non-integer) capacities terminate as well; the {@link ExecutionBudget} is a safety net.
 *
 * <p>Determinism: BFS expands the residual arcs of each node in edge insertion order, so the path chosen
 * among several shortest paths depends only on the network.
 */
public class AugmentingPath implements MaxFlowAlgorithm {

    @Override
    public AlgorithmType type() {
        return AlgorithmType.AUGMENTING_PATH;
    }

    @Override
    public FlowResult run(FlowNetwork network, Node source, Node sink, ExecutionBudget budget,
                          double tolerance, TraceRecorder recorder) {
        RunContext ctx = new RunContext(type(), network, source, sink, budget, tolerance, recorder);
        ResidualNetwork r = ctx.residual;
        final int s = ctx.s, t = ctx.t;
        final int n = r.size();

        // prevArc[v] = residual arc used to enter v on the BFS tree (-1: unvisited).
        int[] prevArc = new int[n];
        int[] path = new int[n];
        long augmentations = 0L;
        TerminationReason reason = TerminationReason.CONVERGED;

        while (bfs(r, s, t, prevArc, ctx.eps)) {
            TerminationReason stop = ctx.interruption(augmentations);
            if (stop != null) {
                reason = stop;
                break;
            }

            // Walk t -> s to collect the path, then flip it into s -> t order.
            int len = 0;
            for (int v = t; v != s; v = r.tail(prevArc[v])) path[len++] = prevArc[v];
            reverse(path, len);

            double bottleneck = Double.POSITIVE_INFINITY;
            for (int i = 0; i < len; i++) bottleneck = Math.min(bottleneck, r.residual(path[i]));

            ctx.pathFound(path, len, bottleneck);
            for (int i = 0; i < len; i++) ctx.push(path[i], bottleneck);

            augmentations++;
        }

        return ctx.finish(augmentations, reason);
    }

    /**
     * BFS on the residual network, traversing only arcs with residual capacity above {@code eps}.
     *
     * @return true iff {@code t} was reached; {@code prevArc} then describes a shortest s-t path
     */
    private static boolean bfs(ResidualNetwork r, int s, int t, int[] prevArc, double eps) {
        Arrays.fill(prevArc, -1);
        boolean[] seen = new boolean[r.size()];
        seen[s] = true;

        Queue<Integer> q = new ArrayDeque<>();
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (int a : r.arcs(u)) {
                int v = r.head(a);
                if (seen[v] || r.residual(a) <= eps) continue;

                seen[v] = true;
                prevArc[v] = a;
                if (v == t) return true; // early exit once we reach the sink
                q.add(v);
            }
        }
        return false;
    }

    private static void reverse(int[] a, int len) {
        for (int i = 0, j = len - 1; i < j; i++, j--) {
            int tmp = a[i];
            a[i] = a[j];
            a[j] = tmp;
        }
    }
}
