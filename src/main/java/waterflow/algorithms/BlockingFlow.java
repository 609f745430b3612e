package waterflow.algorithms;

import waterflow.core.FlowNetwork;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;
import waterflow.trace.TraceRecorder;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;

/**
 * Dinic's algorithm for the maximum s-t flow problem.
 *
 * <p>High-level structure:
 * <ol>
 *   <li>Build a level graph with BFS on the residual network.</li>
 *   <li>On that level graph, repeatedly send augmenting paths found by DFS with the current-arc
 *       optimization until the flow in the level graph is blocking.</li>
 *   <li>Repeat until the sink is unreachable in the residual network.</li>
 * </ol>
 *
 * <p>The DFS is iterative and keeps the current path on an explicit arc stack, so deep level graphs
 * do not grow the Java call stack. Within a phase {@code ptr[u]} only advances: an arc skipped as
 * saturated or leading into a dead end is never examined again in that phase.</p>
 *
 * <p>The number of phases is bounded by the number of distinct levels ({@code < V}); one phase is one
 * iteration of the {@link ExecutionBudget}.</p>
 */
public class BlockingFlow implements MaxFlowAlgorithm {

    @Override
    public AlgorithmType type() {
        return AlgorithmType.BLOCKING_FLOW;
    }

    @Override
    public FlowResult run(FlowNetwork network, Node source, Node sink, ExecutionBudget budget,
                          double tolerance, TraceRecorder recorder) {
        RunContext ctx = new RunContext(type(), network, source, sink, budget, tolerance, recorder);
        ResidualNetwork r = ctx.residual;
        final int n = r.size();

        // level[v] = BFS distance from s in the residual network (unreachable => -1).
        int[] level = new int[n];
        // ptr[v] = "current arc" pointer for DFS in the current BFS phase.
        int[] ptr = new int[n];
        int[] stack = new int[n];

        long phases = 0L;
        TerminationReason reason = TerminationReason.CONVERGED;

        while (buildLevelGraph(r, ctx.s, ctx.t, level, ctx.eps)) {
            TerminationReason stop = ctx.interruption(phases);
            if (stop != null) {
                reason = stop;
                break;
            }

            phases++;
            ctx.phaseStarted((int) phases, level);
            Arrays.fill(ptr, 0);

            // Augment within this level graph until it becomes blocking.
            while (augmentOnce(ctx, level, ptr, stack)) {
                // keep augmenting
            }
        }

        return ctx.finish(phases, reason);
    }

    /**
     * Builds the level graph by running BFS on the residual network.
     *
     * <p>Only arcs with residual capacity above {@code eps} are traversed. The resulting levels satisfy
     * {@code level[s] = 0} and for any traversed arc {@code (u -> v)} {@code level[v] = level[u] + 1}.
     *
     * @return {@code true} iff {@code t} is reachable from {@code s} in the residual network
     */
    private static boolean buildLevelGraph(ResidualNetwork r, int s, int t, int[] level, double eps) {
        Arrays.fill(level, -1);

        Queue<Integer> q = new ArrayDeque<>();
        level[s] = 0;
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (int a : r.arcs(u)) {
                int v = r.head(a);
                if (level[v] == -1 && r.residual(a) > eps) {
                    level[v] = level[u] + 1;
                    q.add(v);
                }
            }
        }
        return level[t] != -1;
    }

    /**
     * Finds one s-t path in the level graph and augments along it.
     *
     * @return false once the phase is blocked (no s-t path left in the level graph)
     */
    private static boolean augmentOnce(RunContext ctx, int[] level, int[] ptr, int[] stack) {
        ResidualNetwork r = ctx.residual;
        final int s = ctx.s, t = ctx.t;
        int depth = 0;
        int u = s;

        while (u != t) {
            int[] arcs = r.arcs(u);
            boolean advanced = false;

            while (ptr[u] < arcs.length) {
                int a = arcs[ptr[u]];
                int v = r.head(a);
                // Only follow arcs that go "forward" in the level graph and have residual capacity.
                if (level[v] == level[u] + 1 && r.residual(a) > ctx.eps) {
                    stack[depth++] = a;
                    u = v;
                    advanced = true;
                    break;
                }
                ptr[u]++;
            }
            if (advanced) continue;

            // Pruning: u cannot reach t in the current level graph.
            level[u] = -1;
            if (u == s) return false;

            // Retreat and skip the arc that led into the dead end.
            int back = stack[--depth];
            u = r.tail(back);
            ptr[u]++;
        }

        double bottleneck = Double.POSITIVE_INFINITY;
        for (int i = 0; i < depth; i++) bottleneck = Math.min(bottleneck, r.residual(stack[i]));

        ctx.pathFound(stack, depth, bottleneck);
        for (int i = 0; i < depth; i++) ctx.push(stack[i], bottleneck);
        return true;
    }
}
