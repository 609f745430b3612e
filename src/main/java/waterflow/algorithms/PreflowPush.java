package waterflow.algorithms;

import waterflow.core.FlowNetwork;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;
import waterflow.trace.TraceRecorder;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;

/**
 * Goldberg–Tarjan Push–Relabel algorithm (preflow-push) for computing a maximum s-t flow.
 *
 * <p>Core invariants:
 * <ul>
 *   <li>We maintain a <b>preflow</b>: flow conservation may be violated at intermediate nodes.
 *       The violation is tracked as {@code excess[v]} (inflow minus outflow) and never drops below zero
 *       outside the source.</li>
 *   <li>Each node has an integer <b>height</b> {@code height[v]}, starting at {@code n} for the source and
 *       {@code 0} elsewhere, and never decreasing afterwards.
 *       Pushes are only allowed on <b>admissible</b> arcs (u->v) with
 *       {@code residual(u,v) > 0} and {@code height[u] == height[v] + 1}.</li>
 *   <li>When no admissible arc exists for an active node u, we <b>relabel</b> u to
 *       {@code 1 + min{ height[v] | (u->v) has residual capacity > 0 }}.</li>
 * </ul>
 *
 * <p>Implementation choices:
 * <ul>
 *   <li>Active nodes (excess > 0, excluding s and t) are processed in a FIFO queue. Heights stay below
 *       {@code 2n}, so excess that cannot reach the sink is eventually pushed back to the source and the
 *       final state is a flow.</li>
 *   <li>Current-arc optimization via {@code ptr[u]} avoids rescanning arc lists from scratch.</li>
 *   <li>One discharge of an active node is one iteration of the {@link ExecutionBudget}. If the budget
 *       stops the run early, the remaining intermediate excess is returned to the source along
 *       flow-carrying paths, which turns the preflow into a valid (non-maximal) flow.</li>
 * </ul>
 */
public class PreflowPush implements MaxFlowAlgorithm {

    @Override
    public AlgorithmType type() {
        return AlgorithmType.PREFLOW_PUSH;
    }

    @Override
    public FlowResult run(FlowNetwork network, Node source, Node sink, ExecutionBudget budget,
                          double tolerance, TraceRecorder recorder) {
        return new Run(new RunContext(type(), network, source, sink, budget, tolerance, recorder)).execute();
    }

    /**
     * Mutable per-run state. A new instance per run keeps {@link PreflowPush} itself stateless.
     */
    private static final class Run {

        private final RunContext ctx;
        private final ResidualNetwork r;
        private final int n;
        private final int s;
        private final int t;

        /** Node heights (labels). */
        private final int[] height;

        /** Excess flow at each node (negative at s due to initialization). */
        private final double[] excess;

        /** FIFO queue of active nodes (excluding s and t). */
        private final Queue<Integer> activeQ = new ArrayDeque<>();

        /** Whether a node is currently in {@link #activeQ}. */
        private final boolean[] inQ;

        /** Current-arc pointer per node for discharge scanning. */
        private final int[] ptr;

        Run(RunContext ctx) {
            this.ctx = ctx;
            this.r = ctx.residual;
            this.n = r.size();
            this.s = ctx.s;
            this.t = ctx.t;
            this.height = new int[n];
            this.excess = new double[n];
            this.inQ = new boolean[n];
            this.ptr = new int[n];
        }

        FlowResult execute() {
            // Initialize preflow: set height[s]=n and saturate all outgoing residual arcs of s.
            height[s] = n;
            for (int a : r.arcs(s)) {
                double send = r.residual(a);
                if (send <= ctx.eps) continue;
                push(a, send);
            }

            long discharges = 0L;
            TerminationReason reason = TerminationReason.CONVERGED;

            while (!activeQ.isEmpty()) {
                TerminationReason stop = ctx.interruption(discharges);
                if (stop != null) {
                    reason = stop;
                    break;
                }

                int u = activeQ.poll();
                inQ[u] = false;

                discharge(u);
                discharges++;

                // If u still has excess, keep it active.
                if (excess[u] > ctx.eps) activate(u);
            }

            if (reason != TerminationReason.CONVERGED) returnExcessToSource();

            return ctx.finish(discharges, reason);
        }

        /**
         * Discharge: repeatedly pushes along admissible arcs until u has no excess.
         * If no admissible arc exists, relabel u and restart scanning from the beginning.
         */
        private void discharge(int u) {
            int[] arcs = r.arcs(u);
            while (excess[u] > ctx.eps) {
                if (ptr[u] >= arcs.length) {
                    relabel(u);
                    ptr[u] = 0;
                    continue;
                }

                int a = arcs[ptr[u]];
                if (r.residual(a) > ctx.eps && height[u] == height[r.head(a)] + 1) {
                    push(a, Math.min(excess[u], r.residual(a)));
                } else {
                    ptr[u]++;
                }
            }
        }

        /**
         * Push operation: sends {@code send} along residual arc {@code a} and activates its head if it
         * starts overflowing.
         */
        private void push(int a, double send) {
            int u = r.tail(a);
            int v = r.head(a);

            ctx.push(a, send);
            excess[u] -= send;
            excess[v] += send;

            if (u != s && excess[u] < -ctx.eps) {
                throw ctx.instability("negative excess " + excess[u] + " at node " + ctx.id(u));
            }
            if (excess[v] > ctx.eps) activate(v);
        }

        private void activate(int v) {
            if (v == s || v == t || inQ[v]) return;
            activeQ.add(v);
            inQ[v] = true;
        }

        /**
         * Relabel operation: raises height[u] so that at least one outgoing residual arc becomes admissible.
         */
        private void relabel(int u) {
            int minH = Integer.MAX_VALUE;
            for (int a : r.arcs(u)) {
                if (r.residual(a) > ctx.eps) minH = Math.min(minH, height[r.head(a)]);
            }
            if (minH == Integer.MAX_VALUE) {
                // A node with excess always has a residual arc back along its inflow; without one the
                // excess is rounding residue spread over too many arcs.
                throw ctx.instability("node " + ctx.id(u) + " holds excess " + excess[u]
                        + " but has no residual arc");
            }

            int oldH = height[u];
            int newH = minH + 1;
            if (newH >= 2 * n) {
                throw ctx.instability("height of node " + ctx.id(u) + " exceeded " + (2 * n - 1));
            }
            height[u] = newH;
            ctx.relabel(u, oldH, newH);
        }

        /**
         * Converts the current preflow into a flow: for every intermediate node with excess, find a path
         * from s to it over flow-carrying edges and cancel flow along that path. Each round either empties
         * the node's excess or zeroes the flow of an edge on the path, so the loop terminates.
         */
        private void returnExcessToSource() {
            int[] viaArc = new int[n];
            int[] path = new int[n];

            for (int v = 0; v < n; v++) {
                if (v == s || v == t) continue;

                while (excess[v] > ctx.eps) {
                    if (!findFlowPathBack(v, viaArc)) {
                        throw ctx.instability("excess " + excess[v] + " at node " + ctx.id(v)
                                + " is not connected to the source by flow");
                    }

                    int len = 0;
                    for (int x = s; x != v; x = r.head(viaArc[x])) path[len++] = viaArc[x];

                    // path[] holds the forward arcs s -> ... -> v; their partners carry the flow back.
                    double delta = excess[v];
                    for (int i = 0; i < len; i++) {
                        delta = Math.min(delta, r.residual(ResidualNetwork.partner(path[i])));
                    }

                    for (int i = len - 1; i >= 0; i--) ctx.push(ResidualNetwork.partner(path[i]), delta);
                    excess[v] -= delta;
                    excess[s] += delta;
                }
            }
        }

        /**
         * BFS from {@code v} over reverse arcs whose edge carries flow above {@code eps}, i.e. backwards
         * along the flow, until the source is found.
         *
         * @param viaArc on success {@code viaArc[x]} is the reverse arc leaving x on the path x -> ... -> v
         *               walked from s; only entries on that path are meaningful
         */
        private boolean findFlowPathBack(int v, int[] viaArc) {
            Arrays.fill(viaArc, -1);
            boolean[] seen = new boolean[n];
            seen[v] = true;

            Queue<Integer> q = new ArrayDeque<>();
            q.add(v);

            while (!q.isEmpty()) {
                int x = q.poll();
                for (int a : r.arcs(x)) {
                    if (!ResidualNetwork.isReverse(a) || r.residual(a) <= ctx.eps) continue;
                    int y = r.head(a);
                    if (seen[y] || y == t) continue;
                    seen[y] = true;
                    // Arc a runs x -> y against the flow; store its partner so the path reads s -> v.
                    viaArc[y] = ResidualNetwork.partner(a);
                    if (y == s) return true;
                    q.add(y);
                }
            }
            return false;
        }
    }
}
