package waterflow.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waterflow.core.Edge;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.FlowValidators;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;
import waterflow.trace.PathFound;
import waterflow.trace.PhaseStarted;
import waterflow.trace.Push;
import waterflow.trace.Relabel;
import waterflow.trace.TraceRecorder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * State shared by the three variants during one run: the residual arena, budget bookkeeping,
 * event sequencing, and the final validation that turns the arena into a {@link FlowResult}.
 */
final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    final AlgorithmType type;
    final FlowNetwork network;
    final ResidualNetwork residual;
    final int s;
    final int t;
    /** Absolute zero threshold for residual capacities and excesses. */
    final double eps;

    private final ExecutionBudget budget;
    private final TraceRecorder recorder;
    private final boolean tracing;
    private final long startNanos;
    /** Long.MAX_VALUE when the run has no timeout. */
    private final long timeoutNanos;
    private long sequence;

    RunContext(AlgorithmType type, FlowNetwork network, Node source, Node sink,
               ExecutionBudget budget, double tolerance, TraceRecorder recorder) {
        if (source.index() >= network.nodeCount() || !network.node(source.index()).equals(source)) {
            throw new IllegalArgumentException("Source " + source + " is not a node of " + network);
        }
        if (sink.index() >= network.nodeCount() || !network.node(sink.index()).equals(sink)) {
            throw new IllegalArgumentException("Sink " + sink + " is not a node of " + network);
        }
        if (source.index() == sink.index()) throw new IllegalArgumentException("Source and sink must differ: " + source);
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be finite and >= 0: " + tolerance);
        }

        this.type = type;
        this.network = network;
        this.residual = new ResidualNetwork(network);
        this.s = source.index();
        this.t = sink.index();
        this.budget = budget;
        this.recorder = recorder == null ? TraceRecorder.NO_OP : recorder;
        this.tracing = this.recorder != TraceRecorder.NO_OP;

        double maxCap = 0.0;
        for (Edge e : network.edges()) maxCap = Math.max(maxCap, e.capacity());
        this.eps = tolerance * Math.max(1.0, maxCap);

        this.startNanos = System.nanoTime();
        this.timeoutNanos = saturatedNanos(budget.timeout());
    }

    private static long saturatedNanos(Duration timeout) {
        if (timeout == null) return Long.MAX_VALUE;
        try {
            return timeout.toNanos();
        } catch (ArithmeticException tooLong) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Checked before starting iteration number {@code done + 1}.
     *
     * @return why the run must stop, or null if it may continue
     */
    TerminationReason interruption(long done) {
        if (budget.isCancelled()) return TerminationReason.CANCELLED;
        if (done >= budget.maxIterations()) return TerminationReason.BUDGET_EXCEEDED;
        if (timeoutNanos != Long.MAX_VALUE && System.nanoTime() - startNanos >= timeoutNanos) {
            return TerminationReason.BUDGET_EXCEEDED;
        }
        return null;
    }

    boolean tracing() {
        return tracing;
    }

    String id(int node) {
        return network.node(node).id();
    }

    /** Pushes on the arena and reports the push to the recorder. */
    void push(int arc, double amount) {
        residual.push(arc, amount);
        if (tracing) {
            recorder.record(new Push(sequence++, ResidualNetwork.edgeOf(arc), id(residual.tail(arc)),
                    id(residual.head(arc)), amount, ResidualNetwork.isReverse(arc)));
        }
    }

    /**
     * @param arcs  path arcs in source-to-sink order, {@code arcs[0..len-1]}
     */
    void pathFound(int[] arcs, int len, double bottleneck) {
        if (!tracing) return;
        List<String> nodes = new ArrayList<>(len + 1);
        nodes.add(id(residual.tail(arcs[0])));
        for (int i = 0; i < len; i++) nodes.add(id(residual.head(arcs[i])));
        recorder.record(new PathFound(sequence++, nodes, bottleneck));
    }

    void phaseStarted(int phase, int[] levels) {
        if (tracing) recorder.record(new PhaseStarted(sequence++, phase, levels));
    }

    void relabel(int node, int oldHeight, int newHeight) {
        if (tracing) recorder.record(new Relabel(sequence++, id(node), oldHeight, newHeight));
    }

    NumericInstabilityException instability(String message) {
        log.warn("{} aborted on {}: {}", type.displayName(), network, message);
        return new NumericInstabilityException(type, message);
    }

    /**
     * Validates the arena and packages it as a result.
     *
     * @throws NumericInstabilityException if a capacity or conservation check fails beyond tolerance
     */
    FlowResult finish(long iterations, TerminationReason reason) {
        int badEdge = FlowValidators.firstCapacityViolation(residual, eps);
        if (badEdge >= 0) {
            throw instability("flow " + residual.flow(badEdge) + " outside [0, " + residual.capacity(badEdge)
                    + "] on edge " + network.edge(badEdge).key());
        }
        int badNode = FlowValidators.firstConservationViolation(residual, s, t, eps);
        if (badNode >= 0) {
            throw instability("conservation violated at node " + id(badNode)
                    + " (imbalance " + residual.netInflow()[badNode] + ")");
        }

        double[] net = residual.netInflow();
        double total = -net[s];
        if (total <= 0.0 && total >= -eps) total = 0.0;

        List<EdgeKey> keys = new ArrayList<>(network.edgeCount());
        for (Edge e : network.edges()) keys.add(e.key());

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        FlowResult result = new FlowResult(type, id(s), id(t), total, residual.flows(), keys,
                iterations, reason, eps, elapsed);

        if (reason == TerminationReason.CONVERGED) {
            log.debug("{} converged on {}: flow={} after {} iterations in {} ms",
                    type.displayName(), network, total, iterations, elapsed.toMillis());
        } else {
            log.warn("{} stopped early ({}) on {}: flow={} after {} iterations",
                    type.displayName(), reason, network, total, iterations);
        }
        return result;
    }
}
