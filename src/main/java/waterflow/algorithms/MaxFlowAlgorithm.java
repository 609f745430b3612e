package waterflow.algorithms;

import waterflow.core.FlowNetwork;
import waterflow.core.Node;
import waterflow.trace.TraceRecorder;

/**
 * Max-flow capability implemented by {@link AugmentingPath}, {@link BlockingFlow} and {@link PreflowPush}.
 *
 * <p>Implementations are stateless: all mutable state of a run lives in a per-run
 * {@link waterflow.core.ResidualNetwork}, so one instance may serve concurrent runs on shared networks.</p>
 */
public interface MaxFlowAlgorithm {

    double DEFAULT_TOLERANCE = 1e-9;

    AlgorithmType type();

    /**
     * Computes a maximum flow from {@code source} to {@code sink}.
     *
     * @param network   network to analyse; never modified
     * @param source    source node of {@code network}
     * @param sink      sink node of {@code network}, different from {@code source}
     * @param budget    iteration / time / cancellation limits
     * @param tolerance relative numeric tolerance; residual capacities at or below
     *                  {@code tolerance * max(1, largest capacity)} count as zero
     * @param recorder  receives the run's events; use {@link TraceRecorder#NO_OP} for none
     * @return the flow found; maximal iff its termination reason is {@link TerminationReason#CONVERGED}
     * @throws NumericInstabilityException if the run detects a numerically invalid state
     */
    FlowResult run(FlowNetwork network, Node source, Node sink, ExecutionBudget budget,
                   double tolerance, TraceRecorder recorder);

    /**
     * Runs between the network's own source and sink, without a recorder.
     */
    default FlowResult run(FlowNetwork network, ExecutionBudget budget) {
        return run(network, network.source(), network.sink(), budget, DEFAULT_TOLERANCE, TraceRecorder.NO_OP);
    }
}
