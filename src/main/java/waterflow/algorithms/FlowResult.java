package waterflow.algorithms;

import waterflow.core.EdgeKey;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one max-flow run.
 *
 * <p>Holds the per-edge flow assignment (indexed like the network's edges), the total value, which
 * variant produced it, how many iterations it took and why it stopped. Together with the network the
 * per-edge flows fully determine the final residual state, which is what
 * {@link waterflow.cut.MinCutExtractor} works from.</p>
 *
 * <p>{@link #equals} ignores the elapsed time, so two runs of the same variant on the same network
 * compare equal exactly when their flows, totals, iteration counts and termination reasons agree.</p>
 */
public final class FlowResult {

    private final AlgorithmType algorithm;
    private final String sourceId;
    private final String sinkId;
    private final double totalFlow;
    private final double[] flows;
    private final List<EdgeKey> edgeKeys;
    private final long iterations;
    private final TerminationReason termination;
    private final double tolerance;
    private final Duration elapsed;

    public FlowResult(AlgorithmType algorithm,
                      String sourceId,
                      String sinkId,
                      double totalFlow,
                      double[] flows,
                      List<EdgeKey> edgeKeys,
                      long iterations,
                      TerminationReason termination,
                      double tolerance,
                      Duration elapsed) {
        if (flows.length != edgeKeys.size()) {
            throw new IllegalArgumentException("flows and edge keys differ in length");
        }
        this.algorithm = Objects.requireNonNull(algorithm);
        this.sourceId = Objects.requireNonNull(sourceId);
        this.sinkId = Objects.requireNonNull(sinkId);
        this.totalFlow = totalFlow;
        this.flows = Arrays.copyOf(flows, flows.length);
        this.edgeKeys = List.copyOf(edgeKeys);
        this.iterations = iterations;
        this.termination = Objects.requireNonNull(termination);
        this.tolerance = tolerance;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public AlgorithmType algorithm() {
        return algorithm;
    }

    public String sourceId() {
        return sourceId;
    }

    public String sinkId() {
        return sinkId;
    }

    /** @return net flow leaving the source */
    public double totalFlow() {
        return totalFlow;
    }

    /** @return flow on the edge with the given index */
    public double flow(int edgeIndex) {
        return flows[edgeIndex];
    }

    /**
     * @throws IllegalArgumentException if the edge is not part of the network this result belongs to
     */
    public double flow(EdgeKey key) {
        int i = edgeKeys.indexOf(key);
        if (i < 0) throw new IllegalArgumentException("Unknown edge " + key);
        return flows[i];
    }

    /** @return copy of the flows, indexed by edge index */
    public double[] flowArray() {
        return Arrays.copyOf(flows, flows.length);
    }

    /** @return flows keyed by edge identity, in edge index order */
    public Map<EdgeKey, Double> edgeFlows() {
        Map<EdgeKey, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < flows.length; i++) m.put(edgeKeys.get(i), flows[i]);
        return Collections.unmodifiableMap(m);
    }

    public long iterations() {
        return iterations;
    }

    public TerminationReason termination() {
        return termination;
    }

    /** @return true iff the run converged, i.e. {@link #totalFlow()} is the maximum flow */
    public boolean isMaximal() {
        return termination == TerminationReason.CONVERGED;
    }

    /** @return absolute tolerance the run treated as zero residual capacity */
    public double tolerance() {
        return tolerance;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowResult)) return false;
        FlowResult other = (FlowResult) o;
        return algorithm == other.algorithm
                && Double.compare(totalFlow, other.totalFlow) == 0
                && iterations == other.iterations
                && termination == other.termination
                && sourceId.equals(other.sourceId)
                && sinkId.equals(other.sinkId)
                && Arrays.equals(flows, other.flows)
                && edgeKeys.equals(other.edgeKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, totalFlow, iterations, termination, sourceId, sinkId,
                Arrays.hashCode(flows));
    }

    @Override
    public String toString() {
        return "FlowResult{" + algorithm.displayName() + ", total=" + totalFlow
                + ", iterations=" + iterations + ", " + termination + "}";
    }
}
