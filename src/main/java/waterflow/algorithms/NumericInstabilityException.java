package waterflow.algorithms;

/**
 * Thrown when a run detects flow, residual capacity or excess outside the numeric tolerance in a
 * direction the max-flow invariants forbid. The run is aborted; the input network is unaffected.
 */
public class NumericInstabilityException extends RuntimeException {

    private final AlgorithmType algorithm;

    public NumericInstabilityException(AlgorithmType algorithm, String message) {
        super(algorithm.displayName() + ": " + message);
        this.algorithm = algorithm;
    }

    public AlgorithmType algorithm() {
        return algorithm;
    }
}
