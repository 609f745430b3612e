package waterflow.engine;

import waterflow.algorithms.ExecutionBudget;
import waterflow.algorithms.MaxFlowAlgorithm;
import waterflow.trace.TraceRecorder;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Options of one engine run. Immutable; every {@code with*} method returns a modified copy.
 *
 * <p>Defaults: {@value ExecutionBudget#DEFAULT_MAX_ITERATIONS} iterations, tolerance
 * {@value MaxFlowAlgorithm#DEFAULT_TOLERANCE}, no timeout, no cancellation, no trace.</p>
 */
public final class RunOptions {

    private static final RunOptions DEFAULTS = new RunOptions(ExecutionBudget.DEFAULT_MAX_ITERATIONS,
            MaxFlowAlgorithm.DEFAULT_TOLERANCE, false, null, null, null);

    private final long maxIterations;
    private final double tolerance;
    private final boolean trace;
    private final TraceRecorder recorder;
    private final Duration timeout;
    private final BooleanSupplier cancellation;

    private RunOptions(long maxIterations, double tolerance, boolean trace, TraceRecorder recorder,
                       Duration timeout, BooleanSupplier cancellation) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.trace = trace;
        this.recorder = recorder;
        this.timeout = timeout;
        this.cancellation = cancellation;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public RunOptions withMaxIterations(long maxIterations) {
        if (maxIterations < 0) throw new IllegalArgumentException("maxIterations must be >= 0: " + maxIterations);
        return new RunOptions(maxIterations, tolerance, trace, recorder, timeout, cancellation);
    }

    public RunOptions withTolerance(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be finite and >= 0: " + tolerance);
        }
        return new RunOptions(maxIterations, tolerance, trace, recorder, timeout, cancellation);
    }

    /**
     * Enables tracing. Without an explicit {@link #withRecorder recorder} the events are logged at DEBUG.
     */
    public RunOptions withTrace(boolean trace) {
        return new RunOptions(maxIterations, tolerance, trace, recorder, timeout, cancellation);
    }

    /** Attaches a recorder and enables tracing. */
    public RunOptions withRecorder(TraceRecorder recorder) {
        return new RunOptions(maxIterations, tolerance, recorder != null, recorder, timeout, cancellation);
    }

    public RunOptions withTimeout(Duration timeout) {
        return new RunOptions(maxIterations, tolerance, trace, recorder, timeout, cancellation);
    }

    public RunOptions withCancellation(BooleanSupplier cancellation) {
        return new RunOptions(maxIterations, tolerance, trace, recorder, timeout, cancellation);
    }

    public long maxIterations() {
        return maxIterations;
    }

    public double tolerance() {
        return tolerance;
    }

    public boolean trace() {
        return trace;
    }

    /** @return explicitly attached recorder, or null */
    public TraceRecorder recorder() {
        return recorder;
    }

    public Duration timeout() {
        return timeout;
    }

    public BooleanSupplier cancellation() {
        return cancellation;
    }

    ExecutionBudget budget() {
        ExecutionBudget b = ExecutionBudget.iterations(maxIterations);
        if (timeout != null) b = b.withTimeout(timeout);
        if (cancellation != null) b = b.withCancellation(cancellation);
        return b;
    }

    @Override
    public String toString() {
        return "RunOptions{maxIterations=" + maxIterations + ", tolerance=" + tolerance
                + ", trace=" + trace + ", timeout=" + timeout + "}";
    }
}
