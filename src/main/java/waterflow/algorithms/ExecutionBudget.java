package waterflow.algorithms;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Limits on one run: iteration count, optional wall-clock timeout and an optional cooperative
 * cancellation signal.
 *
 * <p>What counts as an iteration depends on the variant: one augmentation for
 * {@link AugmentingPath}, one phase for {@link BlockingFlow}, one discharge of an active node for
 * {@link PreflowPush}. Limits are checked only between iterations, so a stopped run always holds a
 * valid flow.</p>
 */
public final class ExecutionBudget {

    public static final long DEFAULT_MAX_ITERATIONS = 1_000_000L;

    private static final BooleanSupplier NEVER = () -> false;

    private final long maxIterations;
    private final Duration timeout;
    private final BooleanSupplier cancelled;

    private ExecutionBudget(long maxIterations, Duration timeout, BooleanSupplier cancelled) {
        if (maxIterations < 0) throw new IllegalArgumentException("maxIterations must be >= 0: " + maxIterations);
        if (timeout != null && timeout.isNegative()) throw new IllegalArgumentException("timeout must be >= 0");
        this.maxIterations = maxIterations;
        this.timeout = timeout;
        this.cancelled = cancelled;
    }

    public static ExecutionBudget defaults() {
        return iterations(DEFAULT_MAX_ITERATIONS);
    }

    public static ExecutionBudget iterations(long maxIterations) {
        return new ExecutionBudget(maxIterations, null, NEVER);
    }

    public static ExecutionBudget unlimited() {
        return iterations(Long.MAX_VALUE);
    }

    public ExecutionBudget withTimeout(Duration timeout) {
        return new ExecutionBudget(maxIterations, timeout, cancelled);
    }

    /**
     * @param cancelled polled between iterations; once it returns true the run stops with
     *                  {@link TerminationReason#CANCELLED}
     */
    public ExecutionBudget withCancellation(BooleanSupplier cancelled) {
        return new ExecutionBudget(maxIterations, timeout, cancelled == null ? NEVER : cancelled);
    }

    public long maxIterations() {
        return maxIterations;
    }

    /** @return timeout, or null if the run has no deadline */
    public Duration timeout() {
        return timeout;
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    @Override
    public String toString() {
        return "ExecutionBudget{maxIterations=" + maxIterations + ", timeout=" + timeout + "}";
    }
}
