package waterflow.engine;

import waterflow.algorithms.FlowResult;

/**
 * One sample of a leakage sweep: the uniform leakage fraction and the run at that level, or the
 * exception that run failed with.
 */
public final class LeakagePoint {

    private final double leakage;
    private final FlowResult result;
    private final RuntimeException failure;

    LeakagePoint(double leakage, FlowResult result, RuntimeException failure) {
        this.leakage = leakage;
        this.result = result;
        this.failure = failure;
    }

    public double leakage() {
        return leakage;
    }

    /** @return the run's result, or null if it failed */
    public FlowResult result() {
        return result;
    }

    /** @return the failure, or null if the run succeeded */
    public RuntimeException failure() {
        return failure;
    }

    public boolean failed() {
        return failure != null;
    }

    /** @return total flow, or {@code NaN} if the run failed */
    public double maxFlow() {
        return result == null ? Double.NaN : result.totalFlow();
    }

    @Override
    public String toString() {
        return failed() ? leakage + " -> " + failure : leakage + " -> " + result.totalFlow();
    }
}
