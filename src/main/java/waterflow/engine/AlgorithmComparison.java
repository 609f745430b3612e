package waterflow.engine;

import waterflow.algorithms.AlgorithmType;
import waterflow.algorithms.FlowResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Results of running several variants on the same network. A variant that failed appears in
 * {@link #failures()} instead of {@link #results()}.
 */
public final class AlgorithmComparison {

    private final Map<AlgorithmType, FlowResult> results;
    private final Map<AlgorithmType, RuntimeException> failures;

    AlgorithmComparison(EnumMap<AlgorithmType, FlowResult> results,
                        EnumMap<AlgorithmType, RuntimeException> failures) {
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
        this.failures = Collections.unmodifiableMap(failures.isEmpty()
                ? new EnumMap<>(AlgorithmType.class) : new EnumMap<>(failures));
    }

    public Map<AlgorithmType, FlowResult> results() {
        return results;
    }

    public Map<AlgorithmType, RuntimeException> failures() {
        return failures;
    }

    public FlowResult result(AlgorithmType type) {
        return results.get(type);
    }

    /**
     * @return true iff no variant failed and all totals lie within {@code tolerance} of each other
     */
    public boolean agree(double tolerance) {
        if (!failures.isEmpty() || results.isEmpty()) return false;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (FlowResult r : results.values()) {
            min = Math.min(min, r.totalFlow());
            max = Math.max(max, r.totalFlow());
        }
        return max - min <= tolerance;
    }

    @Override
    public String toString() {
        return "AlgorithmComparison{results=" + results + ", failures=" + failures.keySet() + "}";
    }
}
