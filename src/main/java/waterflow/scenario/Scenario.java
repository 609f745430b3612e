package waterflow.scenario;

import waterflow.core.EdgeKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Perturbation of a water network: proportional leakage and pipe failures.
 *
 * <p>A scenario is an immutable value independent of any particular network. It is checked against
 * a network only when {@link ScenarioBuilder#apply applied}:
 * <ul>
 *   <li>{@code defaultLeakage} applies to every edge without an override,</li>
 *   <li>{@code leakageOverrides} replace the default for individual edges,</li>
 *   <li>{@code failedEdges} are forced to capacity 0 regardless of leakage.</li>
 * </ul>
 */
public final class Scenario {

    private static final Scenario NONE = new Scenario(0.0, Collections.emptyMap(), Collections.emptySet());

    private final double defaultLeakage;
    private final Map<EdgeKey, Double> leakageOverrides;
    private final Set<EdgeKey> failedEdges;

    private Scenario(double defaultLeakage, Map<EdgeKey, Double> overrides, Set<EdgeKey> failed) {
        this.defaultLeakage = defaultLeakage;
        this.leakageOverrides = overrides;
        this.failedEdges = failed;
    }

    /** @return the unperturbed scenario (no leakage, no failures) */
    public static Scenario none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double defaultLeakage() {
        return defaultLeakage;
    }

    public Map<EdgeKey, Double> leakageOverrides() {
        return leakageOverrides;
    }

    public Set<EdgeKey> failedEdges() {
        return failedEdges;
    }

    /** @return leakage fraction effective for {@code key}, ignoring failures */
    public double leakageFor(EdgeKey key) {
        Double f = leakageOverrides.get(key);
        return f != null ? f : defaultLeakage;
    }

    public boolean isFailed(EdgeKey key) {
        return failedEdges.contains(key);
    }

    @Override
    public String toString() {
        return "Scenario{defaultLeakage=" + defaultLeakage
                + ", overrides=" + leakageOverrides.size()
                + ", failed=" + failedEdges + "}";
    }

    public static final class Builder {

        private double defaultLeakage = 0.0;
        private final Map<EdgeKey, Double> overrides = new LinkedHashMap<>();
        private final Set<EdgeKey> failed = new LinkedHashSet<>();

        private Builder() {
        }

        /** Leakage fraction in {@code [0,1)} applied to every edge without an override. */
        public Builder defaultLeakage(double fraction) {
            this.defaultLeakage = fraction;
            return this;
        }

        /** Same as {@link #defaultLeakage(double)} with the value given in percent. */
        public Builder defaultLeakagePercent(double percent) {
            return defaultLeakage(percent / 100.0);
        }

        public Builder leakage(EdgeKey edge, double fraction) {
            overrides.put(edge, fraction);
            return this;
        }

        public Builder fail(EdgeKey edge) {
            failed.add(edge);
            return this;
        }

        public Builder failAll(Iterable<EdgeKey> edges) {
            for (EdgeKey k : edges) failed.add(k);
            return this;
        }

        public Scenario build() {
            return new Scenario(defaultLeakage,
                    Collections.unmodifiableMap(new LinkedHashMap<>(overrides)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(failed)));
        }
    }
}
