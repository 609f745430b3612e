package waterflow.core;

/**
 * Validators for flows held in a {@link ResidualNetwork}.
 *
 * <p>These checks verify the correctness properties every result of the engine must satisfy:
 * <ol>
 *   <li><b>Capacity constraints</b>: {@code 0 <= flow <= capacity} on every edge</li>
 *   <li><b>Flow conservation</b> at all intermediate nodes</li>
 *   <li><b>Value agreement</b>: outflow of the source equals inflow of the sink</li>
 *   <li><b>Existence of a saturated s-t cut</b> in the residual network (max-flow certificate)</li>
 * </ol>
 *
 * <p>Capacities are floating-point, so every comparison accepts a deviation of {@code tolerance}.
 * The engine runs the first two checks after each run and turns a failure into a
 * {@code NumericInstabilityException}; the testbed and the tests use all four.</p>
 */
public final class FlowValidators {

    private FlowValidators() {
    }

    /**
     * Capacity constraints: for every edge verify {@code -tol <= flow <= capacity + tol}.
     */
    public static boolean capacityConstraints(ResidualNetwork r, double tolerance) {
        return firstCapacityViolation(r, tolerance) < 0;
    }

    /**
     * @return index of the first edge whose flow is outside {@code [-tol, capacity + tol]}, or -1
     */
    public static int firstCapacityViolation(ResidualNetwork r, double tolerance) {
        int m = r.network().edgeCount();
        for (int e = 0; e < m; e++) {
            double f = r.flow(e);
            if (Double.isNaN(f) || f < -tolerance || f > r.capacity(e) + tolerance) return e;
        }
        return -1;
    }

    /**
     * Flow conservation: {@code |inflow - outflow| <= tol} at every node except {@code s} and {@code t}.
     *
     * <p>The tolerance is scaled by the node degree, since each incident edge may carry its own
     * rounding residue.</p>
     */
    public static boolean flowConservation(ResidualNetwork r, int s, int t, double tolerance) {
        return firstConservationViolation(r, s, t, tolerance) < 0;
    }

    /**
     * @return index of the first intermediate node violating conservation, or -1
     */
    public static int firstConservationViolation(ResidualNetwork r, int s, int t, double tolerance) {
        double[] net = r.netInflow();

        for (int u = 0; u < net.length; u++) {
            if (u == s || u == t) continue;
            int degree = Math.max(1, r.arcs(u).length);
            if (Double.isNaN(net[u]) || Math.abs(net[u]) > tolerance * degree) return u;
        }
        return -1;
    }

    /**
     * Value agreement: net outflow of {@code s} equals net inflow of {@code t}.
     */
    public static boolean valueAgreement(ResidualNetwork r, int s, int t, double tolerance) {
        double[] net = r.netInflow();
        double out = -net[s];
        double in = net[t];
        return Math.abs(out - in) <= tolerance * Math.max(1, r.network().edgeCount());
    }

    /**
     * Saturated cut existence check (a standard max-flow optimality certificate):
     *
     * <p>Compute the set S of nodes reachable from {@code s} in the residual network using only arcs
     * with residual capacity above {@code tol}. Then require:
     * <ol>
     *   <li>{@code t} is not reachable</li>
     *   <li>every edge crossing from S to V\S has residual capacity {@code <= tol}</li>
     *   <li>every edge crossing from V\S back to S carries flow {@code <= tol}</li>
     * </ol>
     * The last two follow from the first by construction of S; they are checked anyway so a corrupted
     * state that happens to keep the sink unreachable is still caught.
     */
    public static boolean saturatedCutExists(ResidualNetwork r, int s, int t, double tolerance) {
        boolean[] inS = r.residualReachable(s, tolerance);

        if (inS[t]) return false;

        for (Edge e : r.network().edges()) {
            boolean fromInS = inS[e.from().index()];
            boolean toInS = inS[e.to().index()];
            if (fromInS && !toInS && r.capacity(e.index()) - r.flow(e.index()) > tolerance) return false;
            if (!fromInS && toInS && r.flow(e.index()) > tolerance) return false;
        }
        return true;
    }
}
