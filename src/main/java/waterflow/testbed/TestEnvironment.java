package waterflow.testbed;

import waterflow.algorithms.AlgorithmType;
import waterflow.algorithms.FlowResult;
import waterflow.core.Edge;
import waterflow.core.FlowNetwork;
import waterflow.core.FlowValidators;
import waterflow.core.Node;
import waterflow.core.ResidualNetwork;
import waterflow.cut.FlowPath;
import waterflow.cut.MinCut;
import waterflow.engine.AlgorithmComparison;
import waterflow.engine.FlowEngine;
import waterflow.engine.RunOptions;
import waterflow.engine.ScenarioOutcome;
import waterflow.generator.NetworkGenerator;
import waterflow.scenario.Scenario;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Test harness for the engine.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Generate batches of random water-grid instances (generation is delegated to {@link NetworkGenerator}).</li>
 *   <li>For each instance, run all max-flow variants concurrently through {@link FlowEngine#compareAll}.</li>
 *   <li>Validate each produced flow with:
 *     <ul>
 *       <li>capacity constraints</li>
 *       <li>flow conservation</li>
 *       <li>existence of a saturated s-t cut in the final residual network</li>
 *       <li>duality: flow value equals the capacity of the extracted min cut</li>
 *     </ul>
 *   </li>
 *   <li>Check whether all variants agree on the maximum flow value.</li>
 *   <li>Perform destructive sanity checks to demonstrate that the validators can detect violations:
 *     <ul>
 *       <li>Sanity A: force a flow overflow on an edge (flow &gt; capacity).</li>
 *       <li>Sanity B: break the saturated-cut property by releasing flow on a saturated cut edge.</li>
 *     </ul>
 *   </li>
 *   <li>Print the scenario report for one network: max flow, flow paths, min-cut and imbalance table.</li>
 * </ul>
 *
 * <p>Output goes to a {@link Consumer} callback, one line at a time.</p>
 */
public final class TestEnvironment {

    /** Absolute tolerance for comparing flow values in the report. */
    private static final double REPORT_TOLERANCE = 1e-6;

    private TestEnvironment() {
    }

    /**
     * One batch configuration triple: (numInstances, n, maxCap).
     */
    public static final class BatchConfig {
        public final int numInstances;
        public final int n;
        public final int maxCap;

        public BatchConfig(int numInstances, int n, int maxCap) {
            this.numInstances = numInstances;
            this.n = n;
            this.maxCap = maxCap;
        }
    }

    /**
     * Aggregated validation outcome of one batch run.
     */
    public static final class BatchSummary {
        public int instances;
        public int mismatches;
        public int failedChecks;
        public int sanityDetected;

        public boolean allOk() {
            return mismatches == 0 && failedChecks == 0 && sanityDetected == instances;
        }
    }

    /**
     * Aggregated report for one variant on one instance. If the run failed, {@code ranOK=false} and
     * the checks are forced to false to avoid misleading "OK" flags.
     */
    private static final class AlgoReport {
        String name;
        double maxFlow;
        boolean capacityOK;
        boolean conservationOK;
        boolean saturatedCutOK;
        boolean dualityOK;
        boolean ranOK;
        String errorMessage;

        boolean allOK() {
            return ranOK && capacityOK && conservationOK && saturatedCutOK && dualityOK;
        }
    }

    /* ===================== Random batches ===================== */

    /**
     * @param batches batch configurations
     * @param rng     random generator (used for instance generation)
     * @param engine  engine used to run the variants
     * @param log     consumer receiving one line at a time
     * @return totals over all batches
     */
    public static BatchSummary runBatches(List<BatchConfig> batches, Random rng, FlowEngine engine,
                                          Consumer<String> log) {
        log.accept("=== Water Network Max-Flow Test Report ===");
        log.accept("Total batches: " + batches.size());
        log.accept("------------------------------------------");

        BatchSummary total = new BatchSummary();
        int globalInstanceId = 1;

        for (BatchConfig batch : batches) {
            log.accept("");
            log.accept(">>> Batch: " + batch.numInstances + " instances, n=" + batch.n + ", maxCap=" + batch.maxCap);
            log.accept("------------------------------------------");

            BatchSummary bs = new BatchSummary();

            for (int instIdx = 0; instIdx < batch.numInstances; instIdx++, globalInstanceId++) {
                // Every other instance uses fractional (leaked) capacities.
                boolean fractional = instIdx % 2 == 1;
                FlowNetwork g = NetworkGenerator.generate(batch.n, batch.maxCap, 0.2, fractional, rng);

                AlgorithmComparison cmp = engine.compareAll(g, RunOptions.defaults());
                List<AlgoReport> reports = new ArrayList<>();
                for (AlgorithmType type : AlgorithmType.values()) {
                    reports.add(validate(engine, g, type, cmp));
                }

                boolean allAgree = cmp.agree(REPORT_TOLERANCE * Math.max(1.0, g.sourceOutCapacity()));

                log.accept("Instance #" + globalInstanceId + " (idxInBatch=" + instIdx + ", nodes="
                        + g.nodeCount() + ", edges=" + g.edgeCount() + (fractional ? ", fractional" : "") + "):");

                StringBuilder line = new StringBuilder("  maxFlow EK/Dinic/PR = ");
                for (int i = 0; i < reports.size(); i++) {
                    if (i > 0) line.append("/");
                    line.append(fmtFlow(reports.get(i)));
                }
                line.append(allAgree ? " [OK]" : " [MISMATCH]");
                log.accept(line.toString());

                for (AlgoReport r : reports) printAlgoReport(log, "    ", r);

                if (!allAgree) {
                    bs.mismatches++;
                    log.accept("    >>> WARNING: algorithms disagree on max flow value!");
                }
                if (reports.stream().anyMatch(r -> !r.allOK())) bs.failedChecks++;

                // Destructive sanity checks on a solved state.
                FlowResult solved = cmp.result(AlgorithmType.AUGMENTING_PATH);
                if (solved != null) {
                    boolean detectedA = sanityFlowOverflow(g, solved);
                    boolean detectedB = sanityBreakSaturatedCut(g, solved);
                    if (detectedA || detectedB) bs.sanityDetected++;

                    log.accept("    Sanity A (flow overflow): " + (detectedA ? "detected violation" : "NOT detected"));
                    log.accept("    Sanity B (unsaturated cut): " + (detectedB ? "detected violation" : "NOT detected"));
                }
                bs.instances++;
                log.accept("");
            }

            log.accept(String.format(Locale.ROOT,
                    "Batch summary: mismatched flows=%d / any check failed=%d / sanity OK=%d",
                    bs.mismatches, bs.failedChecks, bs.sanityDetected));

            total.instances += bs.instances;
            total.mismatches += bs.mismatches;
            total.failedChecks += bs.failedChecks;
            total.sanityDetected += bs.sanityDetected;
        }

        log.accept("=== End of Report ===");
        return total;
    }

    /* ===================== Scenario report ===================== */

    /**
     * Prints the report for one network under one scenario: max flow per variant, and for the first
     * variant the debug balances, flow paths and min-cut.
     */
    public static void runScenarioReport(FlowNetwork base, Scenario scenario, List<AlgorithmType> algorithms,
                                         RunOptions options, FlowEngine engine, boolean debug,
                                         Consumer<String> log) {
        log.accept("=== Water Network Max-Flow Simulation ===");
        log.accept("Network:  " + base);
        log.accept("Scenario: " + scenario);
        log.accept("");

        ScenarioOutcome first = null;
        for (AlgorithmType type : algorithms) {
            ScenarioOutcome out = engine.analyze(base, scenario, type, options);
            FlowResult r = out.result();
            log.accept(String.format(Locale.ROOT, "Max Flow = %.2f MLD (%s)%s", r.totalFlow(),
                    type.displayName(), r.isMaximal() ? "" : " [" + r.termination() + "]"));
            if (first == null) first = out;
        }
        if (first == null) return;

        if (debug) printDebugInfo(first, log);

        log.accept("");
        log.accept("--- Flow Paths (" + base.source().id() + " -> " + base.sink().id() + ") ---");
        if (first.paths().isEmpty()) {
            log.accept("No flow paths found.");
        } else {
            for (FlowPath p : first.paths()) {
                log.accept(String.format(Locale.ROOT, "  %s  %.2f MLD", String.join(" -> ", p.nodes()), p.amount()));
            }
        }

        log.accept("");
        log.accept("--- Min-Cut Report ---");
        MinCut cut = first.minCut();
        if (cut == null) {
            log.accept("No certified min-cut: run stopped early (" + first.result().termination() + ").");
            return;
        }
        if (cut.isEmpty()) {
            log.accept("No bottlenecks detected.");
        } else {
            for (Edge e : cut.edges()) {
                log.accept(String.format(Locale.ROOT, "  %s -> %s  capacity %.2f", e.from().id(), e.to().id(), e.capacity()));
            }
            log.accept(String.format(Locale.ROOT, "  Cut capacity: %.2f MLD", cut.capacity()));
        }
        for (Edge e : cut.zeroCapacityEdges()) {
            log.accept("  (failed pipe on cut boundary: " + e.from().id() + " -> " + e.to().id() + ")");
        }
    }

    /**
     * Net flows at source and sink, plus nodes whose forward flow is imbalanced.
     */
    private static void printDebugInfo(ScenarioOutcome out, Consumer<String> log) {
        FlowNetwork g = out.network();
        ResidualNetwork r = ResidualNetwork.withFlows(g, out.result().flowArray());
        double[] net = r.netInflow();

        log.accept("");
        log.accept("--- Debug info ---");
        log.accept("Number of predecessors of " + g.sink().id() + ": " + g.inEdges(g.sink().index()).size());
        log.accept(String.format(Locale.ROOT, "Net inflow into %s: %.2f", g.sink().id(), net[g.sink().index()]));
        log.accept(String.format(Locale.ROOT, "Net outflow from %s: %.2f", g.source().id(), -net[g.source().index()]));

        int imbalanced = 0;
        for (Node v : g.nodes()) {
            if (v.index() == g.source().index() || v.index() == g.sink().index()) continue;
            if (Math.abs(net[v.index()]) > REPORT_TOLERANCE) {
                log.accept(String.format(Locale.ROOT, "  imbalanced node %s: %.6f", v.id(), net[v.index()]));
                imbalanced++;
            }
        }
        if (imbalanced == 0) log.accept("No nodes with significant flow imbalance found");

        for (Map.Entry<String, Double> en : utilisation(g, out.result()).entrySet()) {
            log.accept(String.format(Locale.ROOT, "  pipe %s utilisation %.0f%%", en.getKey(), en.getValue() * 100.0));
        }
    }

    /**
     * @return flow/capacity per positive-capacity edge carrying flow, keyed {@code "u->v"}, in edge order
     */
    static Map<String, Double> utilisation(FlowNetwork g, FlowResult result) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (Edge e : g.edges()) {
            double f = result.flow(e.index());
            if (e.capacity() > 0.0 && f > REPORT_TOLERANCE) m.put(e.from().id() + "->" + e.to().id(), f / e.capacity());
        }
        return m;
    }

    /* ===================== Internal helpers ===================== */

    private static AlgoReport validate(FlowEngine engine, FlowNetwork g, AlgorithmType type, AlgorithmComparison cmp) {
        AlgoReport rep = new AlgoReport();
        rep.name = type.displayName();

        FlowResult result = cmp.result(type);
        if (result == null) {
            RuntimeException ex = cmp.failures().get(type);
            rep.ranOK = false;
            rep.errorMessage = ex == null ? "no result" : ex.getClass().getSimpleName() + ": " + ex.getMessage();
            rep.maxFlow = Double.NaN;
            return rep;
        }

        int s = g.source().index();
        int t = g.sink().index();
        double tol = result.tolerance() * Math.max(1, g.edgeCount());
        ResidualNetwork r = ResidualNetwork.withFlows(g, result.flowArray());

        rep.maxFlow = result.totalFlow();
        rep.capacityOK = FlowValidators.capacityConstraints(r, tol);
        rep.conservationOK = FlowValidators.flowConservation(r, s, t, tol);
        rep.saturatedCutOK = FlowValidators.saturatedCutExists(r, s, t, result.tolerance());
        if (result.isMaximal()) {
            MinCut cut = engine.extractMinCut(g, result);
            rep.dualityOK = Math.abs(cut.capacity() - result.totalFlow()) <= REPORT_TOLERANCE * Math.max(1.0, cut.capacity());
        }
        rep.ranOK = true;
        return rep;
    }

    private static void printAlgoReport(Consumer<String> log, String indent, AlgoReport r) {
        log.accept(indent + r.name + (r.ranOK ? ":" : " [FAILED]: " + r.errorMessage));
        log.accept(indent + "  capacity constraints: " + (r.capacityOK ? "OK" : "FAIL"));
        log.accept(indent + "  flow conservation:    " + (r.conservationOK ? "OK" : "FAIL"));
        log.accept(indent + "  saturated cut exists: " + (r.saturatedCutOK ? "OK" : "FAIL"));
        log.accept(indent + "  flow equals cut:      " + (r.dualityOK ? "OK" : "FAIL"));
    }

    /**
     * Pretty-prints the max-flow value; uses 'X' if the variant failed.
     */
    private static String fmtFlow(AlgoReport r) {
        return r.ranOK ? String.format(Locale.ROOT, "%.2f", r.maxFlow) : "X";
    }

    /**
     * Sanity A:
     * Corrupt a solved state by forcing the first edge's flow above its capacity.
     *
     * @return true iff at least one validator detects a violation
     */
    static boolean sanityFlowOverflow(FlowNetwork g, FlowResult solved) {
        if (g.edgeCount() == 0) return true;
        ResidualNetwork r = ResidualNetwork.withFlows(g, solved.flowArray());
        r.overrideFlow(0, r.capacity(0) + 123);
        return !allValidatorsPass(r, g, solved.tolerance());
    }

    /**
     * Sanity B:
     * Break the saturated-cut certificate: find a saturated edge crossing the final cut and release one
     * unit of its flow (or all of it if it carries less), which leaves residual capacity across the cut.
     *
     * @return true iff any validator detects the injected violation
     */
    static boolean sanityBreakSaturatedCut(FlowNetwork g, FlowResult solved) {
        ResidualNetwork r = ResidualNetwork.withFlows(g, solved.flowArray());
        boolean[] inS = r.residualReachable(g.source().index(), solved.tolerance());

        for (Edge e : g.edges()) {
            if (!inS[e.from().index()] || inS[e.to().index()]) continue;
            if (e.capacity() <= 0.0) continue;
            r.overrideFlow(e.index(), Math.max(0.0, r.flow(e.index()) - 1.0));
            return !allValidatorsPass(r, g, solved.tolerance());
        }
        // No crossing edge with capacity (flow 0): nothing to corrupt, the cut certificate is trivially sound.
        return true;
    }

    private static boolean allValidatorsPass(ResidualNetwork r, FlowNetwork g, double tol) {
        int s = g.source().index();
        int t = g.sink().index();
        return FlowValidators.capacityConstraints(r, tol)
                && FlowValidators.flowConservation(r, s, t, tol)
                && FlowValidators.saturatedCutExists(r, s, t, tol);
    }
}
