package waterflow.algorithms;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import waterflow.core.Edge;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.FlowValidators;
import waterflow.core.ResidualNetwork;
import waterflow.cut.FlowDecomposition;
import waterflow.cut.FlowPath;
import waterflow.cut.MinCut;
import waterflow.cut.MinCutExtractor;
import waterflow.generator.NetworkGenerator;
import waterflow.scenario.Scenario;
import waterflow.scenario.ScenarioBuilder;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/// Properties every max-flow variant must satisfy on random water grids.
/// Networks come from the generator so every instance is reproducible from its seed.
class MaxFlowPropertyTests {

    private static FlowNetwork network(long seed, int n, boolean fractional) {
        return NetworkGenerator.generate(n, 40, 0.25, fractional, new Random(seed));
    }

    private static FlowResult solve(AlgorithmType type, FlowNetwork g) {
        return type.create().run(g, ExecutionBudget.defaults());
    }

    private static double slack(double value) {
        return 1e-6 * Math.max(1.0, Math.abs(value));
    }

    /// All three variants find the same maximum.
    @Property(tries = 60)
    void variantsAgree(@ForAll long seed, @ForAll @IntRange(min = 3, max = 40) int n, @ForAll boolean fractional) {
        FlowNetwork g = network(seed, n, fractional);

        Map<AlgorithmType, Double> totals = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : AlgorithmType.values()) totals.put(type, solve(type, g).totalFlow());

        double ek = totals.get(AlgorithmType.AUGMENTING_PATH);
        assertThat(totals.values()).allSatisfy(v -> assertThat(v).isCloseTo(ek, within(slack(ek))));
    }

    /// Every result is a feasible flow and its value equals the capacity of the extracted cut.
    @Property(tries = 60)
    void flowIsFeasibleAndMatchesCut(@ForAll long seed, @ForAll @IntRange(min = 3, max = 40) int n,
                                     @ForAll boolean fractional) {
        FlowNetwork g = network(seed, n, fractional);
        int s = g.source().index();
        int t = g.sink().index();

        for (AlgorithmType type : AlgorithmType.values()) {
            FlowResult r = solve(type, g);
            ResidualNetwork res = ResidualNetwork.withFlows(g, r.flowArray());
            double tol = r.tolerance() * g.edgeCount();

            assertThat(FlowValidators.capacityConstraints(res, tol)).isTrue();
            assertThat(FlowValidators.flowConservation(res, s, t, tol)).isTrue();
            assertThat(FlowValidators.saturatedCutExists(res, s, t, r.tolerance())).isTrue();

            MinCut cut = MinCutExtractor.extract(g, r);
            assertThat(cut.capacity()).isCloseTo(r.totalFlow(), within(slack(r.totalFlow())));
            assertThat(cut.sourceSide()).contains(g.source().id()).doesNotContain(g.sink().id());
        }
    }

    /// Failing every pipe of a minimum cut leaves nothing for the sink.
    @Property(tries = 40)
    void failingTheCutStopsAllFlow(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n) {
        FlowNetwork g = network(seed, n, false);
        MinCut cut = MinCutExtractor.extract(g, solve(AlgorithmType.BLOCKING_FLOW, g));

        List<EdgeKey> failed = new ArrayList<>();
        for (Edge e : cut.edges()) failed.add(e.key());
        FlowNetwork broken = ScenarioBuilder.apply(g, Scenario.builder().failAll(failed).build());

        for (AlgorithmType type : AlgorithmType.values()) {
            assertThat(solve(type, broken).totalFlow()).isCloseTo(0.0, within(1e-9));
        }
    }

    /// A uniform leakage scales the maximum flow by the remaining fraction.
    @Property(tries = 40)
    void uniformLeakageScalesTheMaximum(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n,
                                        @ForAll @DoubleRange(min = 0.0, max = 0.95) double leakage) {
        FlowNetwork g = network(seed, n, true);
        double base = solve(AlgorithmType.PREFLOW_PUSH, g).totalFlow();

        FlowNetwork leaked = ScenarioBuilder.apply(g, Scenario.builder().defaultLeakage(leakage).build());
        double expected = base * (1.0 - leakage);

        for (AlgorithmType type : AlgorithmType.values()) {
            double got = solve(type, leaked).totalFlow();
            assertThat(got).isCloseTo(expected, within(slack(base)));
            assertThat(got).isLessThanOrEqualTo(base + slack(base));
        }
    }

    /// Losing every pipe out of the source is total loss.
    @Property(tries = 20)
    void totalLossAtTheSource(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n) {
        FlowNetwork g = network(seed, n, true);
        List<EdgeKey> failed = new ArrayList<>();
        for (Edge e : g.outEdges(g.source().index())) failed.add(e.key());

        FlowNetwork dry = ScenarioBuilder.apply(g, Scenario.builder().failAll(failed).build());

        for (AlgorithmType type : AlgorithmType.values()) {
            assertThat(solve(type, dry).totalFlow()).isEqualTo(0.0);
        }
    }

    /// The empty scenario reproduces the base network's result exactly.
    @Property(tries = 20)
    void emptyScenarioChangesNothing(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n) {
        FlowNetwork g = network(seed, n, true);
        FlowNetwork same = ScenarioBuilder.apply(g, Scenario.none());

        for (AlgorithmType type : AlgorithmType.values()) {
            assertThat(solve(type, same)).isEqualTo(solve(type, g));
        }
    }

    /// Paths of a decomposition add up to the total and each starts at the source and ends at the sink.
    @Property(tries = 40)
    void decompositionAddsUp(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n,
                             @ForAll boolean fractional) {
        FlowNetwork g = network(seed, n, fractional);

        for (AlgorithmType type : AlgorithmType.values()) {
            FlowResult r = solve(type, g);
            List<FlowPath> paths = FlowDecomposition.decompose(g, r);
            double sum = 0.0;
            for (FlowPath p : paths) {
                sum += p.amount();
                assertThat(p.nodes().get(0)).isEqualTo(g.source().id());
                assertThat(p.nodes().get(p.nodes().size() - 1)).isEqualTo(g.sink().id());
            }
            assertThat(sum).isCloseTo(r.totalFlow(), within(slack(r.totalFlow())));
        }
    }

    /// A run stopped after one iteration still returns a feasible flow.
    @Property(tries = 40)
    void earlyStopKeepsAFeasibleFlow(@ForAll long seed, @ForAll @IntRange(min = 3, max = 30) int n,
                                     @ForAll boolean fractional) {
        FlowNetwork g = network(seed, n, fractional);
        int s = g.source().index();
        int t = g.sink().index();
        double max = solve(AlgorithmType.AUGMENTING_PATH, g).totalFlow();

        for (AlgorithmType type : AlgorithmType.values()) {
            FlowResult r = type.create().run(g, ExecutionBudget.iterations(1));
            ResidualNetwork res = ResidualNetwork.withFlows(g, r.flowArray());
            double tol = r.tolerance() * g.edgeCount();

            assertThat(FlowValidators.capacityConstraints(res, tol)).isTrue();
            assertThat(FlowValidators.flowConservation(res, s, t, tol)).isTrue();
            assertThat(r.totalFlow()).isLessThanOrEqualTo(max + slack(max));
            if (r.termination() == TerminationReason.CONVERGED) {
                assertThat(r.totalFlow()).isCloseTo(max, within(slack(max)));
            }
        }
    }
}
