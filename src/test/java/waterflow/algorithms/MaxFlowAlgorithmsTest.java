package waterflow.algorithms;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.FlowValidators;
import waterflow.core.Networks;
import waterflow.core.ResidualNetwork;
import waterflow.scenario.Scenario;
import waterflow.scenario.ScenarioBuilder;
import waterflow.trace.TraceRecorder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MaxFlowAlgorithmsTest {

    private static FlowResult solve(AlgorithmType type, FlowNetwork g) {
        return type.create().run(g, ExecutionBudget.defaults());
    }

    private static void assertValidFlow(FlowNetwork g, FlowResult r) {
        ResidualNetwork res = ResidualNetwork.withFlows(g, r.flowArray());
        int s = g.source().index();
        int t = g.sink().index();
        double tol = Math.max(r.tolerance(), 1e-12) * 10;
        assertThat(FlowValidators.capacityConstraints(res, tol)).isTrue();
        assertThat(FlowValidators.flowConservation(res, s, t, tol)).isTrue();
        assertThat(FlowValidators.valueAgreement(res, s, t, tol)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void diamondCarriesTwenty(AlgorithmType type) {
        FlowResult r = solve(type, Networks.diamond());

        assertThat(r.totalFlow()).isCloseTo(20.0, within(1e-9));
        assertThat(r.termination()).isEqualTo(TerminationReason.CONVERGED);
        assertThat(r.isMaximal()).isTrue();
        assertThat(r.algorithm()).isEqualTo(type);
        assertThat(r.flow(EdgeKey.of("A", "T"))).isCloseTo(10.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void halfLeakageHalvesTheDiamond(AlgorithmType type) {
        FlowNetwork g = ScenarioBuilder.apply(Networks.diamond(), Scenario.builder().defaultLeakage(0.5).build());

        assertThat(solve(type, g).totalFlow()).isCloseTo(10.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void failedPipeRemovesItsRoute(AlgorithmType type) {
        FlowNetwork g = ScenarioBuilder.apply(Networks.diamond(),
                Scenario.builder().fail(EdgeKey.of("A", "T")).build());
        FlowResult r = solve(type, g);

        assertThat(r.totalFlow()).isCloseTo(10.0, within(1e-9));
        assertThat(r.flow(EdgeKey.of("A", "T"))).isEqualTo(0.0);
        assertThat(r.flow(EdgeKey.of("B", "T"))).isCloseTo(10.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void textbookNetwork(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();
        FlowResult r = solve(type, g);

        assertThat(r.totalFlow()).isCloseTo(23.0, within(1e-9));
        assertValidFlow(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void needsFlowCancellation(AlgorithmType type) {
        FlowNetwork g = Networks.crossover();

        assertThat(solve(type, g).totalFlow()).isCloseTo(2.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void fractionalCapacities(AlgorithmType type) {
        FlowNetwork g = Networks.fractional();
        FlowResult r = solve(type, g);

        assertThat(r.totalFlow()).isCloseTo(0.3, within(1e-9));
        assertValidFlow(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void disconnectedSinkGivesZero(AlgorithmType type) {
        FlowResult r = solve(type, Networks.disconnected());

        assertThat(r.totalFlow()).isEqualTo(0.0);
        assertThat(r.termination()).isEqualTo(TerminationReason.CONVERGED);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void directSourceSinkPipe(AlgorithmType type) {
        FlowNetwork g = FlowNetwork.builder().source("S").sink("T").edge("S", "T", 3.5).build();

        assertThat(solve(type, g).totalFlow()).isCloseTo(3.5, within(1e-12));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void pipesIntoSourceAndOutOfSinkCarryNothingUseful(AlgorithmType type) {
        FlowNetwork g = FlowNetwork.builder()
                .source("S").node("A").sink("T")
                .edge("S", "A", 5).edge("A", "S", 5).edge("A", "T", 3).edge("T", "A", 2)
                .build();
        FlowResult r = solve(type, g);

        assertThat(r.totalFlow()).isCloseTo(3.0, within(1e-9));
        assertValidFlow(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void iterationBudgetStopsWithValidFlow(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();
        FlowResult r = type.create().run(g, ExecutionBudget.iterations(1));

        assertThat(r.termination()).isEqualTo(TerminationReason.BUDGET_EXCEEDED);
        assertThat(r.isMaximal()).isFalse();
        assertThat(r.totalFlow()).isLessThan(23.0);
        assertThat(r.iterations()).isEqualTo(1);
        assertValidFlow(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void zeroBudgetReturnsEmptyFlow(AlgorithmType type) {
        FlowResult r = type.create().run(Networks.diamond(), ExecutionBudget.iterations(0));

        assertThat(r.termination()).isEqualTo(TerminationReason.BUDGET_EXCEEDED);
        assertThat(r.totalFlow()).isCloseTo(0.0, within(1e-9));
        assertValidFlow(Networks.diamond(), r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void cancellationIsObservedBetweenIterations(AlgorithmType type) {
        AtomicInteger polls = new AtomicInteger();
        ExecutionBudget budget = ExecutionBudget.defaults().withCancellation(() -> polls.incrementAndGet() > 1);
        FlowNetwork g = Networks.textbook();

        FlowResult r = type.create().run(g, budget);

        assertThat(r.termination()).isEqualTo(TerminationReason.CANCELLED);
        assertValidFlow(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void expiredTimeoutStops(AlgorithmType type) {
        ExecutionBudget budget = ExecutionBudget.defaults().withTimeout(Duration.ZERO);

        FlowResult r = type.create().run(Networks.textbook(), budget);

        assertThat(r.termination()).isEqualTo(TerminationReason.BUDGET_EXCEEDED);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void hugeTimeoutMeansNoDeadline(AlgorithmType type) {
        ExecutionBudget budget = ExecutionBudget.defaults().withTimeout(Duration.ofSeconds(Long.MAX_VALUE));

        FlowResult r = type.create().run(Networks.diamond(), budget);

        assertThat(r.termination()).isEqualTo(TerminationReason.CONVERGED);
        assertThat(r.totalFlow()).isCloseTo(20.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void runsAreDeterministic(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();

        FlowResult a = solve(type, g);
        FlowResult b = solve(type, g);

        assertThat(a).isEqualTo(b);
        assertThat(a.flowArray()).containsExactly(b.flowArray());
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void runsBetweenArbitraryNodes(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();

        FlowResult r = type.create().run(g, g.node("C"), g.node("B"), ExecutionBudget.defaults(),
                MaxFlowAlgorithm.DEFAULT_TOLERANCE, TraceRecorder.NO_OP);

        // C->D->B (7) plus C->A->B (4).
        assertThat(r.totalFlow()).isCloseTo(11.0, within(1e-9));
        assertThat(r.sourceId()).isEqualTo("C");
        assertThat(r.sinkId()).isEqualTo("B");
    }

    @Test
    void rejectsInvalidArguments() {
        FlowNetwork g = Networks.diamond();
        MaxFlowAlgorithm algo = AlgorithmType.AUGMENTING_PATH.create();

        assertThatThrownBy(() -> algo.run(g, g.source(), g.source(), ExecutionBudget.defaults(),
                MaxFlowAlgorithm.DEFAULT_TOLERANCE, TraceRecorder.NO_OP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> algo.run(g, g.source(), Networks.textbook().node("D"), ExecutionBudget.defaults(),
                MaxFlowAlgorithm.DEFAULT_TOLERANCE, TraceRecorder.NO_OP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> algo.run(g, g.source(), g.sink(), ExecutionBudget.defaults(),
                -1.0, TraceRecorder.NO_OP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionBudget.iterations(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesAlgorithmNames() {
        assertThat(AlgorithmType.parse("ek")).isEqualTo(AlgorithmType.AUGMENTING_PATH);
        assertThat(AlgorithmType.parse("Dinic")).isEqualTo(AlgorithmType.BLOCKING_FLOW);
        assertThat(AlgorithmType.parse("preflow_push")).isEqualTo(AlgorithmType.PREFLOW_PUSH);
        assertThatThrownBy(() -> AlgorithmType.parse("simplex")).isInstanceOf(IllegalArgumentException.class);
    }
}
