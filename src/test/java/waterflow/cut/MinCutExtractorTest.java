package waterflow.cut;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import waterflow.algorithms.AlgorithmType;
import waterflow.algorithms.ExecutionBudget;
import waterflow.algorithms.FlowResult;
import waterflow.algorithms.TerminationReason;
import waterflow.core.Edge;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.Networks;
import waterflow.scenario.Scenario;
import waterflow.scenario.ScenarioBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MinCutExtractorTest {

    private static MinCut cutOf(AlgorithmType type, FlowNetwork g) {
        FlowResult r = type.create().run(g, ExecutionBudget.defaults());
        return MinCutExtractor.extract(g, r);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void textbookCutIsUnique(AlgorithmType type) {
        MinCut cut = cutOf(type, Networks.textbook());

        assertThat(cut.capacity()).isCloseTo(23.0, within(1e-9));
        assertThat(cut.sourceSide()).containsExactlyInAnyOrder("S", "A", "C", "D");
        assertThat(cut.sinkSide()).containsExactlyInAnyOrder("B", "T");
        assertThat(cut.edges()).extracting(Edge::key).containsExactly(
                EdgeKey.of("A", "B"), EdgeKey.of("D", "B"), EdgeKey.of("D", "T"));
        assertThat(cut.contains(EdgeKey.of("A", "B"))).isTrue();
        assertThat(cut.contains(EdgeKey.of("B", "C"))).isFalse();
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void diamondCutIsTheSourceSide(AlgorithmType type) {
        MinCut cut = cutOf(type, Networks.diamond());

        assertThat(cut.sourceSide()).containsExactly("S");
        assertThat(cut.edges()).extracting(Edge::key).containsExactly(EdgeKey.of("S", "A"), EdgeKey.of("S", "B"));
        assertThat(cut.capacity()).isCloseTo(20.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void failedOutletMovesTheCut(AlgorithmType type) {
        FlowNetwork g = ScenarioBuilder.apply(Networks.diamond(),
                Scenario.builder().fail(EdgeKey.of("A", "T")).build());

        MinCut cut = cutOf(type, g);

        assertThat(cut.sourceSide()).containsExactlyInAnyOrder("S", "A", "B");
        assertThat(cut.edges()).extracting(Edge::key).containsExactly(EdgeKey.of("B", "T"));
        assertThat(cut.zeroCapacityEdges()).extracting(Edge::key).containsExactly(EdgeKey.of("A", "T"));
        assertThat(cut.capacity()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void disconnectedNetworkHasZeroCut() {
        MinCut cut = cutOf(AlgorithmType.AUGMENTING_PATH, Networks.disconnected());

        assertThat(cut.capacity()).isEqualTo(0.0);
        assertThat(cut.isEmpty()).isTrue();
        assertThat(cut.sourceSide()).containsExactlyInAnyOrder("S", "A");
        assertThat(cut.sinkSide()).containsExactlyInAnyOrder("B", "T");
    }

    @Test
    void failedPipesOnTheBoundaryAreListedSeparately() {
        FlowNetwork g = ScenarioBuilder.apply(Networks.diamond(),
                Scenario.builder().fail(EdgeKey.of("S", "A")).fail(EdgeKey.of("S", "B")).build());

        MinCut cut = cutOf(AlgorithmType.BLOCKING_FLOW, g);

        assertThat(cut.capacity()).isEqualTo(0.0);
        assertThat(cut.edges()).isEmpty();
        assertThat(cut.zeroCapacityEdges()).extracting(Edge::key)
                .containsExactly(EdgeKey.of("S", "A"), EdgeKey.of("S", "B"));
    }

    @Test
    void rejectsResultOfAnotherNetwork() {
        FlowResult r = AlgorithmType.AUGMENTING_PATH.create().run(Networks.diamond(), ExecutionBudget.defaults());

        assertThatThrownBy(() -> MinCutExtractor.extract(Networks.textbook(), r))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void rejectsRunStoppedByBudget(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();
        FlowResult r = type.create().run(g, ExecutionBudget.iterations(1));
        assertThat(r.termination()).isEqualTo(TerminationReason.BUDGET_EXCEEDED);

        assertThatThrownBy(() -> MinCutExtractor.extract(g, r))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BUDGET_EXCEEDED");
    }

    @ParameterizedTest
    @EnumSource(AlgorithmType.class)
    void rejectsCancelledRun(AlgorithmType type) {
        FlowNetwork g = Networks.textbook();
        FlowResult r = type.create().run(g, ExecutionBudget.defaults().withCancellation(() -> true));
        assertThat(r.termination()).isEqualTo(TerminationReason.CANCELLED);

        assertThatThrownBy(() -> MinCutExtractor.extract(g, r))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CANCELLED");
    }

    @Test
    void rejectsConvergedResultWhoseSinkIsStillReachable() {
        FlowNetwork g = Networks.diamond();
        List<EdgeKey> keys = new ArrayList<>();
        for (Edge e : g.edges()) keys.add(e.key());
        FlowResult empty = new FlowResult(AlgorithmType.BLOCKING_FLOW, "S", "T", 0.0, new double[g.edgeCount()],
                keys, 0, TerminationReason.CONVERGED, 1e-9, Duration.ZERO);

        assertThatThrownBy(() -> MinCutExtractor.extract(g, empty))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reachable");
    }
}
