package waterflow.scenario;

import org.junit.jupiter.api.Test;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.Networks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScenarioBuilderTest {

    private final FlowNetwork base = Networks.diamond();

    @Test
    void emptyScenarioKeepsCapacities() {
        FlowNetwork g = ScenarioBuilder.apply(base, Scenario.none());

        for (int i = 0; i < base.edgeCount(); i++) {
            assertThat(g.edge(i).capacity()).isEqualTo(base.edge(i).capacity());
        }
    }

    @Test
    void uniformLeakageScalesEveryPipe() {
        FlowNetwork g = ScenarioBuilder.apply(base, Scenario.builder().defaultLeakagePercent(25).build());

        for (int i = 0; i < base.edgeCount(); i++) {
            assertThat(g.edge(i).capacity()).isCloseTo(base.edge(i).capacity() * 0.75, within(1e-12));
        }
        assertThat(base.edge(0).capacity()).isEqualTo(10.0);
    }

    @Test
    void overrideWinsOverDefault() {
        Scenario sc = Scenario.builder()
                .defaultLeakage(0.1)
                .leakage(EdgeKey.of("A", "T"), 0.5)
                .build();
        FlowNetwork g = ScenarioBuilder.apply(base, sc);

        assertThat(g.findEdge(EdgeKey.of("A", "T")).get().capacity()).isCloseTo(5.0, within(1e-12));
        assertThat(g.findEdge(EdgeKey.of("S", "A")).get().capacity()).isCloseTo(9.0, within(1e-12));
    }

    @Test
    void failedPipeDropsToZeroButStays() {
        Scenario sc = Scenario.builder()
                .defaultLeakage(0.3)
                .fail(EdgeKey.of("S", "B"))
                .build();
        FlowNetwork g = ScenarioBuilder.apply(base, sc);

        assertThat(g.edgeCount()).isEqualTo(base.edgeCount());
        assertThat(g.findEdge(EdgeKey.of("S", "B")).get().capacity()).isEqualTo(0.0);
    }

    @Test
    void rejectsLeakageOutsideRange() {
        assertThatThrownBy(() -> ScenarioBuilder.apply(base, Scenario.builder().defaultLeakage(1.0).build()))
                .isInstanceOf(InvalidScenarioException.class);
        assertThatThrownBy(() -> ScenarioBuilder.apply(base, Scenario.builder().defaultLeakage(-0.1).build()))
                .isInstanceOf(InvalidScenarioException.class);
        assertThatThrownBy(() -> ScenarioBuilder.apply(base,
                Scenario.builder().leakage(EdgeKey.of("S", "A"), Double.NaN).build()))
                .isInstanceOf(InvalidScenarioException.class);
    }

    @Test
    void rejectsUnknownEdges() {
        assertThatThrownBy(() -> ScenarioBuilder.apply(base,
                Scenario.builder().fail(EdgeKey.of("B", "A")).build()))
                .isInstanceOf(InvalidScenarioException.class)
                .hasMessageContaining("B,A");
        assertThatThrownBy(() -> ScenarioBuilder.apply(base,
                Scenario.builder().leakage(EdgeKey.of("T", "A"), 0.2).build()))
                .isInstanceOf(InvalidScenarioException.class);
    }
}
