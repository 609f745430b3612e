package waterflow.testbed;

import org.junit.jupiter.api.Test;
import waterflow.algorithms.AlgorithmType;
import waterflow.core.EdgeKey;

import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @Test
    void parsesFileModeOptions() {
        Main.Options o = Main.parseArgs(new String[]{
                "--file=net.csv", "--source=R", "--sink=Z", "--algo=ek,pr", "--leakage=12.5",
                "--fail=A,B", "--fail=B,Z", "--max-iterations=50", "--debug"});

        assertThat(o.effectiveMode()).isEqualTo(Main.Mode.FILE);
        assertThat(o.source).isEqualTo("R");
        assertThat(o.sink).isEqualTo("Z");
        assertThat(o.algorithms).containsExactly(AlgorithmType.AUGMENTING_PATH, AlgorithmType.PREFLOW_PUSH);
        assertThat(o.leakagePercent).isEqualTo(12.5);
        assertThat(o.failed).containsExactly(EdgeKey.of("A", "B"), EdgeKey.of("B", "Z"));
        assertThat(o.maxIterations).isEqualTo(50L);
        assertThat(o.debug).isTrue();
        assertThat(o.invalid).isFalse();
    }

    @Test
    void defaultsToBatchMode() {
        Main.Options o = Main.parseArgs(new String[0]);

        assertThat(o.effectiveMode()).isEqualTo(Main.Mode.BATCH);
        assertThat(o.seed).isEqualTo(123L);
        assertThat(o.algorithms).containsExactly(AlgorithmType.AUGMENTING_PATH);
    }

    @Test
    void allSelectsEveryAlgorithm() {
        assertThat(Main.parseArgs(new String[]{"--algo=all"}).algorithms).containsExactly(AlgorithmType.values());
    }

    @Test
    void flagsBadArguments() {
        assertThat(Main.parseArgs(new String[]{"--mode=huge"}).invalid).isTrue();
        assertThat(Main.parseArgs(new String[]{"--n=many"}).invalid).isTrue();
        assertThat(Main.parseArgs(new String[]{"--fail=A"}).invalid).isTrue();
        assertThat(Main.parseArgs(new String[]{"--colour=blue"}).invalid).isTrue();
        assertThat(Main.parseArgs(new String[]{"stray"}).invalid).isTrue();
    }

    @Test
    void usageErrorExitCode() {
        List<String> out = new ArrayList<>();

        assertThat(Main.run(new String[]{"--algo=simplex"}, out::add)).isEqualTo(2);
        assertThat(out).anyMatch(l -> l.startsWith("Usage:"));
    }

    @Test
    void analysesBundledCsv() throws URISyntaxException {
        String file = Paths.get(getClass().getResource("/grid.csv").toURI()).toString();
        List<String> out = new ArrayList<>();

        int code = Main.run(new String[]{"--file=" + file, "--algo=all"}, out::add);

        assertThat(code).isZero();
        assertThat(out).contains(
                "Max Flow = 23.00 MLD (Edmonds-Karp)",
                "Max Flow = 23.00 MLD (Dinic)",
                "Max Flow = 23.00 MLD (Push-Relabel)",
                "  Cut capacity: 23.00 MLD");
    }

    @Test
    void leakageAndFailureFromCommandLine() throws URISyntaxException {
        String file = Paths.get(getClass().getResource("/edges.csv").toURI()).toString();
        List<String> out = new ArrayList<>();

        int code = Main.run(new String[]{"--file=" + file, "--leakage=50", "--fail=A,T"}, out::add);

        assertThat(code).isZero();
        assertThat(out).contains("Max Flow = 5.00 MLD (Edmonds-Karp)");
    }

    @Test
    void invalidScenarioIsReported() throws URISyntaxException {
        String file = Paths.get(getClass().getResource("/edges.csv").toURI()).toString();

        assertThat(Main.run(new String[]{"--file=" + file, "--fail=T,S"}, line -> { })).isEqualTo(1);
        assertThat(Main.run(new String[]{"--file=" + file, "--leakage=100"}, line -> { })).isEqualTo(1);
    }

    @Test
    void missingFileIsReported() {
        assertThat(Main.run(new String[]{"--file=/nonexistent/edges.csv"}, line -> { })).isEqualTo(1);
    }

    @Test
    void smallBatchRunsClean() {
        assertThat(Main.run(new String[]{"--mode=batch", "--instances=2", "--n=10", "--cap=20", "--seed=5"},
                line -> { })).isZero();
    }
}
