package waterflow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waterflow.algorithms.AlgorithmType;
import waterflow.algorithms.FlowResult;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.cut.FlowDecomposition;
import waterflow.cut.FlowPath;
import waterflow.cut.MinCut;
import waterflow.cut.MinCutExtractor;
import waterflow.scenario.Scenario;
import waterflow.scenario.ScenarioBuilder;
import waterflow.trace.LoggingTraceRecorder;
import waterflow.trace.RecordingTraceRecorder;
import waterflow.trace.TraceRecorder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point of the max-flow engine.
 *
 * <p>Single runs ({@link #run}, {@link #runTraced}, {@link #analyze}) execute on the calling thread.
 * {@link #compareAll} and {@link #leakageSweep} fan independent runs out to an {@link ExecutorService};
 * each run owns its residual state and only shares the immutable network, so they need no locking.</p>
 *
 * <p>An engine created with {@link #FlowEngine()} owns a fixed thread pool and must be {@link #close() closed};
 * one created with {@link #FlowEngine(ExecutorService)} leaves the executor to the caller.</p>
 */
public final class FlowEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public FlowEngine() {
        this(Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors())), true);
    }

    public FlowEngine(ExecutorService executor) {
        this(executor, false);
    }

    private FlowEngine(ExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Runs one variant between the network's source and sink.
     *
     * @throws waterflow.algorithms.NumericInstabilityException if the run hits a numerically invalid state
     */
    public FlowResult run(FlowNetwork network, AlgorithmType algorithm, RunOptions options) {
        TraceRecorder recorder = TraceRecorder.NO_OP;
        if (options.recorder() != null) recorder = options.recorder();
        else if (options.trace()) recorder = new LoggingTraceRecorder();
        return execute(network, algorithm, options, recorder);
    }

    /**
     * Runs one variant and records its events in memory. If {@code options} carries a recorder it still
     * receives the events as well.
     */
    public TracedRun runTraced(FlowNetwork network, AlgorithmType algorithm, RunOptions options) {
        RecordingTraceRecorder recording = new RecordingTraceRecorder();
        TraceRecorder extra = options.recorder();
        TraceRecorder recorder = extra == null ? recording : event -> {
            recording.record(event);
            extra.record(event);
        };
        FlowResult result = execute(network, algorithm, options, recorder);
        return new TracedRun(result, recording.events());
    }

    public MinCut extractMinCut(FlowNetwork network, FlowResult result) {
        return MinCutExtractor.extract(network, result);
    }

    public FlowNetwork applyScenario(FlowNetwork network, Scenario scenario) {
        return ScenarioBuilder.apply(network, scenario);
    }

    public List<FlowPath> decompose(FlowNetwork network, FlowResult result) {
        return FlowDecomposition.decompose(network, result);
    }

    /**
     * Applies the scenario, runs the variant on the derived network and extracts cut and flow paths.
     * A run that stopped early yields no cut.
     */
    public ScenarioOutcome analyze(FlowNetwork base, Scenario scenario, AlgorithmType algorithm, RunOptions options) {
        FlowNetwork derived = applyScenario(base, scenario);
        FlowResult result = run(derived, algorithm, options);
        MinCut cut = result.isMaximal() ? extractMinCut(derived, result) : null;
        return new ScenarioOutcome(derived, result, cut, decompose(derived, result));
    }

    /**
     * Runs every variant on {@code network} concurrently.
     *
     * <p>Trace settings of {@code options} are ignored here since a recorder is not meant to be shared
     * between runs.</p>
     */
    public AlgorithmComparison compareAll(FlowNetwork network, RunOptions options) {
        RunOptions untraced = options.withRecorder(null).withTrace(false);

        EnumMap<AlgorithmType, Future<FlowResult>> futures = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : AlgorithmType.values()) {
            futures.put(type, executor.submit(() -> run(network, type, untraced)));
        }

        EnumMap<AlgorithmType, FlowResult> results = new EnumMap<>(AlgorithmType.class);
        EnumMap<AlgorithmType, RuntimeException> failures = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : futures.keySet()) {
            try {
                results.put(type, await(futures.get(type)));
            } catch (RuntimeException ex) {
                log.warn("{} failed on {}: {}", type.displayName(), network, ex.getMessage());
                failures.put(type, ex);
            }
        }

        AlgorithmComparison comparison = new AlgorithmComparison(results, failures);
        log.info("Compared {} variants on {}: {}", results.size(), network,
                comparison.agree(options.tolerance() * Math.max(1.0, network.sourceOutCapacity()))
                        ? "agree" : "DISAGREE");
        return comparison;
    }

    /**
     * Evaluates the degradation curve: for each uniform leakage fraction, applies it (plus the given
     * failed pipes) to {@code base} and computes the max flow. Levels run concurrently; the returned
     * points keep the order of {@code leakages}.
     *
     * @throws waterflow.scenario.InvalidScenarioException if a leakage is outside {@code [0,1)} or a failed
     *                                                     edge is unknown; checked before any run starts
     * @throws NullPointerException if a leakage entry or {@code failedEdges} is null
     */
    public List<LeakagePoint> leakageSweep(FlowNetwork base, AlgorithmType algorithm, List<Double> leakages,
                                           Collection<EdgeKey> failedEdges, RunOptions options) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(leakages, "leakages");
        Objects.requireNonNull(failedEdges, "failedEdges");
        for (int i = 0; i < leakages.size(); i++) {
            Objects.requireNonNull(leakages.get(i), "leakages[" + i + "]");
        }
        RunOptions untraced = options.withRecorder(null).withTrace(false);

        List<FlowNetwork> derived = new ArrayList<>(leakages.size());
        for (double leak : leakages) {
            Scenario sc = Scenario.builder().defaultLeakage(leak).failAll(failedEdges).build();
            derived.add(applyScenario(base, sc));
        }

        List<Future<FlowResult>> futures = new ArrayList<>(derived.size());
        for (FlowNetwork g : derived) {
            futures.add(executor.submit(() -> run(g, algorithm, untraced)));
        }

        List<LeakagePoint> points = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                points.add(new LeakagePoint(leakages.get(i), await(futures.get(i)), null));
            } catch (RuntimeException ex) {
                log.warn("Leakage {} failed: {}", leakages.get(i), ex.getMessage());
                points.add(new LeakagePoint(leakages.get(i), null, ex));
            }
        }
        log.debug("Leakage sweep over {} levels on {} done", points.size(), base);
        return points;
    }

    @Override
    public void close() {
        if (ownsExecutor) executor.shutdown();
    }

    private static FlowResult execute(FlowNetwork network, AlgorithmType algorithm, RunOptions options,
                                      TraceRecorder recorder) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(algorithm, "algorithm");
        log.debug("Running {} on {} with {}", algorithm.displayName(), network, options);
        return algorithm.create().run(network, network.source(), network.sink(), options.budget(),
                options.tolerance(), recorder);
    }

    /**
     * Waits for a run and unwraps its failure.
     */
    private static FlowResult await(Future<FlowResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            CancellationException ce = new CancellationException("Interrupted while waiting for a run");
            ce.initCause(ex);
            throw ce;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Run failed", cause);
        }
    }
}
