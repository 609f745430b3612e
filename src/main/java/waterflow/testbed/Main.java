package waterflow.testbed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waterflow.algorithms.AlgorithmType;
import waterflow.algorithms.ExecutionBudget;
import waterflow.algorithms.NumericInstabilityException;
import waterflow.core.EdgeKey;
import waterflow.core.FlowNetwork;
import waterflow.core.InvalidNetworkException;
import waterflow.core.NetworkLoader;
import waterflow.engine.FlowEngine;
import waterflow.engine.RunOptions;
import waterflow.scenario.InvalidScenarioException;
import waterflow.scenario.Scenario;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Command-line entry point.
 *
 * <p>This runner focuses on:
 * <ul>
 *   <li>loading a pipe network from CSV and reporting it under a leakage / failure scenario,</li>
 *   <li>selecting a random test mode / batch configuration and initializing the RNG,</li>
 *   <li>delegating all correctness checks and reporting to {@link TestEnvironment}.</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   # Analyse a network with 10% leakage and a failed pipe
 *   java waterflow.testbed.Main --file=data/edges.csv --leakage=10 --fail=A,T --algo=all
 *
 *   # Random validation batch
 *   java waterflow.testbed.Main --mode=batch --instances=5 --n=12 --cap=50 --seed=123
 *
 *   # Larger run
 *   java waterflow.testbed.Main --mode=big --seed=2025
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 invalid input or failed validation, 2 usage error.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    enum Mode { FILE, SMALL, BATCH, BIG }

    static class Options {
        Mode mode = null;   // Derived from --file when not given.
        String file = null;
        String source = NetworkLoader.DEFAULT_SOURCE;
        String sink = NetworkLoader.DEFAULT_SINK;
        List<AlgorithmType> algorithms = new ArrayList<>(List.of(AlgorithmType.AUGMENTING_PATH));
        double leakagePercent = 0.0;
        List<EdgeKey> failed = new ArrayList<>();
        long maxIterations = RunOptions.defaults().maxIterations();
        boolean debug = false;
        int instances = 5;
        int n = 12;
        int cap = 50;
        Long seed = 123L;   // If set to null, a seed is derived from System.nanoTime().
        boolean help = false;
        boolean invalid = false;

        Mode effectiveMode() {
            if (mode != null) return mode;
            return file != null ? Mode.FILE : Mode.BATCH;
        }
    }

    public static void main(String[] args) {
        int code = run(args, Main::println);
        if (code != 0) System.exit(code);
    }

    /**
     * Runs the command line and returns the process exit code.
     */
    static int run(String[] args, Consumer<String> out) {
        Options opt = parseArgs(args);
        if (opt.help || opt.invalid) {
            out.accept(usage());
            return opt.invalid ? 2 : 0;
        }

        printHeader(opt, out);

        try (FlowEngine engine = new FlowEngine()) {
            if (opt.effectiveMode() == Mode.FILE) {
                return runFile(opt, engine, out);
            }
            return runBatches(opt, engine, out);
        }
    }

    private static int runFile(Options opt, FlowEngine engine, Consumer<String> out) {
        if (opt.file == null) {
            log.error("--mode=file requires --file=<path>");
            return 2;
        }
        try {
            FlowNetwork network = NetworkLoader.load(Paths.get(opt.file), opt.source, opt.sink);
            Scenario scenario = Scenario.builder()
                    .defaultLeakagePercent(opt.leakagePercent)
                    .failAll(opt.failed)
                    .build();
            RunOptions options = RunOptions.defaults().withMaxIterations(opt.maxIterations);
            TestEnvironment.runScenarioReport(network, scenario, opt.algorithms, options, engine, opt.debug, out);
            return 0;
        } catch (IOException e) {
            log.error("Cannot read network file {}: {}", opt.file, e.getMessage());
            return 1;
        } catch (InvalidNetworkException | InvalidScenarioException e) {
            log.error("Invalid input: {}", e.getMessage());
            return 1;
        } catch (NumericInstabilityException e) {
            log.error("Run aborted: {}", e.getMessage());
            return 1;
        }
    }

    private static int runBatches(Options opt, FlowEngine engine, Consumer<String> out) {
        List<TestEnvironment.BatchConfig> batches = new ArrayList<>();

        Random rng;
        if (opt.seed != null) {
            rng = new Random(opt.seed);
            out.accept("Seed: " + opt.seed);
        } else {
            long s = System.nanoTime();
            rng = new Random(s);
            out.accept("Seed (auto): " + s);
        }
        out.accept("");

        switch (opt.effectiveMode()) {
            case SMALL:
                batches.add(new TestEnvironment.BatchConfig(3, 20, 50));
                batches.add(new TestEnvironment.BatchConfig(2, 40, 50));
                break;
            case BIG:
                batches.add(new TestEnvironment.BatchConfig(20, 50, 100));
                batches.add(new TestEnvironment.BatchConfig(15, 80, 100));
                batches.add(new TestEnvironment.BatchConfig(10, 120, 100));
                break;
            case BATCH:
            default:
                batches.add(new TestEnvironment.BatchConfig(opt.instances, opt.n, opt.cap));
                break;
        }

        TestEnvironment.BatchSummary summary = TestEnvironment.runBatches(batches, rng, engine, out);
        out.accept("=== Test run finished. ===");
        if (!summary.allOk()) {
            log.warn("Validation problems: {} mismatches, {} failed checks over {} instances",
                    summary.mismatches, summary.failedChecks, summary.instances);
            return 1;
        }
        return 0;
    }

    /* ============================= Argument parsing & printing ============================= */

    static Options parseArgs(String[] args) {
        Options o = new Options();

        if (args == null) return o;

        for (String a : args) {
            if (a == null) continue;

            String s = a.trim();
            if (s.isEmpty()) continue;

            if (s.equals("--help") || s.equals("-h")) {
                o.help = true;
                continue;
            }

            if (s.equals("--debug")) {
                o.debug = true;
                continue;
            }

            int eq = s.indexOf('=');
            if (!s.startsWith("--") || eq < 0) {
                log.error("Unknown argument: {}", s);
                o.invalid = true;
                continue;
            }
            String key = s.substring(2, eq);
            String v = s.substring(eq + 1).trim();

            try {
                switch (key) {
                    case "mode":
                        o.mode = parseMode(v);
                        break;
                    case "file":
                        o.file = v;
                        break;
                    case "source":
                        o.source = v;
                        break;
                    case "sink":
                        o.sink = v;
                        break;
                    case "algo":
                        o.algorithms = parseAlgorithms(v);
                        break;
                    case "leakage":
                        o.leakagePercent = Double.parseDouble(v);
                        break;
                    case "fail":
                        o.failed.add(EdgeKey.parse(v));
                        break;
                    case "max-iterations":
                        o.maxIterations = Long.parseLong(v);
                        break;
                    case "instances":
                        o.instances = Integer.parseInt(v);
                        break;
                    case "n":
                        o.n = Integer.parseInt(v);
                        break;
                    case "cap":
                        o.cap = Integer.parseInt(v);
                        break;
                    case "seed":
                        o.seed = Long.parseLong(v);
                        break;
                    default:
                        log.error("Unknown argument: {}", s);
                        o.invalid = true;
                }
            } catch (IllegalArgumentException e) {
                // NumberFormatException included.
                log.error("Cannot parse {}: {}", s, e.getMessage());
                o.invalid = true;
            }
        }

        return o;
    }

    private static Mode parseMode(String v) {
        switch (v.toLowerCase(Locale.ROOT)) {
            case "file":  return Mode.FILE;
            case "small": return Mode.SMALL;
            case "big":   return Mode.BIG;
            case "batch": return Mode.BATCH;
            default:
                throw new IllegalArgumentException("unknown mode '" + v + "' (expected: file|small|batch|big)");
        }
    }

    private static List<AlgorithmType> parseAlgorithms(String v) {
        if (v.equalsIgnoreCase("all")) return new ArrayList<>(EnumSet.allOf(AlgorithmType.class));
        List<AlgorithmType> list = new ArrayList<>();
        for (String part : v.split(",")) {
            AlgorithmType t = AlgorithmType.parse(part.trim());
            if (!list.contains(t)) list.add(t);
        }
        return list;
    }

    static String usage() {
        return "Usage:\n" +
                "  java waterflow.testbed.Main [options]\n\n" +
                "Options:\n" +
                "  --mode=<file|small|batch|big>  run mode (default: file if --file is given, else batch)\n" +
                "  --file=<path>                  CSV with header u,v,capacity_mld\n" +
                "  --source=<id>                  source node (default: S)\n" +
                "  --sink=<id>                    sink node (default: T)\n" +
                "  --algo=<ek|dinic|pr|all>       algorithm(s), comma separated (default: ek)\n" +
                "  --leakage=<percent>            uniform leakage in percent, [0,100) (default: 0)\n" +
                "  --fail=<u,v>                   failed pipe, repeatable\n" +
                "  --max-iterations=<long>        iteration budget per run (default: " + ExecutionBudget.DEFAULT_MAX_ITERATIONS + ")\n" +
                "  --debug                        print node balances and pipe utilisation\n" +
                "  --instances=<int>              batch mode: number of instances (default: 5)\n" +
                "  --n=<int>                      batch mode: number of nodes (default: 12)\n" +
                "  --cap=<int>                    batch mode: capacity upper bound (default: 50)\n" +
                "  --seed=<long>                  RNG seed (default: 123)\n" +
                "  --help                         print this help\n\n" +
                "Examples:\n" +
                "  java waterflow.testbed.Main --file=edges.csv --leakage=10 --fail=A,T --algo=all\n" +
                "  java waterflow.testbed.Main --mode=batch --instances=5 --n=12 --cap=50 --seed=123\n" +
                "  java waterflow.testbed.Main --mode=big --seed=2025\n";
    }

    private static void printHeader(Options opt, Consumer<String> out) {
        out.accept("Date:  " + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
        out.accept("Java:  " + System.getProperty("java.version")
                + "  |  OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        out.accept("Mode:  " + opt.effectiveMode());

        if (opt.effectiveMode() == Mode.BATCH) {
            out.accept(String.format(Locale.ROOT, "Batch params: instances=%d, n=%d, cap=%d",
                    opt.instances, opt.n, opt.cap));
        } else if (opt.effectiveMode() == Mode.FILE) {
            out.accept(String.format(Locale.ROOT, "Input: %s (%s -> %s), algorithms=%s", opt.file,
                    opt.source, opt.sink, Arrays.toString(opt.algorithms.toArray())));
        }

        out.accept("==============================================");
        out.accept("");
    }

    private static void println(String s) {
        System.out.println(s);
    }
}
