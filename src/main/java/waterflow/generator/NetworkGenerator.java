package waterflow.generator;

import waterflow.core.FlowNetwork;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random water-grid instance generator (layered topology).
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Place {@code n - 2} junctions {@code J1..Jk} into roughly {@code sqrt(k)} layers between the source
 *       {@code S} (reservoir) and the sink {@code T} (demand).</li>
 *   <li>Connect S to every junction of the first layer and every junction of the last layer to T.</li>
 *   <li>Connect every junction to one or two junctions of the next layer (mains), so every junction lies on
 *       some S-T route.</li>
 *   <li>Add extra pipes with probability {@code density}: sideways within a layer, skipping a layer, or
 *       backwards (return pipes), which creates the cycles real grids have.</li>
 * </ol>
 * Capacities are drawn uniformly from {@code [1, maxCap]}; with {@code fractional} they carry two decimals,
 * like derated pipe ratings in MLD. The same seed always yields the same network.</p>
 */
public final class NetworkGenerator {

    public static final String SOURCE = "S";
    public static final String SINK = "T";

    private NetworkGenerator() {
    }

    /**
     * Integer capacities, moderate density.
     */
    public static FlowNetwork generate(int n, int maxCap, Random rng) {
        return generate(n, maxCap, 0.15, false, rng);
    }

    /**
     * @param n          number of nodes including source and sink (>= 3)
     * @param maxCap     maximum capacity (> 0)
     * @param density    probability of each extra pipe, in [0, 1]
     * @param fractional whether capacities have two decimals
     * @param rng        random generator
     */
    public static FlowNetwork generate(int n, int maxCap, double density, boolean fractional, Random rng) {
        if (n < 3) throw new IllegalArgumentException("At least three nodes are required.");
        if (maxCap <= 0) throw new IllegalArgumentException("maxCap must be > 0.");
        if (density < 0.0 || density > 1.0) throw new IllegalArgumentException("density must be in [0,1].");

        int k = n - 2;
        int layerCount = Math.max(1, (int) Math.round(Math.sqrt(k)));
        List<List<String>> layers = new ArrayList<>(layerCount);
        for (int i = 0; i < layerCount; i++) layers.add(new ArrayList<>());
        for (int j = 1; j <= k; j++) {
            // First junctions fill each layer once so no layer stays empty.
            int layer = j <= layerCount ? j - 1 : rng.nextInt(layerCount);
            layers.get(layer).add("J" + j);
        }

        FlowNetwork.Builder b = FlowNetwork.builder();
        b.source(SOURCE);
        for (int j = 1; j <= k; j++) b.node("J" + j);
        b.sink(SINK);

        Set<String> used = new HashSet<>();

        for (String v : layers.get(0)) addPipe(b, used, SOURCE, v, maxCap, fractional, rng);

        for (int i = 0; i + 1 < layerCount; i++) {
            List<String> next = layers.get(i + 1);
            for (String u : layers.get(i)) {
                addPipe(b, used, u, next.get(rng.nextInt(next.size())), maxCap, fractional, rng);
                addPipe(b, used, u, next.get(rng.nextInt(next.size())), maxCap, fractional, rng);
            }
        }

        for (String u : layers.get(layerCount - 1)) addPipe(b, used, u, SINK, maxCap, fractional, rng);

        // Extra pipes: sideways, skipping ahead, or backwards.
        for (int i = 0; i < layerCount; i++) {
            for (String u : layers.get(i)) {
                if (rng.nextDouble() < density) {
                    List<String> same = layers.get(i);
                    addPipe(b, used, u, same.get(rng.nextInt(same.size())), maxCap, fractional, rng);
                }
                if (i + 2 < layerCount && rng.nextDouble() < density) {
                    List<String> far = layers.get(i + 2);
                    addPipe(b, used, u, far.get(rng.nextInt(far.size())), maxCap, fractional, rng);
                }
                if (i > 0 && rng.nextDouble() < density) {
                    List<String> prev = layers.get(i - 1);
                    addPipe(b, used, u, prev.get(rng.nextInt(prev.size())), maxCap, fractional, rng);
                }
            }
        }
        if (rng.nextDouble() < density) addPipe(b, used, SOURCE, SINK, maxCap, fractional, rng);

        return b.build();
    }

    /**
     * Adds u->v unless it would be a self-loop or a duplicate.
     */
    private static void addPipe(FlowNetwork.Builder b, Set<String> used, String u, String v,
                                int maxCap, boolean fractional, Random rng) {
        if (u.equals(v) || !used.add(u + "\u0000" + v)) return;
        double cap;
        if (fractional) {
            cap = Math.round((1.0 + rng.nextDouble() * (maxCap - 1)) * 100.0) / 100.0;
        } else {
            cap = 1 + rng.nextInt(maxCap);
        }
        b.edge(u, v, cap);
    }
}
