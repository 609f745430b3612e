package waterflow.algorithms;

import java.util.Locale;

/**
 * The three max-flow variants offered by the engine.
 */
public enum AlgorithmType {

    /** Edmonds-Karp: shortest augmenting paths found by BFS. */
    AUGMENTING_PATH("Edmonds-Karp", "ek"),

    /** Dinic: level graph + blocking flow per phase. */
    BLOCKING_FLOW("Dinic", "dinic"),

    /** Goldberg-Tarjan: FIFO push-relabel. */
    PREFLOW_PUSH("Push-Relabel", "pr");

    private final String displayName;
    private final String shortName;

    AlgorithmType(String displayName, String shortName) {
        this.displayName = displayName;
        this.shortName = shortName;
    }

    public String displayName() {
        return displayName;
    }

    public String shortName() {
        return shortName;
    }

    /** @return a fresh, stateless instance of this variant */
    public MaxFlowAlgorithm create() {
        switch (this) {
            case AUGMENTING_PATH: return new AugmentingPath();
            case BLOCKING_FLOW:   return new BlockingFlow();
            case PREFLOW_PUSH:    return new PreflowPush();
            default: throw new IllegalStateException("Unhandled algorithm " + this);
        }
    }

    /**
     * Accepts the short name ({@code ek}, {@code dinic}, {@code pr}), the display name, or the enum name,
     * case-insensitively.
     */
    public static AlgorithmType parse(String text) {
        String v = text.trim().toLowerCase(Locale.ROOT);
        for (AlgorithmType a : values()) {
            if (a.shortName.equals(v) || a.displayName.toLowerCase(Locale.ROOT).equals(v)
                    || a.name().toLowerCase(Locale.ROOT).equals(v)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + text + " (expected: ek|dinic|pr)");
    }
}
