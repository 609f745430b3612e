package waterflow.trace;

import java.util.Arrays;

/**
 * A blocking-flow phase begins on a freshly built level graph.
 * {@code levels[v]} is the BFS distance of node index v from the source, or -1 if unreachable.
 */
public final class PhaseStarted implements AlgorithmEvent {
    public final long sequence;
    public final int phase;
    private final int[] levels;

    public PhaseStarted(long sequence, int phase, int[] levels) {
        this.sequence = sequence;
        this.phase = phase;
        this.levels = Arrays.copyOf(levels, levels.length);
    }

    public int[] levels() {
        return Arrays.copyOf(levels, levels.length);
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public Kind kind() {
        return Kind.PHASE_STARTED;
    }

    @Override
    public String toString() {
        return "#" + sequence + " phase " + phase + " levels=" + Arrays.toString(levels);
    }
}
