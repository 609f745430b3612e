package waterflow.trace;

import java.util.Collections;
import java.util.List;

/**
 * An augmenting path was found. Emitted before the {@link Push} events that augment along it.
 */
public final class PathFound implements AlgorithmEvent {
    public final long sequence;
    public final List<String> nodes;
    public final double bottleneck;

    public PathFound(long sequence, List<String> nodes, double bottleneck) {
        this.sequence = sequence;
        this.nodes = Collections.unmodifiableList(nodes);
        this.bottleneck = bottleneck;
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public Kind kind() {
        return Kind.PATH_FOUND;
    }

    @Override
    public String toString() {
        return "#" + sequence + " path " + String.join("->", nodes) + " bottleneck=" + bottleneck;
    }
}
