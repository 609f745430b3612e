package waterflow.trace;

/**
 * Flow was pushed along one residual arc.
 *
 * <p>{@code from}/{@code to} give the direction of the push. For a push on a reverse arc
 * ({@code reverse == true}) the flow on network edge {@code edge} decreases by {@code amount};
 * otherwise it increases. Replaying all pushes of a run in order reproduces its final flows up to the
 * run's tolerance, since the arena clamps each edge flow to {@code [0, capacity]}.</p>
 */
public final class Push implements AlgorithmEvent {
    public final long sequence;
    public final int edge;
    public final String from;
    public final String to;
    public final double amount;
    public final boolean reverse;

    public Push(long sequence, int edge, String from, String to, double amount, boolean reverse) {
        this.sequence = sequence;
        this.edge = edge;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.reverse = reverse;
    }

    /** @return change of the edge flow caused by this push */
    public double flowDelta() {
        return reverse ? -amount : amount;
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public Kind kind() {
        return Kind.PUSH;
    }

    @Override
    public String toString() {
        return "#" + sequence + " push " + from + "->" + to + " " + amount + (reverse ? " (cancel)" : "");
    }
}
