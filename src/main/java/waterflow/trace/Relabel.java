package waterflow.trace;

public final class Relabel implements AlgorithmEvent {
    public final long sequence;
    public final String node;
    public final int oldHeight;
    public final int newHeight;

    public Relabel(long sequence, String node, int oldHeight, int newHeight) {
        this.sequence = sequence;
        this.node = node;
        this.oldHeight = oldHeight;
        this.newHeight = newHeight;
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public Kind kind() {
        return Kind.RELABEL;
    }

    @Override
    public String toString() {
        return "#" + sequence + " relabel " + node + " " + oldHeight + "->" + newHeight;
    }
}
