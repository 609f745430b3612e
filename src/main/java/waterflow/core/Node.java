package waterflow.core;

import java.util.Objects;

/**
 * Node (junction, reservoir or demand point) of a {@link FlowNetwork}.
 *
 * <p>The {@code index} is assigned by the network at construction time in insertion order and is
 * used by the algorithms to address per-node state (heights, excesses, levels) in flat arrays.</p>
 */
public final class Node {

    private final String id;
    private final NodeRole role;
    private final int index;

    Node(String id, NodeRole role, int index) {
        this.id = id;
        this.role = role;
        this.index = index;
    }

    public String id() {
        return id;
    }

    public NodeRole role() {
        return role;
    }

    /**
     * @return stable position of this node in {@link FlowNetwork#nodes()}
     */
    public int index() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node other = (Node) o;
        return index == other.index && id.equals(other.id) && role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, role, index);
    }

    @Override
    public String toString() {
        return id + "(" + role + ")";
    }
}
