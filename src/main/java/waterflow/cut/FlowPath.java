package waterflow.cut;

import java.util.Collections;
import java.util.List;

/**
 * One source-to-sink path of a flow decomposition and the amount it carries.
 */
public final class FlowPath {

    private final List<String> nodes;
    private final double amount;

    FlowPath(List<String> nodes, double amount) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.amount = amount;
    }

    public List<String> nodes() {
        return nodes;
    }

    public double amount() {
        return amount;
    }

    @Override
    public String toString() {
        return String.join(" -> ", nodes) + " : " + amount;
    }
}
