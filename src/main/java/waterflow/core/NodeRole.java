package waterflow.core;

/**
 * Role of a node in a water network. Every network has exactly one {@link #SOURCE}
 * (reservoir / treatment plant) and exactly one {@link #SINK} (aggregated demand).
 */
public enum NodeRole {
    SOURCE,
    SINK,
    INTERMEDIATE
}
