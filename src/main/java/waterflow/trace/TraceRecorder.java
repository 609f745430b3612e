package waterflow.trace;

/**
 * Side channel receiving the events of a run in chronological order.
 *
 * <p>A recorder only observes. Algorithms call it after a step has been applied and never read
 * anything back, so a run produces the same result with any recorder attached, including
 * {@link #NO_OP}.</p>
 */
@FunctionalInterface
public interface TraceRecorder {

    /** Discards every event. Algorithms skip building events altogether when this recorder is attached. */
    TraceRecorder NO_OP = event -> { };

    void record(AlgorithmEvent event);
}
