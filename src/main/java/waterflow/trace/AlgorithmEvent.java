package waterflow.trace;

/**
 * One observable step of a max-flow run.
 *
 * <p>Events carry a per-run sequence number starting at 0. A {@link TraceRecorder} receives them in
 * increasing sequence order, which is the order in which the algorithm performed the steps.</p>
 */
public interface AlgorithmEvent {

    enum Kind { PATH_FOUND, PHASE_STARTED, PUSH, RELABEL }

    /** @return position of this event in the run that produced it */
    long sequence();

    Kind kind();
}
