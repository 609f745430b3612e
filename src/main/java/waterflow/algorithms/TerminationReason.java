package waterflow.algorithms;

/**
 * Why a run stopped. Only {@link #CONVERGED} guarantees a maximum flow; the other two
 * still leave a valid (conserving, capacity-respecting) flow.
 */
public enum TerminationReason {
    CONVERGED,
    BUDGET_EXCEEDED,
    CANCELLED
}
