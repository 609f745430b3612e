package waterflow.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every event in memory, in arrival order. Intended for one run at a time; not thread-safe.
 */
public final class RecordingTraceRecorder implements TraceRecorder {

    private final List<AlgorithmEvent> events = new ArrayList<>();

    @Override
    public void record(AlgorithmEvent event) {
        events.add(event);
    }

    /** @return snapshot of the events recorded so far */
    public List<AlgorithmEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
