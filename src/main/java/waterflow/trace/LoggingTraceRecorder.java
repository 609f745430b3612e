package waterflow.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event to an SLF4J logger at DEBUG level.
 */
public final class LoggingTraceRecorder implements TraceRecorder {

    private final Logger logger;

    public LoggingTraceRecorder() {
        this(LoggerFactory.getLogger(LoggingTraceRecorder.class));
    }

    public LoggingTraceRecorder(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void record(AlgorithmEvent event) {
        logger.debug("{}", event);
    }
}
