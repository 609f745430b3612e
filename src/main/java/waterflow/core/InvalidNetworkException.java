package waterflow.core;

/**
 * Thrown when a network description is structurally invalid: missing or duplicate source/sink,
 * unknown endpoint, negative or non-finite capacity, self-loop, or a duplicate edge for the same
 * ordered pair. Always raised while the network is being built, never from inside an algorithm.
 */
public class InvalidNetworkException extends IllegalArgumentException {

    public InvalidNetworkException(String message) {
        super(message);
    }

    public InvalidNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
