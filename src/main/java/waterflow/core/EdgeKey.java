package waterflow.core;

import java.util.Objects;

/**
 * Identity of a directed edge: the ordered pair (from, to).
 *
 * <p>Since a network holds at most one edge per ordered pair, the key identifies an edge in a
 * network and in every network derived from it by a scenario. The textual form is
 * {@code from,to}, which is also how a failed pipe is named on the command line.</p>
 */
public final class EdgeKey {

    private final String from;
    private final String to;

    public EdgeKey(String from, String to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public static EdgeKey of(String from, String to) {
        return new EdgeKey(from, to);
    }

    /**
     * Parses {@code "u,v"} (whitespace around either id is ignored).
     *
     * @throws IllegalArgumentException if the text does not contain exactly two non-empty ids
     */
    public static EdgeKey parse(String text) {
        if (text == null) throw new IllegalArgumentException("Edge key must not be null.");
        String[] parts = text.split(",", -1);
        if (parts.length != 2 || parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
            throw new IllegalArgumentException("Edge key must have the form 'u,v': " + text);
        }
        return new EdgeKey(parts[0].trim(), parts[1].trim());
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeKey)) return false;
        EdgeKey other = (EdgeKey) o;
        return from.equals(other.from) && to.equals(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + "," + to;
    }
}
