package waterflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a water network from an edge list in CSV form.
 *
 * <p>Format (one pipe per line, header required):
 * <pre>
 *   u,v,capacity_mld
 *   S,J1,120
 *   J1,T,80
 * </pre>
 * Columns may appear in any order and extra columns are ignored. Fields may be separated by commas or
 * tabs. Empty lines and lines starting with {@code #} are skipped. Node ids are taken from the
 * {@code u}/{@code v} columns; the configured source and sink ids receive their roles and every other id
 * becomes an intermediate junction.</p>
 */
public final class NetworkLoader {

    private static final Logger log = LoggerFactory.getLogger(NetworkLoader.class);

    public static final String DEFAULT_SOURCE = "S";
    public static final String DEFAULT_SINK = "T";

    private static final String COL_FROM = "u";
    private static final String COL_TO = "v";
    private static final String COL_CAPACITY = "capacity_mld";

    private NetworkLoader() {
    }

    public static FlowNetwork load(Path file) throws IOException {
        return load(file, DEFAULT_SOURCE, DEFAULT_SINK);
    }

    /**
     * @throws IOException             if the file cannot be read
     * @throws InvalidNetworkException if the content is malformed or describes an invalid network
     */
    public static FlowNetwork load(Path file, String sourceId, String sinkId) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            FlowNetwork g = parse(in, sourceId, sinkId);
            log.info("Loaded {} from {}", g, file);
            return g;
        }
    }

    /**
     * Parses an edge list from {@code in}. The reader is consumed but not closed.
     */
    public static FlowNetwork parse(Reader in, String sourceId, String sinkId) throws IOException {
        BufferedReader br = (in instanceof BufferedReader) ? (BufferedReader) in : new BufferedReader(in);

        FlowNetwork.Builder b = FlowNetwork.builder();
        b.source(sourceId);
        b.sink(sinkId);

        int colFrom = -1, colTo = -1, colCap = -1;
        boolean haveHeader = false;
        int lineNo = 0;
        int rows = 0;

        String line;
        while ((line = br.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            String[] fields = trimmed.split("[,\t]", -1);

            if (!haveHeader) {
                for (int i = 0; i < fields.length; i++) {
                    String name = fields[i].trim().toLowerCase(Locale.ROOT);
                    if (name.equals(COL_FROM)) colFrom = i;
                    else if (name.equals(COL_TO)) colTo = i;
                    else if (name.equals(COL_CAPACITY)) colCap = i;
                }
                if (colFrom < 0 || colTo < 0 || colCap < 0) {
                    throw new InvalidNetworkException("Line " + lineNo + ": header must contain columns "
                            + COL_FROM + ", " + COL_TO + ", " + COL_CAPACITY);
                }
                haveHeader = true;
                continue;
            }

            int needed = Math.max(colFrom, Math.max(colTo, colCap));
            if (fields.length <= needed) {
                throw new InvalidNetworkException("Line " + lineNo + ": expected at least " + (needed + 1)
                        + " fields, got " + fields.length);
            }

            String u = fields[colFrom].trim();
            String v = fields[colTo].trim();
            if (u.isEmpty() || v.isEmpty()) {
                throw new InvalidNetworkException("Line " + lineNo + ": empty node id");
            }

            double cap;
            try {
                cap = Double.parseDouble(fields[colCap].trim());
            } catch (NumberFormatException ex) {
                throw new InvalidNetworkException("Line " + lineNo + ": cannot parse capacity '"
                        + fields[colCap].trim() + "'", ex);
            }

            if (!b.hasNode(u)) b.node(u);
            if (!b.hasNode(v)) b.node(v);
            b.edge(u, v, cap);
            rows++;
        }

        if (!haveHeader) throw new InvalidNetworkException("Empty network file (no header).");
        log.debug("Parsed {} edge rows", rows);
        return b.build();
    }
}
