package com.knowledge.importer.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link GraphConnection} backed by the JFalkorDB client.
 *
 * <p>Parameters are rendered into the query text as Cypher literals. Strings are escaped,
 * {@code float[]} values become {@code vecf32([...])} vectors, collections become lists and
 * maps become map literals with back-quoted keys.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String rendered = render(query, params);
        log.debug("falkordb.execute query={}", rendered);
        graph.query(rendered);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String rendered = render(query, params);
        log.debug("falkordb.query query={}", rendered);

        ResultSet resultSet = graph.query(rendered);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("falkordb.unreachable graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB driver", e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }

    /**
     * Substitutes placeholders in a single pass, so values that contain {@code $} are never re-expanded.
     */
    static String render(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder out = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? literal(params.get(name)) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            InputSanitizer.sanitizeForCypher(s);
            return quote(s);
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof float[] vector) {
            StringBuilder sb = new StringBuilder("vecf32([");
            for (int i = 0; i < vector.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(vector[i]);
            }
            return sb.append("])").toString();
        }
        if (value instanceof Collection<?> values) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object element : values) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(literal(element));
                first = false;
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append('`').append(String.valueOf(entry.getKey()).replace("`", "``")).append("`: ")
                        .append(literal(entry.getValue()));
                first = false;
            }
            return sb.append('}').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
