package icu.wwj.benchmark.rmdb.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parser of the pipe-delimited text responses of the server.
 * <pre>
 * +------------------+
 * |  d_tax | d_next_o_id |
 * +------------------+
 * |   0.05 |        3001 |
 * +------------------+
 * </pre>
 * The first line beginning with the delimiter is the header, every later one is a data row. Fields are trimmed and
 * empty fields are dropped, so a row whose field count differs from the header is discarded.
 */
public final class ResponseParser {
    
    public static final String ABORT_PREFIX = "abort";
    
    public static final String ERROR_PREFIX = "Error";
    
    public static final char DELIMITER = '|';
    
    private ResponseParser() {
    }
    
    public static QueryResult parse(String response) {
        if (null == response || response.isEmpty() || response.startsWith(ERROR_PREFIX)) {
            return QueryResult.empty();
        }
        if (response.startsWith(ABORT_PREFIX)) {
            return QueryResult.aborted(response);
        }
        List<String> columnNames = null;
        List<Row> rows = new ArrayList<>();
        for (String line : response.strip().split("\n")) {
            if (line.isEmpty() || DELIMITER != line.charAt(0)) {
                continue;
            }
            List<String> fields = splitFields(line);
            if (null == columnNames) {
                columnNames = Collections.unmodifiableList(fields);
                continue;
            }
            if (fields.size() == columnNames.size()) {
                rows.add(new Row(columnNames, fields));
            }
        }
        return null == columnNames ? QueryResult.empty() : QueryResult.rows(columnNames, rows);
    }
    
    static List<String> splitFields(String line) {
        List<String> result = new ArrayList<>();
        int start = 0;
        while (start <= line.length()) {
            int end = line.indexOf(DELIMITER, start);
            if (end < 0) {
                end = line.length();
            }
            String field = line.substring(start, end).strip();
            if (!field.isEmpty()) {
                result.add(field);
            }
            start = end + 1;
        }
        return result;
    }
}
