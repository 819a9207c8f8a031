package icu.wwj.benchmark.rmdb.protocol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Buffered outcome of one statement. Rows are consumed once and in order.
 */
public final class QueryResult {
    
    private final ResponseStatus status;
    
    private final String response;
    
    private final List<String> columnNames;
    
    private final int rowCount;
    
    private final Deque<Row> buffered;
    
    private QueryResult(ResponseStatus status, String response, List<String> columnNames, List<Row> rows) {
        this.status = status;
        this.response = response;
        this.columnNames = columnNames;
        rowCount = rows.size();
        buffered = new ArrayDeque<>(rows);
    }
    
    public static QueryResult empty() {
        return new QueryResult(ResponseStatus.EMPTY, "", Collections.emptyList(), Collections.emptyList());
    }
    
    public static QueryResult aborted(String response) {
        return new QueryResult(ResponseStatus.ABORTED, response, Collections.emptyList(), Collections.emptyList());
    }
    
    public static QueryResult rows(List<String> columnNames, List<Row> rows) {
        return new QueryResult(ResponseStatus.ROWS, "", columnNames, rows);
    }
    
    public ResponseStatus getStatus() {
        return status;
    }
    
    public boolean isAborted() {
        return ResponseStatus.ABORTED == status;
    }
    
    /**
     * Raw server text, kept for aborted statements only.
     */
    public String getResponse() {
        return response;
    }
    
    public List<String> getColumnNames() {
        return columnNames;
    }
    
    /**
     * Number of rows parsed from the response, not affected by fetching.
     */
    public int getRowCount() {
        return rowCount;
    }
    
    public boolean hasNext() {
        return !buffered.isEmpty();
    }
    
    /**
     * Remove and return the first buffered row.
     *
     * @return next row, or null once drained
     */
    public Row fetchOne() {
        return buffered.pollFirst();
    }
    
    public List<Row> fetchMany(int size) {
        List<Row> result = new ArrayList<>(Math.min(size, buffered.size()));
        while (result.size() < size && !buffered.isEmpty()) {
            result.add(buffered.pollFirst());
        }
        return result;
    }
    
    public List<Row> fetchAll() {
        List<Row> result = new ArrayList<>(buffered);
        buffered.clear();
        return result;
    }
}
