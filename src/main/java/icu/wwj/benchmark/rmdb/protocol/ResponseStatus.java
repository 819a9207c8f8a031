package icu.wwj.benchmark.rmdb.protocol;

public enum ResponseStatus {
    
    /**
     * The response carried a result grid, possibly without data rows.
     */
    ROWS,
    
    /**
     * The response was empty, began with {@code Error} or carried no grid. Treated as a successful empty result.
     */
    EMPTY,
    
    /**
     * The server aborted the statement.
     */
    ABORTED
}
