package icu.wwj.benchmark.rmdb.protocol;

public enum FailureKind {
    
    /**
     * The server rejected a statement.
     */
    ABORT,
    
    /**
     * The worker connection could not be established.
     */
    CONNECTION,
    
    /**
     * A record expected by the transaction is missing.
     */
    LOGIC,
    
    /**
     * Deadlock, lock wait or timeout.
     */
    CONTENTION,
    
    OTHER
}
