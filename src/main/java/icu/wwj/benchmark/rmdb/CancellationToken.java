package icu.wwj.benchmark.rmdb;

/**
 * Set once from outside the terminals, read by them between attempts.
 */
public final class CancellationToken {
    
    private volatile boolean cancelled;
    
    public void cancel() {
        cancelled = true;
    }
    
    public boolean isCancelled() {
        return cancelled;
    }
}
