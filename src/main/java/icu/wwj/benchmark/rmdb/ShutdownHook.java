package icu.wwj.benchmark.rmdb;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Turns a user interrupt into a cancellation. Waits a bounded time for the running command to report, then ends the
 * process with exit code 0. Does nothing once the command has finished on its own.
 */
@Slf4j
public final class ShutdownHook implements Runnable {
    
    private final CancellationToken cancellationToken;
    
    private final long waitMillis;
    
    private final IntConsumer halt;
    
    private final CountDownLatch finished = new CountDownLatch(1);
    
    private volatile boolean completed;
    
    public ShutdownHook(CancellationToken cancellationToken, long waitMillis, IntConsumer halt) {
        this.cancellationToken = cancellationToken;
        this.waitMillis = waitMillis;
        this.halt = halt;
    }
    
    /**
     * Register a hook that halts the JVM.
     */
    public static ShutdownHook install(CancellationToken cancellationToken, long waitMillis) {
        ShutdownHook result = new ShutdownHook(cancellationToken, waitMillis, status -> Runtime.getRuntime().halt(status));
        Runtime.getRuntime().addShutdownHook(new Thread(result, "tpcc-shutdown"));
        return result;
    }
    
    /**
     * Mark the command as done. A normal completion makes the hook a no-op, a cancelled one releases the waiting hook.
     */
    public void done() {
        completed = !cancellationToken.isCancelled();
        finished.countDown();
    }
    
    @Override
    public void run() {
        if (completed) {
            return;
        }
        log.info("Operation cancelled by user");
        cancellationToken.cancel();
        try {
            if (!finished.await(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Command did not stop within {} ms", waitMillis);
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        halt.accept(0);
    }
}
