package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.FailureKind;
import icu.wwj.benchmark.rmdb.protocol.Timers;
import icu.wwj.benchmark.rmdb.protocol.TransactionFailure;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs one transaction with up to {@value #MAX_ATTEMPTS} attempts and turns the outcome into a {@link TransactionResult}.
 * <p>
 * The returned future never fails. Contention failures back off {@value #CONTENTION_BACKOFF_MILLIS} ms per attempt,
 * all others {@value #BACKOFF_MILLIS} ms per attempt. Connection failures are not retried.
 */
@Slf4j
public final class RetryPolicy {
    
    public static final int MAX_ATTEMPTS = 3;
    
    static final long BACKOFF_MILLIS = 100L;
    
    static final long CONTENTION_BACKOFF_MILLIS = 500L;
    
    static final long SLOW_TRANSACTION_MILLIS = 60_000L;
    
    private static final String[] CONTENTION_MARKERS = {"deadlock", "timeout", "lock"};
    
    private final Vertx vertx;
    
    private final int terminalId;
    
    private final CancellationToken cancellationToken;
    
    public RetryPolicy(Vertx vertx, int terminalId, CancellationToken cancellationToken) {
        this.vertx = vertx;
        this.terminalId = terminalId;
        this.cancellationToken = cancellationToken;
    }
    
    public static boolean isContention(Throwable cause) {
        if (FailureKind.CONTENTION == TransactionFailure.kindOf(cause)) {
            return true;
        }
        String message = String.valueOf(cause.getMessage()).toLowerCase(Locale.ROOT);
        for (String each : CONTENTION_MARKERS) {
            if (message.contains(each)) {
                return true;
            }
        }
        return false;
    }
    
    public static long backoffMillis(Throwable cause, int attempt) {
        return (isContention(cause) ? CONTENTION_BACKOFF_MILLIS : BACKOFF_MILLIS) * attempt;
    }
    
    public static boolean shouldRetry(Throwable cause, int attempt) {
        return attempt < MAX_ATTEMPTS && FailureKind.CONNECTION != TransactionFailure.kindOf(cause);
    }
    
    public Future<TransactionResult> execute(TPCCTransaction type, Supplier<Future<Boolean>> transaction) {
        return attempt(type, transaction, LocalDateTime.now(), System.nanoTime(), 1);
    }
    
    private Future<TransactionResult> attempt(TPCCTransaction type, Supplier<Future<Boolean>> transaction,
                                              LocalDateTime timestamp, long startNanoTime, int attempt) {
        Future<Boolean> future;
        try {
            future = transaction.get();
        } catch (final RuntimeException ex) {
            future = Future.failedFuture(ex);
        }
        return future.transform(ar -> {
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanoTime);
            if (elapsedMillis > SLOW_TRANSACTION_MILLIS) {
                log.warn("Terminal-{} {} took {} ms", terminalId, type.getDisplayName(), elapsedMillis);
            }
            if (ar.succeeded()) {
                if (attempt > 1) {
                    log.debug("Terminal-{} {} succeeded after {} attempts", terminalId, type.getDisplayName(), attempt);
                }
                boolean success = ar.result();
                return Future.succeededFuture(new TransactionResult(type, success, elapsedMillis, timestamp, terminalId, attempt,
                        success ? null : FailureKind.LOGIC));
            }
            Throwable cause = ar.cause();
            log.warn("Terminal-{} {} attempt {} failed: {}", terminalId, type.getDisplayName(), attempt, cause.getMessage());
            boolean contention = isContention(cause);
            if (contention) {
                log.info("Terminal-{} detected potential deadlock, will retry with longer delay", terminalId);
            }
            if (!shouldRetry(cause, attempt) || cancellationToken.isCancelled()) {
                log.error("Terminal-{} {} failed after {} attempts", terminalId, type.getDisplayName(), attempt, cause);
                return Future.succeededFuture(new TransactionResult(type, false, elapsedMillis, timestamp, terminalId, attempt,
                        TransactionFailure.kindOf(cause)));
            }
            return Timers.delay(vertx, backoffMillis(cause, attempt))
                    .compose(__ -> attempt(type, transaction, timestamp, startNanoTime, attempt + 1));
        });
    }
}
