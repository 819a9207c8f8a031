package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class Transaction {
    
    private final RMDBSession session;
    
    Transaction(RMDBSession session) {
        this.session = session;
    }
    
    public Future<Void> commit() {
        return session.execute("COMMIT").mapEmpty();
    }
    
    public Future<Void> rollback() {
        return session.execute("ROLLBACK").mapEmpty();
    }
    
    /**
     * Commit after the work succeeded, roll back otherwise.
     * <p>
     * A {@link FailureKind#LOGIC} failure of the work ends in {@code false}; any other failure, including a failed
     * commit, is propagated after the rollback.
     *
     * @param work statements of the transaction
     * @return true if committed
     */
    public Future<Boolean> complete(Future<?> work) {
        return work.compose(__ -> commit()).compose(
                __ -> Future.succeededFuture(true),
                cause -> rollback().transform(rollback -> {
                    if (rollback.failed()) {
                        log.warn("Rollback after `{}` failed", cause.getMessage(), rollback.cause());
                    }
                    if (FailureKind.LOGIC == TransactionFailure.kindOf(cause)) {
                        log.debug("Rolled back: {}", cause.getMessage());
                        return Future.succeededFuture(false);
                    }
                    return Future.<Boolean>failedFuture(cause);
                }));
    }
}
