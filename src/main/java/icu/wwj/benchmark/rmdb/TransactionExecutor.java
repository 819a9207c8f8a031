package icu.wwj.benchmark.rmdb;

import io.vertx.core.Future;

public interface TransactionExecutor {
    
    /**
     * Generate and run one transaction of this profile.
     *
     * @param warehouseId home warehouse of the terminal
     * @return whether the transaction succeeded, failed future for failures worth a retry
     */
    Future<Boolean> execute(int warehouseId);
}
