package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

public final class Timers {
    
    private Timers() {
    }
    
    /**
     * Future completed after the delay, without blocking the calling context.
     *
     * @param vertx vertx
     * @param delayMillis delay, completes at once if not positive
     * @return future
     */
    public static Future<Void> delay(Vertx vertx, long delayMillis) {
        if (delayMillis <= 0L) {
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        vertx.setTimer(delayMillis, __ -> promise.complete());
        return promise.future();
    }
}
