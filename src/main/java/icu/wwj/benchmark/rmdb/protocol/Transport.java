package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;

/**
 * One request/response exchange at a time with the server.
 */
public interface Transport {
    
    /**
     * Send a fully substituted statement and receive the raw response text.
     *
     * @param statement statement text, already terminated
     * @return raw response
     */
    Future<String> request(String statement);
    
    boolean isOpen();
    
    Future<Void> close();
}
