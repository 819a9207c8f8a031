package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Logical connection of one worker.
 * <p>
 * The underlying transport is established on the first statement, not on construction, and re-established on the
 * next statement once it has been lost. Establishment is tried {@value #MAX_CONNECT_ATTEMPTS} times with a linear
 * backoff; after that every statement fails with {@link FailureKind#CONNECTION}. A session must only be used from
 * the context of its owner.
 */
@Slf4j
public final class RMDBSession {
    
    public static final int MAX_CONNECT_ATTEMPTS = 3;
    
    public static final long CONNECT_BACKOFF_MILLIS = 100L;
    
    private static final long SLOW_STATEMENT_MILLIS = 10_000L;
    
    private final Vertx vertx;
    
    private final TransportFactory transportFactory;
    
    private final String name;
    
    private Transport transport;
    
    public RMDBSession(Vertx vertx, TransportFactory transportFactory, String name) {
        this.vertx = vertx;
        this.transportFactory = transportFactory;
        this.name = name;
    }
    
    public Statement statement(String template) {
        return new Statement(this, template);
    }
    
    public Future<QueryResult> execute(String template, Object... params) {
        String statement = StatementFormatter.format(template, params);
        return transport().compose(connected -> send(connected, statement));
    }
    
    public Future<Transaction> begin() {
        return execute("BEGIN").map(__ -> new Transaction(this));
    }
    
    public boolean isConnected() {
        return null != transport && transport.isOpen();
    }
    
    public Future<Void> close() {
        if (null == transport) {
            return Future.succeededFuture();
        }
        Transport closing = transport;
        transport = null;
        return closing.close().onSuccess(__ -> log.info("{} connection closed", name));
    }
    
    private Future<Transport> transport() {
        if (isConnected()) {
            return Future.succeededFuture(transport);
        }
        return connect(1).onSuccess(connected -> {
            transport = connected;
            log.info("{} connected", name);
        });
    }
    
    private Future<Transport> connect(int attempt) {
        return transportFactory.connect(vertx).recover(cause -> {
            if (attempt >= MAX_CONNECT_ATTEMPTS) {
                log.error("{} failed to connect after {} attempts", name, attempt, cause);
                return Future.failedFuture(new TransactionFailure(FailureKind.CONNECTION,
                        "Failed to connect after %d attempts: %s".formatted(attempt, cause.getMessage()), cause));
            }
            log.warn("{} failed to connect (attempt {}/{}): {}", name, attempt, MAX_CONNECT_ATTEMPTS, cause.getMessage());
            return Timers.delay(vertx, CONNECT_BACKOFF_MILLIS * attempt).compose(__ -> connect(attempt + 1));
        });
    }
    
    private Future<QueryResult> send(Transport connected, String statement) {
        if (log.isDebugEnabled()) {
            log.debug("{} executing: {}", name, RMDBConnection.abbreviate(statement));
        }
        long startNanoTime = System.nanoTime();
        return connected.request(statement).compose(response -> {
            long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanoTime);
            if (tookMillis > SLOW_STATEMENT_MILLIS) {
                log.warn("Slow statement took {} ms: {}", tookMillis, RMDBConnection.abbreviate(statement));
            }
            QueryResult result = ResponseParser.parse(response);
            if (result.isAborted()) {
                return Future.failedFuture(new TransactionFailure(FailureKind.ABORT, "Query aborted: " + result.getResponse().strip()));
            }
            return Future.succeededFuture(result);
        });
    }
}
