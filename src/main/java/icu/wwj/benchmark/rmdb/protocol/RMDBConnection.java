package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.core.net.NetSocket;
import io.vertx.core.parsetools.RecordParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * TCP transport. Requests and responses are both terminated by a NUL byte.
 */
@Slf4j
public final class RMDBConnection implements Transport {
    
    private static final Buffer TERMINATOR = Buffer.buffer(new byte[]{0});
    
    private final Vertx vertx;
    
    private final NetClient client;
    
    private final NetSocket socket;
    
    private final long requestTimeoutMillis;
    
    private Promise<String> pending;
    
    private long timeoutTimerId = -1L;
    
    private volatile boolean open = true;
    
    private RMDBConnection(Vertx vertx, NetClient client, NetSocket socket, long requestTimeoutMillis) {
        this.vertx = vertx;
        this.client = client;
        this.socket = socket;
        this.requestTimeoutMillis = requestTimeoutMillis;
        socket.handler(RecordParser.newDelimited(TERMINATOR, this::handleResponse));
        socket.closeHandler(__ -> handleClosed());
        socket.exceptionHandler(cause -> log.warn("Connection to {} failed", socket.remoteAddress(), cause));
    }
    
    public static TransportFactory factory(String host, int port, NetClientOptions options, long requestTimeoutMillis) {
        return vertx -> connect(vertx, host, port, options, requestTimeoutMillis);
    }
    
    public static Future<Transport> connect(Vertx vertx, String host, int port, NetClientOptions options, long requestTimeoutMillis) {
        NetClient client = vertx.createNetClient(options);
        return client.connect(port, host)
                .<Transport>map(socket -> new RMDBConnection(vertx, client, socket, requestTimeoutMillis))
                .onSuccess(__ -> log.debug("Connected to {}:{}", host, port))
                .onFailure(__ -> client.close());
    }
    
    @Override
    public Future<String> request(String statement) {
        if (!open) {
            return Future.failedFuture(new TransactionFailure(FailureKind.OTHER, "Connection already closed"));
        }
        if (null != pending) {
            return Future.failedFuture(new IllegalStateException("Another request is still pending on this connection"));
        }
        Promise<String> promise = Promise.promise();
        pending = promise;
        if (requestTimeoutMillis > 0L) {
            timeoutTimerId = vertx.setTimer(requestTimeoutMillis, __ -> handleTimeout(statement));
        }
        socket.write(Buffer.buffer(statement, StandardCharsets.UTF_8.name()).appendBuffer(TERMINATOR))
                .onFailure(this::failPending);
        return promise.future();
    }
    
    private void handleResponse(Buffer record) {
        Promise<String> promise = takePending();
        if (null == promise) {
            log.warn("Discarding unsolicited response of {} bytes", record.length());
            return;
        }
        promise.complete(record.toString(StandardCharsets.UTF_8));
    }
    
    private void handleTimeout(String statement) {
        timeoutTimerId = -1L;
        // A late response would be taken for the answer to the next request.
        close();
        failPending(new TransactionFailure(FailureKind.CONTENTION,
                "Request timed out after %d ms (timeout): %s".formatted(requestTimeoutMillis, abbreviate(statement))));
    }
    
    private void handleClosed() {
        boolean closedByPeer = open;
        open = false;
        failPending(new TransactionFailure(FailureKind.OTHER, "Connection closed by " + socket.remoteAddress()));
        if (closedByPeer) {
            client.close();
        }
    }
    
    private void failPending(Throwable cause) {
        Promise<String> promise = takePending();
        if (null != promise) {
            promise.fail(cause);
        }
    }
    
    private Promise<String> takePending() {
        if (timeoutTimerId >= 0L) {
            vertx.cancelTimer(timeoutTimerId);
            timeoutTimerId = -1L;
        }
        Promise<String> result = pending;
        pending = null;
        return result;
    }
    
    @Override
    public boolean isOpen() {
        return open;
    }
    
    @Override
    public Future<Void> close() {
        if (!open) {
            return Future.succeededFuture();
        }
        open = false;
        return socket.close().eventually(__ -> client.close());
    }
    
    static String abbreviate(String statement) {
        return statement.length() > 100 ? statement.substring(0, 100) + "..." : statement;
    }
}
