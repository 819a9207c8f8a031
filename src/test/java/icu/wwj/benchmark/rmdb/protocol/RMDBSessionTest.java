package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.grid;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RMDBSessionTest {
    
    private Vertx vertx;
    
    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
    }
    
    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    static <T> T await(Future<T> future) throws ExecutionException, InterruptedException, TimeoutException {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    static Throwable awaitFailure(Future<?> future) {
        ExecutionException actual = assertThrows(ExecutionException.class, () -> await(future));
        return actual.getCause();
    }
    
    @Test
    void assertConnectLazily() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        ScriptedTransport transport = new ScriptedTransport().respond("SELECT", grid(row("w_tax"), row(0.08)));
        RMDBSession session = new RMDBSession(vertx, v -> {
            connects.incrementAndGet();
            return transport.factory().connect(v);
        }, "test");
        assertEquals(0, connects.get());
        assertFalse(session.isConnected());
        QueryResult actual = await(session.execute("SELECT w_tax FROM warehouse WHERE w_id = ?", 1));
        assertEquals(0.08, actual.fetchOne().getDouble(0));
        await(session.execute("SELECT w_tax FROM warehouse WHERE w_id = ?", 2));
        assertEquals(1, connects.get());
        assertTrue(session.isConnected());
        assertEquals(Arrays.asList("SELECT w_tax FROM warehouse WHERE w_id = 1;", "SELECT w_tax FROM warehouse WHERE w_id = 2;"), transport.getStatements());
    }
    
    @Test
    void assertConnectRetriedThreeTimes() {
        AtomicInteger connects = new AtomicInteger();
        RMDBSession session = new RMDBSession(vertx, v -> {
            connects.incrementAndGet();
            return Future.failedFuture("Connection refused");
        }, "test");
        Throwable actual = awaitFailure(session.execute("BEGIN"));
        assertEquals(RMDBSession.MAX_CONNECT_ATTEMPTS, connects.get());
        assertInstanceOf(TransactionFailure.class, actual);
        assertEquals(FailureKind.CONNECTION, TransactionFailure.kindOf(actual));
    }
    
    @Test
    void assertConnectSucceedsOnLastAttempt() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        ScriptedTransport transport = new ScriptedTransport();
        RMDBSession session = new RMDBSession(vertx, v -> connects.incrementAndGet() < 3 ? Future.failedFuture("Connection refused") : transport.factory().connect(v), "test");
        await(session.execute("BEGIN"));
        assertEquals(3, connects.get());
        assertEquals(Arrays.asList("BEGIN;"), transport.getStatements());
    }
    
    @Test
    void assertAbortFails() {
        ScriptedTransport transport = new ScriptedTransport().respond("UPDATE", "abort: write conflict\n");
        RMDBSession session = new RMDBSession(vertx, transport.factory(), "test");
        Throwable actual = awaitFailure(session.execute("UPDATE stock SET s_quantity = ? WHERE s_i_id = ?", 5, 1));
        assertEquals(FailureKind.ABORT, TransactionFailure.kindOf(actual));
        assertEquals("Query aborted: abort: write conflict", actual.getMessage());
    }
    
    @Test
    void assertErrorResponseIsEmptySuccess() throws Exception {
        ScriptedTransport transport = new ScriptedTransport().respond("SELECT", "Error: syntax");
        RMDBSession session = new RMDBSession(vertx, transport.factory(), "test");
        assertEquals(ResponseStatus.EMPTY, await(session.execute("SELECT 1")).getStatus());
    }
    
    @Test
    void assertReconnectAfterClose() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        ScriptedTransport transport = new ScriptedTransport();
        RMDBSession session = new RMDBSession(vertx, v -> {
            connects.incrementAndGet();
            return transport.factory().connect(v);
        }, "test");
        await(session.execute("BEGIN"));
        await(transport.close());
        assertFalse(session.isConnected());
        await(session.execute("COMMIT"));
        assertEquals(2, connects.get());
    }
    
    @Test
    void assertTransactionCommit() throws Exception {
        ScriptedTransport transport = new ScriptedTransport();
        RMDBSession session = new RMDBSession(vertx, transport.factory(), "test");
        boolean actual = await(session.begin().compose(transaction -> transaction.complete(session.execute("UPDATE district SET d_ytd = 1"))));
        assertTrue(actual);
        assertEquals(Arrays.asList("BEGIN;", "UPDATE district SET d_ytd = 1;", "COMMIT;"), transport.getStatements());
    }
    
    @Test
    void assertTransactionRollbackOnMissingRow() throws Exception {
        ScriptedTransport transport = new ScriptedTransport();
        RMDBSession session = new RMDBSession(vertx, transport.factory(), "test");
        boolean actual = await(session.begin().compose(transaction -> transaction.complete(
                Future.failedFuture(TransactionFailure.missing("ITEM with I_ID=%d not found", 7)))));
        assertFalse(actual);
        assertEquals(Arrays.asList("BEGIN;", "ROLLBACK;"), transport.getStatements());
    }
    
    @Test
    void assertTransactionRollbackAndPropagateOnAbortedCommit() {
        ScriptedTransport transport = new ScriptedTransport().respond("COMMIT", "abort");
        RMDBSession session = new RMDBSession(vertx, transport.factory(), "test");
        Throwable actual = awaitFailure(session.begin().compose(transaction -> transaction.complete(Future.succeededFuture())));
        assertEquals(FailureKind.ABORT, TransactionFailure.kindOf(actual));
        assertEquals(Arrays.asList("BEGIN;", "COMMIT;", "ROLLBACK;"), transport.getStatements());
    }
}
