package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;
import icu.wwj.benchmark.rmdb.protocol.FailureKind;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.ScriptedTransport;
import icu.wwj.benchmark.rmdb.protocol.TransactionFailure;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.grid;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewOrderExecutorTest {
    
    private Vertx vertx;
    
    private ScriptedTransport transport;
    
    private NewOrderExecutor executor;
    
    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        transport = new ScriptedTransport()
                .respond("SELECT d_tax, d_next_o_id", grid(row("d_tax", "d_next_o_id"), row(0.05, 3001)))
                .respond("SELECT c_discount", grid(row("c_discount", "c_last", "c_credit", "w_tax"), row(0.10, "BARBARBAR", "GC", 0.08)))
                .respond("SELECT i_price", grid(row("i_price", "i_name", "i_data"), row("10.00", "widget", "plain")))
                .respond("SELECT s_quantity", grid(row("s_quantity", "s_dist_01", "s_ytd", "s_order_cnt", "s_remote_cnt", "s_data"),
                        row(50, "dist-info-01", 0, 0, 0, "ORIGINAL")));
        executor = new NewOrderExecutor(new BenchmarkConfiguration(new Properties()), new jTPCCRandom(7L), new RMDBSession(vertx, transport.factory(), "test"));
    }
    
    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    private static NewOrder threeLocalLines() {
        NewOrder result = new NewOrder(1, 1, 1);
        result.addLine(101, 1, 5);
        result.addLine(102, 1, 5);
        result.addLine(103, 1, 5);
        return result;
    }
    
    @Test
    void assertCommitNewOrder() throws Exception {
        NewOrder newOrder = threeLocalLines();
        assertTrue(await(executor.process(newOrder)));
        assertEquals(3001, newOrder.o_id);
        assertEquals(1, newOrder.o_all_local);
        for (int i = 0; i < 3; i++) {
            assertEquals(45, newOrder.s_quantity[i]);
        }
        assertEquals(152.55, newOrder.total_amount, 0.005);
        assertEquals("BEGIN;", transport.getStatements().get(0));
        assertEquals("UPDATE district SET d_next_o_id = d_next_o_id+1 WHERE d_id = 1 AND d_w_id = 1;",
                transport.statementsStartingWith("UPDATE district").get(0));
        List<String> orders = transport.statementsStartingWith("INSERT INTO orders");
        assertEquals(1, orders.size());
        assertTrue(orders.get(0).startsWith("INSERT INTO orders VALUES (3001, 1, 1, 1, '"));
        assertTrue(orders.get(0).endsWith("', -1, 3, 1);"));
        assertEquals(List.of("INSERT INTO new_orders VALUES (3001, 1, 1);"), transport.statementsStartingWith("INSERT INTO new_orders"));
        assertEquals("UPDATE stock SET s_quantity = 45, s_ytd = 5, s_order_cnt = 1, s_remote_cnt = 0 WHERE s_i_id = 101 AND s_w_id = 1;",
                transport.statementsStartingWith("UPDATE stock").get(0));
        List<String> orderLines = transport.statementsStartingWith("INSERT INTO order_line");
        assertEquals(3, orderLines.size());
        assertEquals("INSERT INTO order_line VALUES (3001, 1, 1, 1, 101, 1, '1970-01-01 00:00:00', 5, 50.0, 'dist-info-01');", orderLines.get(0));
        assertEquals("COMMIT;", transport.getStatements().get(transport.getStatements().size() - 1));
        assertEquals("G", newOrder.brand_generic[0]);
    }
    
    @Test
    void assertLinesProcessedInSupplyWarehouseAndItemOrder() throws Exception {
        NewOrder newOrder = new NewOrder(2, 1, 1);
        newOrder.addLine(300, 2, 1);
        newOrder.addLine(100, 2, 1);
        newOrder.addLine(200, 1, 1);
        assertTrue(await(executor.process(newOrder)));
        assertEquals(0, newOrder.o_all_local);
        List<String> orderLines = transport.statementsStartingWith("INSERT INTO order_line");
        assertTrue(orderLines.get(0).startsWith("INSERT INTO order_line VALUES (3001, 1, 2, 1, 200, 1, "));
        assertTrue(orderLines.get(1).startsWith("INSERT INTO order_line VALUES (3001, 1, 2, 2, 100, 2, "));
        assertTrue(orderLines.get(2).startsWith("INSERT INTO order_line VALUES (3001, 1, 2, 3, 300, 2, "));
        assertEquals("UPDATE stock SET s_quantity = 49, s_ytd = 1, s_order_cnt = 1, s_remote_cnt = 1 WHERE s_i_id = 200 AND s_w_id = 1;",
                transport.statementsStartingWith("UPDATE stock").get(0));
    }
    
    @Test
    void assertMissingItemRollsBack() throws Exception {
        transport.respond("SELECT i_price", grid(row("i_price", "i_name", "i_data")));
        assertFalse(await(executor.process(threeLocalLines())));
        List<String> statements = transport.getStatements();
        assertEquals("ROLLBACK;", statements.get(statements.size() - 1));
        assertTrue(transport.statementsStartingWith("COMMIT").isEmpty());
        assertTrue(transport.statementsStartingWith("INSERT INTO order_line").isEmpty());
    }
    
    @Test
    void assertAbortRollsBackAndFails() {
        transport.respond("UPDATE stock", "abort");
        ExecutionException actual = assertThrows(ExecutionException.class, () -> await(executor.process(threeLocalLines())));
        assertEquals(FailureKind.ABORT, TransactionFailure.kindOf(actual.getCause()));
        List<String> statements = transport.getStatements();
        assertEquals("ROLLBACK;", statements.get(statements.size() - 1));
    }
    
    @Test
    void assertDepleteStock() {
        assertEquals(91, NewOrderExecutor.depleteStock(10, 10));
        assertEquals(45, NewOrderExecutor.depleteStock(50, 5));
        assertEquals(10, NewOrderExecutor.depleteStock(20, 10));
        for (int q = 10; q <= 100; q++) {
            for (int r = 1; r <= 10; r++) {
                int actual = NewOrderExecutor.depleteStock(q, r);
                assertEquals(q >= r + 10 ? q - r : q - r + 91, actual);
                assertTrue(actual >= 0 && actual <= 100, "Q=" + q + " R=" + r);
            }
        }
    }
    
    @Test
    void assertGenerateNewOrder() {
        NewOrder actual = executor.generateNewOrder(1);
        assertTrue(actual.o_ol_cnt >= 5 && actual.o_ol_cnt <= 15);
        assertTrue(actual.d_id >= 1 && actual.d_id <= 10);
        assertTrue(actual.c_id >= 1 && actual.c_id <= 3000);
        for (int i = 0; i < actual.o_ol_cnt; i++) {
            assertEquals(1, actual.ol_supply_w_id[i]);
            assertTrue(actual.ol_i_id[i] >= 1 && actual.ol_i_id[i] <= 100000);
            assertTrue(actual.ol_quantity[i] >= 1 && actual.ol_quantity[i] <= 10);
        }
        assertEquals(1, actual.o_all_local);
    }
}
