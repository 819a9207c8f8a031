package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.ScriptedTransport;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static icu.wwj.benchmark.rmdb.NewOrderExecutorTest.await;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.grid;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StockLevelExecutorTest {
    
    private Vertx vertx;
    
    private ScriptedTransport transport;
    
    private StockLevelExecutor executor;
    
    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        transport = new ScriptedTransport();
        executor = new StockLevelExecutor(new jTPCCRandom(9L), new RMDBSession(vertx, transport.factory(), "test"));
    }
    
    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    @Test
    void assertZeroCountIsSuccess() throws Exception {
        transport.respond("SELECT COUNT", grid(row("COUNT(DISTINCT s_i_id)"), row(0)));
        StockLevel stockLevel = new StockLevel(2, 15);
        assertTrue(await(executor.process(stockLevel)));
        assertEquals(0, stockLevel.low_stock);
        assertEquals(List.of("SELECT COUNT(DISTINCT s_i_id) FROM stock WHERE s_w_id = 2 AND s_quantity < 15;"), transport.getStatements());
    }
    
    @Test
    void assertNoRowIsFailure() throws Exception {
        assertFalse(await(executor.process(new StockLevel(1, 10))));
    }
    
    @Test
    void assertThresholdInRange() throws Exception {
        transport.respond("SELECT COUNT", grid(row("COUNT(DISTINCT s_i_id)"), row(4)));
        for (int i = 0; i < 20; i++) {
            assertTrue(await(executor.execute(1)));
        }
        for (String each : transport.getStatements()) {
            int threshold = Integer.parseInt(each.substring(each.lastIndexOf('<') + 1, each.length() - 1).trim());
            assertTrue(threshold >= 10 && threshold <= 20, each);
        }
    }
}
