package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.ScriptedTransport;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static icu.wwj.benchmark.rmdb.NewOrderExecutorTest.await;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.grid;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.row;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DatabaseStatisticsTest {
    
    private Vertx vertx;
    
    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
    }
    
    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
    
    @Test
    void assertCountEveryTable() throws Exception {
        ScriptedTransport transport = new ScriptedTransport()
                .respond("SELECT COUNT(*) FROM warehouse", grid(row("COUNT(*)"), row(2)))
                .respond("SELECT COUNT(*) FROM history", "abort")
                .respond("SELECT COUNT(*) FROM stock", grid(row("COUNT(*)"), row(200000)));
        Map<String, Long> actual = await(new DatabaseStatistics(new RMDBSession(vertx, transport.factory(), "test")).collect());
        assertEquals(DatabaseStatistics.TABLES, new ArrayList<>(actual.keySet()));
        assertEquals(2L, actual.get("warehouse"));
        assertEquals(0L, actual.get("history"));
        assertEquals(0L, actual.get("district"));
        assertEquals(200000L, actual.get("stock"));
        assertEquals(9, transport.getStatements().size());
    }
}
