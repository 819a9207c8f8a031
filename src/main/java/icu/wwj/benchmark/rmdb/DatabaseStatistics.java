package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row counts of the benchmark tables.
 */
@RequiredArgsConstructor
@Slf4j
public final class DatabaseStatistics {
    
    static final List<String> TABLES = List.of("warehouse", "district", "customer", "history", "new_orders", "orders", "order_line", "item", "stock");
    
    private final RMDBSession session;
    
    /**
     * Count the rows of every table in turn. A table whose count fails is reported with 0 rows.
     *
     * @return row count per table, in table order
     */
    public Future<Map<String, Long>> collect() {
        Map<String, Long> result = new LinkedHashMap<>(TABLES.size(), 1F);
        Future<Void> future = Future.succeededFuture();
        for (String each : TABLES) {
            future = future.compose(__ -> count(each).map(rowCount -> {
                result.put(each, rowCount);
                return null;
            }));
        }
        return future.map(result);
    }
    
    private Future<Long> count(String table) {
        return session.execute("SELECT COUNT(*) FROM " + table)
                .map(rows -> {
                    Row row = rows.fetchOne();
                    return null == row ? 0L : row.getLong(0);
                })
                .recover(cause -> {
                    log.warn("Failed to count rows of {}: {}", table, cause.getMessage());
                    return Future.succeededFuture(0L);
                });
    }
}
