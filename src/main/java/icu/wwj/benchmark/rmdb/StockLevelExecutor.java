package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import icu.wwj.benchmark.rmdb.protocol.Statement;
import io.vertx.core.Future;

public class StockLevelExecutor implements TransactionExecutor {
    
    private final jTPCCRandom random;
    
    private final Statement stmtStockLevelSelectLow;
    
    public StockLevelExecutor(jTPCCRandom random, RMDBSession session) {
        this.random = random;
        stmtStockLevelSelectLow = session.statement(
                "SELECT COUNT(DISTINCT s_i_id) " +
                        "FROM stock " +
                        "WHERE s_w_id = ? AND s_quantity < ?");
    }
    
    @Override
    public Future<Boolean> execute(int warehouseId) {
        return process(new StockLevel(warehouseId, random.nextInt(10, 20)));
    }
    
    Future<Boolean> process(StockLevel stockLevel) {
        return stmtStockLevelSelectLow.execute(stockLevel.w_id, stockLevel.threshold).map(rows -> {
            Row row = rows.fetchOne();
            if (null == row) {
                return false;
            }
            stockLevel.low_stock = row.getInteger(0);
            return true;
        });
    }
}
