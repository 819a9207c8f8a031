package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.Configurations;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import icu.wwj.benchmark.rmdb.protocol.Statement;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Read-only, so it runs without a transaction bracket. The outcome depends on the order row alone; its order lines
 * are read for display only.
 */
@Slf4j
public class OrderStatusExecutor implements TransactionExecutor {
    
    private final jTPCCRandom random;
    
    private final Statement stmtOrderStatusSelectLastOrder;
    
    private final Statement stmtOrderStatusSelectOrderLine;
    
    public OrderStatusExecutor(jTPCCRandom random, RMDBSession session) {
        this.random = random;
        stmtOrderStatusSelectLastOrder = session.statement(
                "SELECT o_id, o_entry_d, o_carrier_id " +
                        "FROM orders " +
                        "WHERE o_w_id = ? AND o_d_id = ? AND o_c_id = ? " +
                        "ORDER BY o_id DESC LIMIT 1");
        stmtOrderStatusSelectOrderLine = session.statement(
                "SELECT ol_i_id, ol_supply_w_id, ol_quantity, ol_amount, ol_delivery_d " +
                        "FROM order_line " +
                        "WHERE ol_w_id = ? AND ol_d_id = ? AND ol_o_id = ?");
    }
    
    OrderStatus generateOrderStatus(int warehouseId) {
        return new OrderStatus(warehouseId, random.nextInt(1, Configurations.DISTRICTS_PER_WAREHOUSE), random.getCustomerID());
    }
    
    @Override
    public Future<Boolean> execute(int warehouseId) {
        return process(generateOrderStatus(warehouseId));
    }
    
    Future<Boolean> process(OrderStatus orderStatus) {
        return stmtOrderStatusSelectLastOrder.execute(orderStatus.w_id, orderStatus.d_id, orderStatus.c_id).compose(rows -> {
            Row row = rows.fetchOne();
            if (null == row) {
                return Future.succeededFuture(false);
            }
            orderStatus.o_id = row.getInteger(0);
            orderStatus.o_entry_d = row.getString(1);
            orderStatus.o_carrier_id = row.getInteger(2);
            return selectOrderLine(orderStatus).transform(ar -> {
                if (ar.failed()) {
                    log.warn("Failed to read order lines of order {} in district {} of warehouse {}: {}",
                            orderStatus.o_id, orderStatus.d_id, orderStatus.w_id, ar.cause().getMessage());
                }
                return Future.succeededFuture(true);
            });
        });
    }
    
    private Future<Void> selectOrderLine(OrderStatus orderStatus) {
        return stmtOrderStatusSelectOrderLine.execute(orderStatus.w_id, orderStatus.d_id, orderStatus.o_id).map(rows -> {
            List<Row> lines = rows.fetchMany(orderStatus.ol_i_id.length);
            int ol_idx = 0;
            for (Row each : lines) {
                orderStatus.ol_i_id[ol_idx] = each.getInteger(0);
                orderStatus.ol_supply_w_id[ol_idx] = each.getInteger(1);
                orderStatus.ol_quantity[ol_idx] = each.getInteger(2);
                orderStatus.ol_amount[ol_idx] = each.getDouble(3);
                orderStatus.ol_delivery_d[ol_idx] = each.getString(4);
                ol_idx++;
            }
            orderStatus.ol_cnt = ol_idx;
            return null;
        });
    }
}
