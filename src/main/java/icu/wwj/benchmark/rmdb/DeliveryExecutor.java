package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.Configurations;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import icu.wwj.benchmark.rmdb.protocol.Statement;
import icu.wwj.benchmark.rmdb.protocol.TransactionFailure;
import io.vertx.core.Future;

import java.time.LocalDateTime;
import java.util.Arrays;

public class DeliveryExecutor implements TransactionExecutor {
    
    private final jTPCCRandom random;
    
    private final RMDBSession session;
    
    private final Statement stmtDeliveryBGSelectOldestNewOrder;
    
    private final Statement stmtDeliveryBGDeleteOldestNewOrder;
    
    private final Statement stmtDeliveryBGUpdateOrder;
    
    private final Statement stmtDeliveryBGUpdateOrderLine;
    
    private final Statement stmtDeliveryBGSelectOrder;
    
    private final Statement stmtDeliveryBGSelectSumOLAmount;
    
    private final Statement stmtDeliveryBGUpdateCustomer;
    
    public DeliveryExecutor(jTPCCRandom random, RMDBSession session) {
        this.random = random;
        this.session = session;
        stmtDeliveryBGSelectOldestNewOrder = session.statement(
                "SELECT MIN(no_o_id) " +
                        "FROM new_orders " +
                        "WHERE no_d_id = ? AND no_w_id = ?");
        stmtDeliveryBGDeleteOldestNewOrder = session.statement(
                "DELETE FROM new_orders " +
                        "WHERE no_o_id = ? AND no_d_id = ? AND no_w_id = ?");
        stmtDeliveryBGUpdateOrder = session.statement(
                "UPDATE orders " +
                        "SET o_carrier_id = ? " +
                        "WHERE o_id = ? AND o_d_id = ? AND o_w_id = ?");
        stmtDeliveryBGUpdateOrderLine = session.statement(
                "UPDATE order_line " +
                        "SET ol_delivery_d = ? " +
                        "WHERE ol_o_id = ? AND ol_d_id = ? AND ol_w_id = ?");
        stmtDeliveryBGSelectOrder = session.statement(
                "SELECT o_c_id " +
                        "FROM orders " +
                        "WHERE o_id = ? AND o_d_id = ? AND o_w_id = ?");
        stmtDeliveryBGSelectSumOLAmount = session.statement(
                "SELECT SUM(ol_amount) " +
                        "FROM order_line " +
                        "WHERE ol_o_id = ? AND ol_d_id = ? AND ol_w_id = ?");
        stmtDeliveryBGUpdateCustomer = session.statement(
                "UPDATE customer " +
                        "SET c_balance = c_balance+?, c_delivery_cnt = c_delivery_cnt+1 " +
                        "WHERE c_id = ? AND c_d_id = ? AND c_w_id = ?");
    }
    
    @Override
    public Future<Boolean> execute(int warehouseId) {
        return process(generateDelivery(warehouseId));
    }
    
    Delivery generateDelivery(int warehouseId) {
        Delivery delivery = new Delivery(warehouseId);
        delivery.o_carrier_id = random.nextInt(1, 10);
        Arrays.fill(delivery.delivered_o_id, -1);
        return delivery;
    }
    
    Future<Boolean> process(Delivery generated) {
        generated.ol_delivery_d = NewOrderExecutor.TIMESTAMP_FORMATTER.format(LocalDateTime.now());
        return session.begin().compose(transaction -> {
            Future<Delivery> future = Future.succeededFuture(generated);
            for (int d_id = 1; d_id <= Configurations.DISTRICTS_PER_WAREHOUSE; d_id++) {
                int districtId = d_id;
                future = future.compose(delivery -> handleDistrictId(delivery, districtId));
            }
            return transaction.complete(future);
        });
    }
    
    private Future<Delivery> handleDistrictId(Delivery delivery, int d_id) {
        return stmtDeliveryBGSelectOldestNewOrder.execute(d_id, delivery.w_id).compose(rows -> {
            Row row = rows.fetchOne();
            // No undelivered order for this DISTRICT, nothing to do.
            return null == row ? Future.succeededFuture(delivery) : handleOid(delivery, d_id, row.getInteger(0));
        });
    }
    
    /**
     * We found the oldest undelivered order for this DISTRICT.
     * Remove it from NEW_ORDER and process the rest of the DELIVERY_BG.
     */
    private Future<Delivery> handleOid(Delivery delivery, int d_id, int o_id) {
        return stmtDeliveryBGDeleteOldestNewOrder.execute(o_id, d_id, delivery.w_id)
                // Update the ORDER setting the o_carrier_id.
                .compose(__ -> stmtDeliveryBGUpdateOrder.execute(delivery.o_carrier_id, o_id, d_id, delivery.w_id))
                // Update ORDER_LINE setting the ol_delivery_d.
                .compose(__ -> stmtDeliveryBGUpdateOrderLine.execute(delivery.ol_delivery_d, o_id, d_id, delivery.w_id))
                // Get the o_c_id from the ORDER.
                .compose(__ -> stmtDeliveryBGSelectOrder.execute(o_id, d_id, delivery.w_id).map(rows -> {
                    Row row = rows.fetchOne();
                    if (null == row) {
                        throw TransactionFailure.missing("ORDER in DELIVERY_BG for O_W_ID=%d O_D_ID=%d O_ID=%d not found", delivery.w_id, d_id, o_id);
                    }
                    return row.getInteger(0);
                }))
                // Select the sum(ol_amount) from ORDER_LINE and update the CUSTOMER.
                .compose(o_c_id -> stmtDeliveryBGSelectSumOLAmount.execute(o_id, d_id, delivery.w_id).compose(rows -> {
                    Row row = rows.fetchOne();
                    if (null == row) {
                        throw TransactionFailure.missing("sum(OL_AMOUNT) for ORDER_LINEs with OL_W_ID=%d OL_D_ID=%d OL_O_ID=%d not found", delivery.w_id, d_id, o_id);
                    }
                    return stmtDeliveryBGUpdateCustomer.execute(row.getDouble(0), o_c_id, d_id, delivery.w_id);
                }))
                .map(__ -> {
                    delivery.delivered_o_id[d_id - 1] = o_id;
                    return delivery;
                });
    }
}
