package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;
import icu.wwj.benchmark.rmdb.config.Configurations;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import icu.wwj.benchmark.rmdb.protocol.Statement;
import icu.wwj.benchmark.rmdb.protocol.TransactionFailure;
import io.vertx.core.Future;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.stream.IntStream;

public class NewOrderExecutor implements TransactionExecutor {
    
    static final int UNDELIVERED_CARRIER_ID = -1;
    
    static final String UNDELIVERED_DELIVERY_D = "1970-01-01 00:00:00";
    
    static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    
    private final BenchmarkConfiguration configuration;
    
    private final jTPCCRandom random;
    
    private final RMDBSession session;
    
    private final Statement stmtNewOrderSelectDist;
    
    private final Statement stmtNewOrderUpdateDist;
    
    private final Statement stmtNewOrderSelectWhseCust;
    
    private final Statement stmtNewOrderInsertOrder;
    
    private final Statement stmtNewOrderInsertNewOrder;
    
    private final Statement stmtNewOrderSelectItem;
    
    private final Statement stmtNewOrderUpdateStock;
    
    private final Statement stmtNewOrderInsertOrderLine;
    
    public NewOrderExecutor(BenchmarkConfiguration configuration, jTPCCRandom random, RMDBSession session) {
        this.configuration = configuration;
        this.random = random;
        this.session = session;
        stmtNewOrderSelectDist = session.statement(
                "SELECT d_tax, d_next_o_id " +
                        "FROM district " +
                        "WHERE d_id = ? AND d_w_id = ?");
        stmtNewOrderUpdateDist = session.statement(
                "UPDATE district " +
                        "SET d_next_o_id = d_next_o_id+1 " +
                        "WHERE d_id = ? AND d_w_id = ?");
        stmtNewOrderSelectWhseCust = session.statement(
                "SELECT c_discount, c_last, c_credit, w_tax " +
                        "FROM customer, warehouse " +
                        "WHERE c_w_id = w_id AND c_d_id = ? AND c_id = ? AND w_id = ?");
        stmtNewOrderInsertOrder = session.statement(
                "INSERT INTO orders VALUES (?, ?, ?, ?, ?, ?, ?, ?)");
        stmtNewOrderInsertNewOrder = session.statement(
                "INSERT INTO new_orders VALUES (?, ?, ?)");
        stmtNewOrderSelectItem = session.statement(
                "SELECT i_price, i_name, i_data " +
                        "FROM item " +
                        "WHERE i_id = ?");
        stmtNewOrderUpdateStock = session.statement(
                "UPDATE stock " +
                        "SET s_quantity = ?, s_ytd = ?, s_order_cnt = ?, s_remote_cnt = ? " +
                        "WHERE s_i_id = ? AND s_w_id = ?");
        stmtNewOrderInsertOrderLine = session.statement(
                "INSERT INTO order_line VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
    }
    
    NewOrder generateNewOrder(int warehouse) {
        NewOrder newOrder = new NewOrder(warehouse, random.nextInt(1, Configurations.DISTRICTS_PER_WAREHOUSE), random.getCustomerID());
        // 2.4.1.3
        int o_ol_cnt = random.nextInt(5, 15);
        // 2.4.1.5
        for (int i = 0; i < o_ol_cnt; i++) {
            int supplyWarehouse = random.nextInt(1, 100) <= 99 ? warehouse : randomOtherWarehouse(warehouse);
            newOrder.addLine(random.getItemID(), supplyWarehouse, random.nextInt(1, 10));
        }
        return newOrder;
    }
    
    private int randomOtherWarehouse(int warehouse) {
        if (configuration.getWarehouses() < 2) {
            return warehouse;
        }
        int result = random.nextInt(1, configuration.getWarehouses() - 1);
        return result >= warehouse ? result + 1 : result;
    }
    
    @Override
    public Future<Boolean> execute(int warehouseId) {
        return process(generateNewOrder(warehouseId));
    }
    
    Future<Boolean> process(NewOrder newOrder) {
        newOrder.o_entry_d = TIMESTAMP_FORMATTER.format(LocalDateTime.now());
        /*
         * Stock rows are read and written back by the client, so two orders touching the same two items
         * in opposite order could deadlock. Processing the lines ordered by (ol_supply_w_id, ol_i_id)
         * keeps the lock order the same in every terminal.
         */
        int[] ol_seq = IntStream.range(0, newOrder.o_ol_cnt).boxed()
                .sorted(Comparator.<Integer>comparingInt(each -> newOrder.ol_supply_w_id[each]).thenComparingInt(each -> newOrder.ol_i_id[each]))
                .mapToInt(Integer::intValue).toArray();
        return session.begin().compose(transaction -> transaction.complete(Future.succeededFuture(newOrder)
                .compose(this::selectDistrict)
                // Update the DISTRICT bumping the D_NEXT_O_ID
                .compose(order -> stmtNewOrderUpdateDist.execute(order.d_id, order.w_id).map(order))
                .compose(this::selectWarehouseCustomer)
                // Insert the ORDER row
                .compose(order -> stmtNewOrderInsertOrder.execute(order.o_id, order.d_id, order.w_id, order.c_id, order.o_entry_d,
                        UNDELIVERED_CARRIER_ID, order.o_ol_cnt, order.o_all_local).map(order))
                // Insert the NEW_ORDER row
                .compose(order -> stmtNewOrderInsertNewOrder.execute(order.o_id, order.d_id, order.w_id).map(order))
                .compose(order -> {
                    Future<Void> orderLineFuture = Future.succeededFuture();
                    for (int i = 0; i < order.o_ol_cnt; i++) {
                        int ol_number = i + 1;
                        int seq = ol_seq[i];
                        orderLineFuture = orderLineFuture.compose(__ -> processItem(order, ol_number, seq));
                    }
                    return orderLineFuture.map(order);
                })
                .map(order -> {
                    order.total_amount = totalAmount(order);
                    return order;
                })));
    }
    
    private Future<NewOrder> selectDistrict(NewOrder newOrder) {
        return stmtNewOrderSelectDist.execute(newOrder.d_id, newOrder.w_id).map(rows -> {
            Row row = rows.fetchOne();
            if (null == row) {
                throw TransactionFailure.missing("District for W_ID=%d D_ID=%d not found", newOrder.w_id, newOrder.d_id);
            }
            newOrder.d_tax = row.getDouble(0);
            newOrder.o_id = row.getInteger(1);
            return newOrder;
        });
    }
    
    private Future<NewOrder> selectWarehouseCustomer(NewOrder newOrder) {
        return stmtNewOrderSelectWhseCust.execute(newOrder.d_id, newOrder.c_id, newOrder.w_id).map(rows -> {
            Row row = rows.fetchOne();
            if (null == row) {
                throw TransactionFailure.missing("Warehouse or Customer for W_ID=%d D_ID=%d C_ID=%d not found", newOrder.w_id, newOrder.d_id, newOrder.c_id);
            }
            newOrder.c_discount = row.getDouble(0);
            newOrder.c_last = row.getString(1);
            newOrder.c_credit = row.getString(2);
            newOrder.w_tax = row.getDouble(3);
            return newOrder;
        });
    }
    
    private Future<Void> processItem(NewOrder newOrder, int ol_number, int seq) {
        int i_id = newOrder.ol_i_id[seq];
        int supply_w_id = newOrder.ol_supply_w_id[seq];
        int quantity = newOrder.ol_quantity[seq];
        return stmtNewOrderSelectItem.execute(i_id).compose(itemRows -> {
            Row itemRow = itemRows.fetchOne();
            if (null == itemRow) {
                throw TransactionFailure.missing("ITEM with I_ID=%d not found", i_id);
            }
            newOrder.i_price[seq] = itemRow.getDouble(0);
            newOrder.i_name[seq] = itemRow.getString(1);
            String i_data = itemRow.getString(2);
            return session.execute(selectStockSQL(newOrder.d_id), i_id, supply_w_id).compose(stockRows -> {
                Row stockRow = stockRows.fetchOne();
                if (null == stockRow) {
                    throw TransactionFailure.missing("STOCK with S_W_ID=%d S_I_ID=%d not found", supply_w_id, i_id);
                }
                int s_quantity = stockRow.getInteger(0);
                String s_dist_info = stockRow.getString(1);
                int s_ytd = stockRow.getInteger(2) + quantity;
                int s_order_cnt = stockRow.getInteger(3) + 1;
                int s_remote_cnt = stockRow.getInteger(4) + (supply_w_id == newOrder.w_id ? 0 : 1);
                newOrder.s_quantity[seq] = depleteStock(s_quantity, quantity);
                newOrder.ol_amount[seq] = quantity * newOrder.i_price[seq];
                newOrder.brand_generic[seq] = i_data.contains("ORIGINAL") && stockRow.getString(5).contains("ORIGINAL") ? "B" : "G";
                return stmtNewOrderUpdateStock.execute(newOrder.s_quantity[seq], s_ytd, s_order_cnt, s_remote_cnt, i_id, supply_w_id)
                        .compose(__ -> stmtNewOrderInsertOrderLine.execute(
                                newOrder.o_id,
                                newOrder.d_id,
                                newOrder.w_id,
                                ol_number,
                                i_id,
                                supply_w_id,
                                UNDELIVERED_DELIVERY_D,
                                quantity,
                                newOrder.ol_amount[seq],
                                s_dist_info))
                        .mapEmpty();
            });
        });
    }
    
    private static String selectStockSQL(int d_id) {
        return "SELECT s_quantity, s_dist_%02d, s_ytd, s_order_cnt, s_remote_cnt, s_data ".formatted(d_id) +
                "FROM stock " +
                "WHERE s_i_id = ? AND s_w_id = ?";
    }
    
    /**
     * Stock quantity after an order line consumed some of it, replenished by 91 when it would fall below 10.
     *
     * @param s_quantity quantity before
     * @param ol_quantity ordered quantity
     * @return quantity after
     */
    static int depleteStock(int s_quantity, int ol_quantity) {
        return s_quantity >= ol_quantity + 10 ? s_quantity - ol_quantity : s_quantity - ol_quantity + 91;
    }
    
    static double totalAmount(NewOrder newOrder) {
        double sum = 0.0;
        for (int i = 0; i < newOrder.o_ol_cnt; i++) {
            sum += newOrder.ol_amount[i];
        }
        return sum * (1.0 - newOrder.c_discount) * (1.0 + newOrder.w_tax + newOrder.d_tax);
    }
}
